package com.syncbridge.api.security;

import com.syncbridge.api.config.SyncBridgeProperties;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

/**
 * Token Encryption Service - AES-256-GCM encryption of provider credentials at rest.
 *
 * Stored form is {@code IV (12 bytes) || ciphertext+tag}. The tenant and provider are bound
 * as associated data, so a ciphertext copied onto another connection's row fails to decrypt.
 */
@Service
public class TokenEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int AES_KEY_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey key;

    public TokenEncryptionService(SyncBridgeProperties properties) {
        this.key = parseKey(properties.getEncryption().getKey());
    }

    /**
     * Encrypt a token for one connection.
     *
     * @param plaintext Token to encrypt
     * @param tenantId  Owning tenant, bound as associated data
     * @param provider  Provider name, bound as associated data
     * @return IV followed by ciphertext
     */
    public byte[] encrypt(String plaintext, UUID tenantId, String provider) {
        if (plaintext == null) {
            throw new EncryptionException("Cannot encrypt a null token", null);
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(associatedData(tenantId, provider));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            return ByteBuffer.allocate(iv.length + ciphertext.length)
                .put(iv)
                .put(ciphertext)
                .array();
        } catch (Exception e) {
            throw new EncryptionException("Encryption failed", e);
        }
    }

    /**
     * Decrypt a token previously produced by {@link #encrypt}.
     *
     * @throws DecryptionException when the data was tampered with or belongs to another connection
     */
    public String decrypt(byte[] encryptedData, UUID tenantId, String provider) {
        if (encryptedData == null || encryptedData.length <= GCM_IV_LENGTH) {
            throw new DecryptionException("Ciphertext is missing or truncated", null);
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(encryptedData);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(associatedData(tenantId, provider));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    private static byte[] associatedData(UUID tenantId, String provider) {
        return (tenantId + "|" + provider).getBytes(StandardCharsets.UTF_8);
    }

    static SecretKey parseKey(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalStateException("syncbridge.encryption.key is not configured");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("syncbridge.encryption.key is not valid base64", e);
        }
        if (raw.length != AES_KEY_BYTES) {
            throw new IllegalStateException("syncbridge.encryption.key must decode to 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }

    public static class EncryptionException extends RuntimeException {
        public EncryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class DecryptionException extends RuntimeException {
        public DecryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
