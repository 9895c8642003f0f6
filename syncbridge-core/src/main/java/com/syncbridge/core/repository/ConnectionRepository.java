package com.syncbridge.core.repository;

import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.Connection.ConnectionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for tenant connections.
 */
@Repository
public interface ConnectionRepository extends JpaRepository<Connection, UUID> {

    Optional<Connection> findByTenantIdAndProviderSlugAndExternalId(UUID tenantId, String providerSlug, String externalId);

    Optional<Connection> findByIdAndTenantIdAndProviderSlug(UUID id, UUID tenantId, String providerSlug);

    List<Connection> findByTenantIdAndProviderSlugAndStatusOrderByCreatedAtAsc(
            UUID tenantId, String providerSlug, ConnectionStatus status);

    /**
     * Connections whose access token expires before {@code threshold} and can be refreshed.
     */
    @Query("""
            SELECT c FROM Connection c
            WHERE c.status = :status
              AND c.refreshTokenCiphertext IS NOT NULL
              AND c.expiresAt IS NOT NULL
              AND c.expiresAt <= :threshold
            ORDER BY c.expiresAt ASC
            """)
    List<Connection> findRefreshCandidates(@Param("status") ConnectionStatus status,
                                           @Param("threshold") Instant threshold);

    /**
     * Stores rotated credentials. Touches only the token columns so concurrent cursor and
     * scheduling writes to {@code metadata} are not overwritten.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Connection c
            SET c.accessTokenCiphertext = :accessToken,
                c.refreshTokenCiphertext = :refreshToken,
                c.expiresAt = :expiresAt,
                c.updatedAt = :now
            WHERE c.id = :id
            """)
    int updateTokens(@Param("id") UUID id,
                     @Param("accessToken") byte[] accessToken,
                     @Param("refreshToken") byte[] refreshToken,
                     @Param("expiresAt") Instant expiresAt,
                     @Param("now") Instant now);

    /**
     * Same as {@link #updateTokens} but keeps the stored refresh token.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Connection c
            SET c.accessTokenCiphertext = :accessToken,
                c.expiresAt = :expiresAt,
                c.updatedAt = :now
            WHERE c.id = :id
            """)
    int updateAccessToken(@Param("id") UUID id,
                          @Param("accessToken") byte[] accessToken,
                          @Param("expiresAt") Instant expiresAt,
                          @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Connection c SET c.status = :status, c.updatedAt = :now WHERE c.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") ConnectionStatus status, @Param("now") Instant now);
}
