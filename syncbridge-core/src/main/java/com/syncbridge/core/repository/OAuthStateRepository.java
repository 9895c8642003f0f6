package com.syncbridge.core.repository;

import com.syncbridge.core.domain.OAuthState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OAuthStateRepository extends JpaRepository<OAuthState, UUID> {

    Optional<OAuthState> findByState(String state);

    /**
     * Removes states that can no longer be consumed.
     */
    @Modifying
    @Query("DELETE FROM OAuthState s WHERE s.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
