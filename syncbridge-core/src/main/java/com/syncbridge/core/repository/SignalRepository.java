package com.syncbridge.core.repository;

import com.syncbridge.core.domain.Signal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SignalRepository extends JpaRepository<Signal, UUID> {

    List<Signal> findByConnectionIdOrderByOccurredAtAsc(UUID connectionId);

    long countByConnectionId(UUID connectionId);

    Optional<Signal> findByTenantIdAndProviderSlugAndDedupeKey(UUID tenantId, String providerSlug, String dedupeKey);
}
