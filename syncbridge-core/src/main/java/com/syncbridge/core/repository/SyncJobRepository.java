package com.syncbridge.core.repository;

import com.syncbridge.core.domain.SyncJob;
import com.syncbridge.core.domain.SyncJob.JobStatus;
import com.syncbridge.core.domain.SyncJob.JobType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Read access to sync jobs. State transitions go through the executor's JDBC queue.
 */
@Repository
public interface SyncJobRepository extends JpaRepository<SyncJob, UUID> {

    List<SyncJob> findByConnectionIdOrderByCreatedAtAsc(UUID connectionId);

    List<SyncJob> findByConnectionIdAndStatus(UUID connectionId, JobStatus status);

    List<SyncJob> findByConnectionIdAndJobTypeOrderByCreatedAtAsc(UUID connectionId, JobType jobType);

    long countByConnectionIdAndJobTypeAndStatusIn(UUID connectionId, JobType jobType, Collection<JobStatus> statuses);

    long countByStatus(JobStatus status);
}
