package com.gomflow.smartagent.repository;

import com.gomflow.smartagent.domain.DeadLetterJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeadLetterJobRepository extends JpaRepository<DeadLetterJob, UUID> {

    boolean existsByJobId(UUID jobId);

    List<DeadLetterJob> findByStatusOrderByCreatedAtAsc(DeadLetterJob.Status status);

    long countByStatus(DeadLetterJob.Status status);
}
