package com.gomflow.smartagent.repository;

import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.VerificationJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationJobRepository extends JpaRepository<VerificationJob, UUID> {

    Optional<VerificationJob> findByExtractionId(UUID extractionId);

    long countByStage(PipelineStage stage);
}
