package com.gomflow.smartagent.repository;

import com.gomflow.smartagent.domain.VerificationDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationDecisionRepository extends JpaRepository<VerificationDecision, UUID> {

    Optional<VerificationDecision> findFirstByExtractionIdAndInitialDecisionTrue(UUID extractionId);

    Optional<VerificationDecision> findFirstByExtractionIdOrderByDecidedAtDesc(UUID extractionId);

    List<VerificationDecision> findByExtractionIdOrderByDecidedAtAsc(UUID extractionId);

    List<VerificationDecision> findByInitialDecisionTrueAndDecidedAtBetween(Instant from, Instant to);
}
