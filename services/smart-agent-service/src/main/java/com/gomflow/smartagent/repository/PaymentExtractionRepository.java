package com.gomflow.smartagent.repository;

import com.gomflow.smartagent.domain.PaymentExtraction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentExtractionRepository extends JpaRepository<PaymentExtraction, UUID> {

    List<PaymentExtraction> findByCreatedAtBetween(Instant from, Instant to);
}
