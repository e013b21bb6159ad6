package com.gomflow.smartagent.service;

import com.gomflow.smartagent.domain.PaymentExtraction;
import com.gomflow.smartagent.domain.VerificationDecision;
import com.gomflow.smartagent.exception.ExtractionNotFoundException;
import com.gomflow.smartagent.repository.PaymentExtractionRepository;
import com.gomflow.smartagent.repository.VerificationDecisionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class VerificationQueryService {

    private final PaymentExtractionRepository extractionRepository;
    private final VerificationDecisionRepository decisionRepository;

    public PaymentExtraction getExtraction(UUID extractionId) {
        return extractionRepository.findById(extractionId)
                .orElseThrow(() -> new ExtractionNotFoundException(extractionId));
    }

    /**
     * Decision history for an extraction, oldest first.
     */
    public List<VerificationDecision> getDecisions(UUID extractionId) {
        List<VerificationDecision> decisions = decisionRepository.findByExtractionIdOrderByDecidedAtAsc(extractionId);
        if (decisions.isEmpty() && !extractionRepository.existsById(extractionId)) {
            throw new ExtractionNotFoundException(extractionId);
        }
        return decisions;
    }
}
