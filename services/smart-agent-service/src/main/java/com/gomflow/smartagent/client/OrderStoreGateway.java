package com.gomflow.smartagent.client;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.MatchCandidate;
import com.gomflow.smartagent.exception.ConcurrentClaimConflictException;
import com.gomflow.smartagent.exception.NoCandidatesFoundException;
import com.gomflow.smartagent.exception.ProcessingTimeoutException;
import com.gomflow.smartagent.exception.SmartAgentException;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deadline-bounded access to the order store.
 */
@Slf4j
@Component
public class OrderStoreGateway {

    private final OrderStoreClient orderStoreClient;
    private final Executor executor;
    private final SmartAgentProperties properties;
    private final Clock clock;

    public OrderStoreGateway(OrderStoreClient orderStoreClient,
                             @Qualifier("portCallExecutor") Executor executor,
                             SmartAgentProperties properties,
                             Clock clock) {
        this.orderStoreClient = orderStoreClient;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Pending submissions in the given currency created within the candidate window.
     *
     * @throws NoCandidatesFoundException when the store has nothing pending
     * @throws ProcessingTimeoutException when the store does not answer within the lookup deadline
     */
    public List<MatchCandidate> findCandidates(String currency) {
        Instant to = clock.instant();
        Instant from = to.minus(properties.getMatching().getCandidateWindow());
        Duration deadline = properties.getDispatcher().getCandidateLookupTimeout();

        FutureTask<List<MatchCandidate>> lookup = new FutureTask<>(
                () -> orderStoreClient.findPendingSubmissions(currency, from, to, null, null));
        executor.execute(lookup);
        List<MatchCandidate> candidates;
        try {
            candidates = lookup.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new ProcessingTimeoutException("Candidate lookup exceeded " + deadline, e);
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProcessingTimeoutException("Interrupted during candidate lookup", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SmartAgentException("Candidate lookup failed: " + cause.getMessage(), cause);
        }

        if (candidates == null || candidates.isEmpty()) {
            throw new NoCandidatesFoundException("No pending submissions in " + currency);
        }
        log.debug("Found {} pending submissions in {}", candidates.size(), currency);
        return candidates;
    }

    /**
     * Conditionally claims a pending submission for an approved payment.
     *
     * @throws ConcurrentClaimConflictException when the submission is no longer pending
     */
    public ClaimResponse claim(String submissionId, ClaimRequest request) {
        try {
            ClaimResponse response = orderStoreClient.claimSubmission(submissionId, request);
            if (response != null && !response.claimed()) {
                throw new ConcurrentClaimConflictException(submissionId, null);
            }
            log.info("Claimed submission {} for extraction {} ({})", submissionId,
                    request.extractionId(), request.outcome());
            return response;
        } catch (FeignException.Conflict e) {
            log.warn("Claim conflict on submission {} for extraction {}", submissionId, request.extractionId());
            throw new ConcurrentClaimConflictException(submissionId, e);
        }
    }
}
