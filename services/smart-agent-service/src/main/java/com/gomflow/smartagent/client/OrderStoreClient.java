package com.gomflow.smartagent.client;

import com.gomflow.smartagent.domain.MatchCandidate;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Feign client for the order store that owns pending payment submissions.
 * Claims are conditional: the store answers 409 when a submission is no longer pending.
 */
@FeignClient(name = "order-store", url = "${smart-agent.order-store.url:http://localhost:8080}",
        path = "/api/v1/submissions")
public interface OrderStoreClient {

    @GetMapping("/pending")
    List<MatchCandidate> findPendingSubmissions(
            @RequestParam("currency") String currency,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "reference", required = false) String reference,
            @RequestParam(value = "amount", required = false) BigDecimal amount);

    @PostMapping("/{submissionId}/claim")
    ClaimResponse claimSubmission(@PathVariable("submissionId") String submissionId,
                                  @RequestBody ClaimRequest request);
}
