package com.gomflow.smartagent.intake;

import com.gomflow.smartagent.config.SmartAgentProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Dedup window for uploaded images, keyed by pixel fingerprint.
 *
 * Uses Redis SET NX with a TTL, so the first submission of an image owns the fingerprint
 * for the window and later submissions are answered with its job and extraction ids.
 * Redis errors fail open: the image is processed rather than refused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintRegistry {

    static final String KEY_PREFIX = "smart-agent:fingerprint:";

    private final StringRedisTemplate redisTemplate;
    private final SmartAgentProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Claims the fingerprint for a new submission.
     *
     * @return the earlier submission when the fingerprint is already claimed, empty otherwise
     */
    public Optional<PriorSubmission> claim(String fingerprint, UUID jobId, UUID extractionId) {
        String key = KEY_PREFIX + fingerprint;
        String value = jobId + ":" + extractionId;
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(key, value, properties.getIntake().getDedupWindow());
            if (Boolean.TRUE.equals(claimed)) {
                meterRegistry.counter("smart_agent.intake.dedup", "result", "new").increment();
                return Optional.empty();
            }

            Optional<PriorSubmission> prior = PriorSubmission.parse(redisTemplate.opsForValue().get(key));
            if (prior.isEmpty()) {
                // claim expired between the two calls, or the stored value is unreadable
                log.warn("Fingerprint {} claimed but prior submission unreadable, processing as new", fingerprint);
                redisTemplate.opsForValue().set(key, value, properties.getIntake().getDedupWindow());
                return Optional.empty();
            }
            meterRegistry.counter("smart_agent.intake.dedup", "result", "duplicate").increment();
            log.info("Duplicate upload detected: fingerprint={}, priorExtractionId={}",
                    fingerprint, prior.get().extractionId());
            return prior;

        } catch (DataAccessException e) {
            log.error("Dedup check failed for fingerprint={}, processing anyway: {}", fingerprint, e.getMessage(), e);
            meterRegistry.counter("smart_agent.intake.dedup", "result", "error").increment();
            return Optional.empty();
        }
    }

    /**
     * Gives the fingerprint back when a claimed submission could not be enqueued.
     */
    public void release(String fingerprint) {
        try {
            redisTemplate.delete(KEY_PREFIX + fingerprint);
        } catch (DataAccessException e) {
            log.error("Failed to release fingerprint {}: {}", fingerprint, e.getMessage(), e);
            meterRegistry.counter("smart_agent.intake.dedup", "result", "error").increment();
        }
    }

    public record PriorSubmission(UUID jobId, UUID extractionId) {

        static Optional<PriorSubmission> parse(String value) {
            if (value == null) {
                return Optional.empty();
            }
            String[] parts = value.split(":");
            if (parts.length != 2) {
                return Optional.empty();
            }
            try {
                return Optional.of(new PriorSubmission(UUID.fromString(parts[0]), UUID.fromString(parts[1])));
            } catch (IllegalArgumentException e) {
                log.debug("Unreadable fingerprint claim value {}: {}", value, e.getMessage());
                return Optional.empty();
            }
        }
    }
}
