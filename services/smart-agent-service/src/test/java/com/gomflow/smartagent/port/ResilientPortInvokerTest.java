package com.gomflow.smartagent.port;

import com.gomflow.smartagent.exception.ProcessingTimeoutException;
import com.gomflow.smartagent.exception.RecognitionUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResilientPortInvoker Unit Tests")
class ResilientPortInvokerTest {

    private static final String PORT = "tesseract";
    private static final RetryPolicy POLICY =
            new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0);

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private ResilientPortInvoker invoker;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();
        invoker = new ResilientPortInvoker(executor, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private double calls(String result) {
        return meterRegistry.counter("smart_agent.port.calls", "port", PORT, "result", result).count();
    }

    @Test
    @DisplayName("Should retry transient failures and return the eventual result")
    void shouldRetryUntilSuccess() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = invoker.invoke(PORT, POLICY, Duration.ofSeconds(5), () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE);
            }
            return "GCash receipt";
        }, RecognitionUnavailableException::new);

        // Then
        assertThat(result).isEqualTo("GCash receipt");
        assertThat(attempts).hasValue(3);
        assertThat(calls("success")).isEqualTo(1.0);
        assertThat(meterRegistry.find("smart_agent.port.latency").tag("port", PORT).timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should map the last failure once attempts run out")
    void shouldMapExhaustedFailure() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> invoker.invoke(PORT, POLICY, Duration.ofSeconds(5), () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("engine crashed");
        }, RecognitionUnavailableException::new))
                .isInstanceOf(RecognitionUnavailableException.class)
                .hasMessageContaining("tesseract unavailable")
                .hasMessageContaining("engine crashed")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(attempts).hasValue(3);
        assertThat(calls("failure")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not retry a client error")
    void shouldNotRetryClientError() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> invoker.invoke(PORT, POLICY, Duration.ofSeconds(5), () -> {
            attempts.incrementAndGet();
            throw new HttpClientErrorException(HttpStatus.BAD_REQUEST);
        }, RecognitionUnavailableException::new))
                .isInstanceOf(RecognitionUnavailableException.class)
                .hasCauseInstanceOf(HttpClientErrorException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    @DisplayName("Should give up at the deadline without retrying")
    void shouldStopAtDeadline() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> invoker.invoke(PORT, POLICY, Duration.ofMillis(100), () -> {
            attempts.incrementAndGet();
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return "late";
        }, RecognitionUnavailableException::new))
                .isInstanceOf(RecognitionUnavailableException.class)
                .hasCauseInstanceOf(ProcessingTimeoutException.class);
        assertThat(attempts).hasValue(1);
        assertThat(calls("timeout")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report a saturated executor as unavailable without running the call inline")
    void shouldRejectWhenExecutorSaturated() {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor saturated = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        try {
            saturated.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            ResilientPortInvoker busyInvoker = new ResilientPortInvoker(saturated, meterRegistry);
            AtomicInteger attempts = new AtomicInteger();
            Thread caller = Thread.currentThread();

            // When / Then
            assertThatThrownBy(() -> busyInvoker.invoke(PORT, POLICY, Duration.ofSeconds(30), () -> {
                attempts.incrementAndGet();
                assertThat(Thread.currentThread()).isNotSameAs(caller);
                return "inline";
            }, RecognitionUnavailableException::new))
                    .isInstanceOf(RecognitionUnavailableException.class)
                    .hasCauseInstanceOf(RejectedExecutionException.class);
            assertThat(attempts).hasValue(0);
            assertThat(calls("failure")).isEqualTo(1.0);
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should treat throttling as retryable and other client errors as final")
    void shouldClassifyFailures() {
        assertThat(ResilientPortInvoker.isRetryable(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)))
                .isTrue();
        assertThat(ResilientPortInvoker.isRetryable(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)))
                .isFalse();
        assertThat(ResilientPortInvoker.isRetryable(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)))
                .isTrue();
        assertThat(ResilientPortInvoker.isRetryable(new ProcessingTimeoutException("deadline exceeded")))
                .isFalse();
    }
}
