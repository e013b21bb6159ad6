package com.gomflow.smartagent.port;

import com.gomflow.smartagent.exception.ProcessingTimeoutException;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Runs calls to external recognition services under a retry policy and an overall deadline.
 *
 * Each attempt runs on the port executor so the caller never waits past the deadline, even
 * when the remote side hangs. Once retries or time run out the failure is handed to the
 * caller-supplied mapper, which turns it into the port's "unavailable" exception.
 */
@Slf4j
@Component
public class ResilientPortInvoker {

    private final Executor portCallExecutor;
    private final MeterRegistry meterRegistry;

    public ResilientPortInvoker(@Qualifier("portCallExecutor") Executor portCallExecutor,
                                MeterRegistry meterRegistry) {
        this.portCallExecutor = portCallExecutor;
        this.meterRegistry = meterRegistry;
    }

    public <T> T invoke(String portName,
                        RetryPolicy policy,
                        Duration deadline,
                        Supplier<T> call,
                        BiFunction<String, Throwable, ? extends RuntimeException> onExhausted) {
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        Retry retry = Retry.of(portName, policy.toRetryConfig(ResilientPortInvoker::isRetryable));
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} call, attempt {} failed: {}", portName,
                        event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())));

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = Retry.decorateSupplier(retry, () -> attempt(portName, deadlineNanos, call)).get();
            countCall(portName, "success");
            return result;
        } catch (RuntimeException e) {
            countCall(portName, e instanceof ProcessingTimeoutException ? "timeout" : "failure");
            log.error("{} call gave up: {}", portName, describe(e));
            throw onExhausted.apply(portName + " unavailable: " + describe(e), e);
        } finally {
            sample.stop(Timer.builder("smart_agent.port.latency")
                    .tag("port", portName)
                    .register(meterRegistry));
        }
    }

    private <T> T attempt(String portName, long deadlineNanos, Supplier<T> call) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new ProcessingTimeoutException(portName + " deadline exceeded before attempt");
        }

        // FutureTask rather than CompletableFuture: cancel(true) has to interrupt a hung call
        FutureTask<T> future = new FutureTask<>(call::get);
        try {
            portCallExecutor.execute(future);
        } catch (RejectedExecutionException e) {
            log.warn("{} call rejected by port executor: {}", portName, e.getMessage());
            throw e;
        }
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProcessingTimeoutException(portName + " deadline exceeded", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProcessingTimeoutException(portName + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(portName + " call failed", cause);
        }
    }

    /**
     * Deadline overruns and client errors other than throttling are final.
     */
    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof ProcessingTimeoutException) {
            return false;
        }
        if (throwable instanceof HttpClientErrorException) {
            return ((HttpClientErrorException) throwable).getStatusCode().value() == 429;
        }
        return true;
    }

    private void countCall(String portName, String result) {
        Counter.builder("smart_agent.port.calls")
                .tag("port", portName)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
