package com.gomflow.smartagent.dispatch;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.JobPriority;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.exception.ProcessingTimeoutException;
import com.gomflow.smartagent.port.RetryPolicy;
import com.gomflow.smartagent.service.DeadLetterService;
import com.gomflow.smartagent.service.PaymentVerificationPipeline;
import com.gomflow.smartagent.service.VerificationJobTracker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded worker pool over priority queues.
 *
 * Reserved workers only take HIGH jobs so urgent proofs never wait behind a backlog; shared
 * workers take HIGH, then NORMAL, then LOW. Failed jobs are retried with exponential backoff
 * and dead-lettered once attempts run out, so every accepted job ends with a decision.
 */
@Slf4j
@Component
public class JobDispatcher {

    private static final List<JobPriority> SHARED_ORDER = List.of(JobPriority.HIGH, JobPriority.NORMAL, JobPriority.LOW);
    private static final List<JobPriority> RESERVED_ORDER = List.of(JobPriority.HIGH);

    private final PaymentVerificationPipeline pipeline;
    private final DeadLetterService deadLetterService;
    private final VerificationJobTracker jobTracker;
    private final TaskExecutor workerExecutor;
    private final TaskScheduler retryScheduler;
    private final SmartAgentProperties.Dispatcher settings;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final Map<JobPriority, Deque<ProcessingJob>> queues = new EnumMap<>(JobPriority.class);
    private final Map<UUID, ProcessingJob> pendingRetries = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final Condition idle = lock.newCondition();

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    private volatile boolean accepting = true;
    private volatile boolean running = false;

    public JobDispatcher(PaymentVerificationPipeline pipeline,
                         DeadLetterService deadLetterService,
                         VerificationJobTracker jobTracker,
                         @Qualifier("verificationWorkerExecutor") TaskExecutor workerExecutor,
                         @Qualifier("jobRetryScheduler") TaskScheduler retryScheduler,
                         SmartAgentProperties properties,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        this.pipeline = pipeline;
        this.deadLetterService = deadLetterService;
        this.jobTracker = jobTracker;
        this.workerExecutor = workerExecutor;
        this.retryScheduler = retryScheduler;
        this.settings = properties.getDispatcher();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.retryPolicy = new RetryPolicy(settings.getMaxAttempts(), settings.getRetryBackoff(),
                settings.getMaxRetryBackoff(), 2.0);
        for (JobPriority priority : JobPriority.values()) {
            queues.put(priority, new ArrayDeque<>());
            Gauge.builder("smart_agent.jobs.queued", this, dispatcher -> dispatcher.queued(priority))
                    .tag("priority", priority.name())
                    .register(meterRegistry);
        }
        Gauge.builder("smart_agent.jobs.in_flight", inFlight, AtomicInteger::get).register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        running = true;
        int reserved = settings.getReservedHighPriorityWorkers();
        for (int i = 0; i < settings.getWorkers(); i++) {
            boolean reservedWorker = i < reserved;
            workerExecutor.execute(() -> workerLoop(reservedWorker));
        }
        log.info("Job dispatcher started with {} workers ({} reserved for HIGH priority)",
                settings.getWorkers(), reserved);
    }

    /**
     * @return false when the dispatcher is shutting down and the job was not accepted
     */
    public boolean enqueue(ProcessingJob job) {
        if (!accepting) {
            log.warn("Dispatcher not accepting jobs, rejecting job {}", job.id());
            return false;
        }
        offer(job);
        meterRegistry.counter("smart_agent.jobs.enqueued", "priority", job.priority().name()).increment();
        return true;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public DispatcherStatus snapshot() {
        Map<JobPriority, Integer> depth = new EnumMap<>(JobPriority.class);
        lock.lock();
        try {
            queues.forEach((priority, queue) -> depth.put(priority, queue.size()));
        } finally {
            lock.unlock();
        }
        return new DispatcherStatus(accepting, depth, inFlight.get(), pendingRetries.size(),
                settings.getWorkers(), settings.getReservedHighPriorityWorkers(),
                processed.get(), retried.get(), deadLettered.get());
    }

    private void workerLoop(boolean reserved) {
        log.debug("Worker started (reserved={})", reserved);
        while (running) {
            ProcessingJob job;
            try {
                job = awaitJob(reserved, settings.getPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Worker interrupted, stopping (reserved={})", reserved);
                return;
            }
            if (job != null) {
                runJob(job);
            }
        }
        log.debug("Worker stopped (reserved={})", reserved);
    }

    private ProcessingJob awaitJob(boolean reserved, Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            ProcessingJob job = poll(reserved);
            if (job == null && running) {
                workAvailable.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
                job = poll(reserved);
            }
            if (job != null) {
                inFlight.incrementAndGet();
            }
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next job a worker of the given kind may run, without waiting.
     */
    ProcessingJob nextJob(boolean reserved) {
        lock.lock();
        try {
            ProcessingJob job = poll(reserved);
            if (job != null) {
                inFlight.incrementAndGet();
            }
            return job;
        } finally {
            lock.unlock();
        }
    }

    private ProcessingJob poll(boolean reserved) {
        for (JobPriority priority : reserved ? RESERVED_ORDER : SHARED_ORDER) {
            ProcessingJob job = queues.get(priority).pollFirst();
            if (job != null) {
                return job;
            }
        }
        return null;
    }

    /**
     * Runs a job taken by {@link #nextJob(boolean)} or the worker loop.
     */
    void runJob(ProcessingJob job) {
        MDC.put("jobId", job.id().toString());
        MDC.put("extractionId", job.extractionId().toString());
        try {
            log.info("Processing job {} (priority={}, attempt={})", job.id(), job.priority(), job.attempt());
            pipeline.process(job);
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            handleFailure(job, e);
        } finally {
            MDC.remove("jobId");
            MDC.remove("extractionId");
            lock.lock();
            try {
                inFlight.decrementAndGet();
                idle.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void handleFailure(ProcessingJob job, RuntimeException error) {
        int attempt = job.attempt();
        log.error("Job {} failed on attempt {}/{}: {}", job.id(), attempt, settings.getMaxAttempts(),
                error.getMessage(), error);
        try {
            jobTracker.recordAttemptFailure(job.id(), attempt, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}: {}", job.id(), e.getMessage(), e);
        }

        if (attempt >= settings.getMaxAttempts() || !accepting) {
            deadLetter(job, attempt, error);
            return;
        }

        Duration delay = retryPolicy.delayAfter(attempt);
        ProcessingJob next = job.withAttempt(attempt + 1);
        pendingRetries.put(next.id(), next);
        retried.incrementAndGet();
        meterRegistry.counter("smart_agent.jobs.retried").increment();
        log.warn("Retrying job {} in {}ms (attempt {})", job.id(), delay.toMillis(), next.attempt());
        retryScheduler.schedule(() -> {
            if (pendingRetries.remove(next.id()) != null) {
                offer(next);
            }
        }, clock.instant().plus(delay));
    }

    private void deadLetter(ProcessingJob job, int attempts, Throwable cause) {
        try {
            deadLetterService.deadLetter(job, attempts, cause);
            deadLettered.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("CRITICAL: Failed to dead-letter job {} for extraction {}: {}", job.id(),
                    job.extractionId(), e.getMessage(), e);
            meterRegistry.counter("smart_agent.jobs.dead_letter_failed").increment();
        }
    }

    private void offer(ProcessingJob job) {
        lock.lock();
        try {
            queues.get(job.priority()).addLast(job);
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private int queued(JobPriority priority) {
        lock.lock();
        try {
            return queues.get(priority).size();
        } finally {
            lock.unlock();
        }
    }

    private int queuedTotal() {
        return queues.values().stream().mapToInt(Deque::size).sum();
    }

    /**
     * Stops intake, lets workers drain the queues within the grace period, then dead-letters
     * whatever is left so no accepted job ends without a decision.
     */
    @PreDestroy
    public void shutdown() {
        accepting = false;
        long deadline = System.nanoTime() + settings.getShutdownGrace().toNanos();
        log.info("Job dispatcher shutting down, draining {} queued and {} in-flight jobs",
                snapshot().totalQueued(), inFlight.get());

        lock.lock();
        try {
            long remaining;
            while ((queuedTotal() > 0 || inFlight.get() > 0 || !pendingRetries.isEmpty())
                    && (remaining = deadline - System.nanoTime()) > 0) {
                idle.awaitNanos(Math.min(remaining, settings.getPollInterval().toNanos()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining job queues");
        } finally {
            running = false;
            workAvailable.signalAll();
            lock.unlock();
        }

        List<ProcessingJob> leftovers = new ArrayList<>();
        lock.lock();
        try {
            queues.values().forEach(queue -> {
                leftovers.addAll(queue);
                queue.clear();
            });
        } finally {
            lock.unlock();
        }
        pendingRetries.keySet().forEach(id -> {
            ProcessingJob job = pendingRetries.remove(id);
            if (job != null) {
                leftovers.add(job);
            }
        });

        if (!leftovers.isEmpty()) {
            log.warn("Dead-lettering {} jobs not processed before shutdown", leftovers.size());
        }
        ProcessingTimeoutException cause = new ProcessingTimeoutException("Service shut down before job completed");
        leftovers.forEach(job -> deadLetter(job, job.attempt(), cause));
        log.info("Job dispatcher stopped: processed={}, retried={}, deadLettered={}",
                processed.get(), retried.get(), deadLettered.get());
    }
}
