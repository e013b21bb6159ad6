package com.gomflow.smartagent.dispatch;

import com.gomflow.smartagent.TestFixtures;
import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.domain.JobPriority;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.exception.ExtractionUnavailableException;
import com.gomflow.smartagent.exception.ProcessingTimeoutException;
import com.gomflow.smartagent.service.DeadLetterService;
import com.gomflow.smartagent.service.PaymentVerificationPipeline;
import com.gomflow.smartagent.service.VerificationJobTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobDispatcher Unit Tests")
class JobDispatcherTest {

    @Mock
    private PaymentVerificationPipeline pipeline;

    @Mock
    private DeadLetterService deadLetterService;

    @Mock
    private VerificationJobTracker jobTracker;

    @Mock
    private TaskExecutor workerExecutor;

    @Mock
    private TaskScheduler retryScheduler;

    @Captor
    private ArgumentCaptor<Runnable> runnableCaptor;

    private SmartAgentProperties properties;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new SmartAgentProperties();
        properties.getDispatcher().setShutdownGrace(Duration.ofMillis(50));
        properties.getDispatcher().setPollInterval(Duration.ofMillis(10));
        dispatcher = new JobDispatcher(pipeline, deadLetterService, jobTracker, workerExecutor, retryScheduler,
                properties, new SimpleMeterRegistry(), TestFixtures.fixedClock());
    }

    @Nested
    @DisplayName("Queue ordering")
    class QueueOrdering {

        @Test
        @DisplayName("Should hand shared workers HIGH, then NORMAL, then LOW jobs")
        void shouldServeByPriority() {
            // Given
            ProcessingJob low = TestFixtures.job(JobPriority.LOW);
            ProcessingJob normal = TestFixtures.job(JobPriority.NORMAL);
            ProcessingJob high = TestFixtures.job(JobPriority.HIGH);
            dispatcher.enqueue(low);
            dispatcher.enqueue(normal);
            dispatcher.enqueue(high);

            // When / Then
            assertThat(dispatcher.nextJob(false)).isSameAs(high);
            assertThat(dispatcher.nextJob(false)).isSameAs(normal);
            assertThat(dispatcher.nextJob(false)).isSameAs(low);
            assertThat(dispatcher.nextJob(false)).isNull();
        }

        @Test
        @DisplayName("Should keep reserved workers for HIGH priority jobs only")
        void shouldReserveWorkersForHighPriority() {
            // Given
            ProcessingJob normal = TestFixtures.job(JobPriority.NORMAL);
            ProcessingJob high = TestFixtures.job(JobPriority.HIGH);
            dispatcher.enqueue(normal);
            dispatcher.enqueue(high);

            // When / Then
            assertThat(dispatcher.nextJob(true)).isSameAs(high);
            assertThat(dispatcher.nextJob(true)).isNull();
            assertThat(dispatcher.nextJob(false)).isSameAs(normal);
        }

        @Test
        @DisplayName("Should keep FIFO order within a priority")
        void shouldKeepFifoWithinPriority() {
            // Given
            ProcessingJob first = TestFixtures.job(JobPriority.NORMAL);
            ProcessingJob second = TestFixtures.job(JobPriority.NORMAL);
            dispatcher.enqueue(first);
            dispatcher.enqueue(second);

            // When / Then
            assertThat(dispatcher.nextJob(false)).isSameAs(first);
            assertThat(dispatcher.nextJob(false)).isSameAs(second);
        }

        @Test
        @DisplayName("Should report queue depth per priority")
        void shouldReportQueueDepth() {
            // Given
            dispatcher.enqueue(TestFixtures.job(JobPriority.HIGH));
            dispatcher.enqueue(TestFixtures.job(JobPriority.LOW));
            dispatcher.enqueue(TestFixtures.job(JobPriority.LOW));

            // When
            DispatcherStatus status = dispatcher.snapshot();

            // Then
            assertThat(status.accepting()).isTrue();
            assertThat(status.queueDepth())
                    .containsEntry(JobPriority.HIGH, 1)
                    .containsEntry(JobPriority.NORMAL, 0)
                    .containsEntry(JobPriority.LOW, 2);
            assertThat(status.totalQueued()).isEqualTo(3);
            assertThat(status.workers()).isEqualTo(6);
            assertThat(status.reservedHighPriorityWorkers()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Should count a successful run")
        void shouldRunJob() {
            // Given
            ProcessingJob job = TestFixtures.job();
            dispatcher.enqueue(job);

            // When
            dispatcher.runJob(dispatcher.nextJob(false));

            // Then
            verify(pipeline).process(job);
            DispatcherStatus status = dispatcher.snapshot();
            assertThat(status.processed()).isEqualTo(1);
            assertThat(status.inFlight()).isZero();
        }

        @Test
        @DisplayName("Should schedule a retry with backoff after a failed attempt")
        void shouldRetryFailedJob() {
            // Given
            ProcessingJob job = TestFixtures.job();
            ExtractionUnavailableException failure = new ExtractionUnavailableException("vision down", null);
            when(pipeline.process(job)).thenThrow(failure);
            dispatcher.enqueue(job);

            // When
            dispatcher.runJob(dispatcher.nextJob(false));

            // Then
            verify(jobTracker).recordAttemptFailure(job.id(), 1, failure);
            verify(retryScheduler).schedule(runnableCaptor.capture(),
                    eq(TestFixtures.NOW.plus(Duration.ofSeconds(5))));
            verify(deadLetterService, never()).deadLetter(any(), anyInt(), any());
            assertThat(dispatcher.snapshot().pendingRetries()).isEqualTo(1);
            assertThat(dispatcher.snapshot().retried()).isEqualTo(1);

            // When the backoff elapses
            runnableCaptor.getValue().run();

            // Then
            ProcessingJob retry = dispatcher.nextJob(false);
            assertThat(retry.id()).isEqualTo(job.id());
            assertThat(retry.attempt()).isEqualTo(2);
            assertThat(dispatcher.snapshot().pendingRetries()).isZero();
        }

        @Test
        @DisplayName("Should dead-letter a job once attempts are exhausted")
        void shouldDeadLetterExhaustedJob() {
            // Given
            ProcessingJob job = TestFixtures.job().withAttempt(3);
            ExtractionUnavailableException failure = new ExtractionUnavailableException("vision down", null);
            when(pipeline.process(job)).thenThrow(failure);
            dispatcher.enqueue(job);

            // When
            dispatcher.runJob(dispatcher.nextJob(false));

            // Then
            verify(deadLetterService).deadLetter(job, 3, failure);
            verify(retryScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
            assertThat(dispatcher.snapshot().deadLettered()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should still retry when the failure cannot be recorded")
        void shouldRetryWhenTrackerFails() {
            // Given
            ProcessingJob job = TestFixtures.job();
            when(pipeline.process(job)).thenThrow(new IllegalStateException("boom"));
            when(jobTracker.recordAttemptFailure(eq(job.id()), eq(1), any()))
                    .thenThrow(new IllegalStateException("database down"));
            dispatcher.enqueue(job);

            // When
            dispatcher.runJob(dispatcher.nextJob(false));

            // Then
            verify(retryScheduler).schedule(any(Runnable.class), any(Instant.class));
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("Should refuse new jobs and dead-letter the ones left in the queue")
        void shouldDeadLetterLeftoversOnShutdown() {
            // Given
            ProcessingJob queued = TestFixtures.job(JobPriority.LOW);
            dispatcher.enqueue(queued);

            // When
            dispatcher.shutdown();

            // Then
            assertThat(dispatcher.isAccepting()).isFalse();
            assertThat(dispatcher.enqueue(TestFixtures.job())).isFalse();
            verify(deadLetterService).deadLetter(eq(queued), eq(1), isA(ProcessingTimeoutException.class));
            assertThat(dispatcher.snapshot().totalQueued()).isZero();
        }

        @Test
        @DisplayName("Should dead-letter jobs waiting for a retry on shutdown")
        void shouldDeadLetterPendingRetriesOnShutdown() {
            // Given
            ProcessingJob job = TestFixtures.job();
            when(pipeline.process(job)).thenThrow(new IllegalStateException("boom"));
            dispatcher.enqueue(job);
            dispatcher.runJob(dispatcher.nextJob(false));

            // When
            dispatcher.shutdown();

            // Then
            verify(deadLetterService, times(1)).deadLetter(any(ProcessingJob.class), eq(2),
                    isA(ProcessingTimeoutException.class));
            assertThat(dispatcher.snapshot().pendingRetries()).isZero();
        }
    }
}
