package com.gomflow.smartagent.intake;

import com.gomflow.smartagent.TestFixtures;
import com.gomflow.smartagent.dispatch.JobDispatcher;
import com.gomflow.smartagent.domain.JobPriority;
import com.gomflow.smartagent.domain.PipelineStage;
import com.gomflow.smartagent.domain.ProcessingJob;
import com.gomflow.smartagent.domain.SourcePlatform;
import com.gomflow.smartagent.domain.SubmissionContext;
import com.gomflow.smartagent.domain.VerificationJob;
import com.gomflow.smartagent.dto.IntakeRequest;
import com.gomflow.smartagent.dto.SubmissionReceipt;
import com.gomflow.smartagent.exception.IntakeUnavailableException;
import com.gomflow.smartagent.exception.InvalidImageException;
import com.gomflow.smartagent.repository.VerificationJobRepository;
import com.gomflow.smartagent.service.VerificationJobTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImageIntakeService Unit Tests")
class ImageIntakeServiceTest {

    private static final byte[] IMAGE = {(byte) 0x89, 0x50, 0x4E, 0x47};

    @Mock
    private ImagePreprocessor imagePreprocessor;

    @Mock
    private FingerprintRegistry fingerprintRegistry;

    @Mock
    private VerificationJobTracker jobTracker;

    @Mock
    private VerificationJobRepository jobRepository;

    @Mock
    private JobDispatcher jobDispatcher;

    @Captor
    private ArgumentCaptor<ProcessingJob> jobCaptor;

    private ImageIntakeService intakeService;
    private PreparedImage prepared;

    @BeforeEach
    void setUp() {
        intakeService = new ImageIntakeService(imagePreprocessor, fingerprintRegistry, jobTracker, jobRepository,
                jobDispatcher, new SimpleMeterRegistry(), TestFixtures.fixedClock());
        prepared = TestFixtures.preparedImage("fp-abc");
    }

    private static IntakeRequest request(JobPriority priority, SubmissionContext context) {
        return new IntakeRequest(IMAGE, SourcePlatform.TELEGRAM, priority, "buyer-7", context);
    }

    @Test
    @DisplayName("Should accept a new proof and hand it to the dispatcher")
    void shouldAcceptNewProof() {
        // Given
        SubmissionContext context = new SubmissionContext(new BigDecimal("1200.00"), "PHP", "BP2024-001",
                null, "sub-1", "order-1");
        when(jobDispatcher.isAccepting()).thenReturn(true);
        when(imagePreprocessor.prepare(IMAGE)).thenReturn(prepared);
        when(fingerprintRegistry.claim(eq("fp-abc"), any(UUID.class), any(UUID.class))).thenReturn(Optional.empty());
        when(jobDispatcher.enqueue(any(ProcessingJob.class))).thenReturn(true);

        // When
        SubmissionReceipt receipt = intakeService.submit(request(JobPriority.HIGH, context));

        // Then
        assertThat(receipt.isDuplicate()).isFalse();
        assertThat(receipt.getStatus()).isEqualTo(PipelineStage.RECEIVED);

        verify(jobDispatcher).enqueue(jobCaptor.capture());
        ProcessingJob job = jobCaptor.getValue();
        assertThat(job.id()).isEqualTo(receipt.getJobId());
        assertThat(job.extractionId()).isEqualTo(receipt.getExtractionId());
        assertThat(job.priority()).isEqualTo(JobPriority.HIGH);
        assertThat(job.sourcePlatform()).isEqualTo(SourcePlatform.TELEGRAM);
        assertThat(job.submissionContext()).isEqualTo(context);
        assertThat(job.attempt()).isEqualTo(1);
        assertThat(job.createdAt()).isEqualTo(TestFixtures.NOW);
        verify(jobTracker).create(job);
    }

    @Test
    @DisplayName("Should answer a duplicate upload with the first extraction id without reprocessing")
    void shouldAnswerDuplicateWithPriorExtraction() {
        // Given
        UUID priorJobId = UUID.randomUUID();
        UUID priorExtractionId = UUID.randomUUID();
        when(jobDispatcher.isAccepting()).thenReturn(true);
        when(imagePreprocessor.prepare(IMAGE)).thenReturn(prepared);
        when(fingerprintRegistry.claim(eq("fp-abc"), any(UUID.class), any(UUID.class)))
                .thenReturn(Optional.of(new FingerprintRegistry.PriorSubmission(priorJobId, priorExtractionId)));
        when(jobRepository.findByExtractionId(priorExtractionId)).thenReturn(Optional.of(
                VerificationJob.builder().id(priorJobId).extractionId(priorExtractionId)
                        .stage(PipelineStage.MATCHING).build()));

        // When
        SubmissionReceipt receipt = intakeService.submit(request(JobPriority.NORMAL, null));

        // Then
        assertThat(receipt.isDuplicate()).isTrue();
        assertThat(receipt.getJobId()).isEqualTo(priorJobId);
        assertThat(receipt.getExtractionId()).isEqualTo(priorExtractionId);
        assertThat(receipt.getStatus()).isEqualTo(PipelineStage.MATCHING);
        verify(jobDispatcher, never()).enqueue(any());
        verifyNoInteractions(jobTracker);
    }

    @Test
    @DisplayName("Should reject an invalid image before claiming a fingerprint")
    void shouldRejectInvalidImage() {
        // Given
        when(jobDispatcher.isAccepting()).thenReturn(true);
        when(imagePreprocessor.prepare(IMAGE)).thenThrow(new InvalidImageException("Unsupported image format"));

        // When / Then
        assertThatThrownBy(() -> intakeService.submit(request(JobPriority.NORMAL, null)))
                .isInstanceOf(InvalidImageException.class);
        verifyNoInteractions(fingerprintRegistry, jobTracker);
    }

    @Test
    @DisplayName("Should refuse uploads while shutting down")
    void shouldRefuseWhenNotAccepting() {
        // Given
        when(jobDispatcher.isAccepting()).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> intakeService.submit(request(JobPriority.NORMAL, null)))
                .isInstanceOf(IntakeUnavailableException.class);
        verifyNoInteractions(imagePreprocessor, fingerprintRegistry);
    }

    @Test
    @DisplayName("Should release the fingerprint when the dispatcher stops accepting mid-submit")
    void shouldReleaseFingerprintWhenEnqueueFails() {
        // Given
        when(jobDispatcher.isAccepting()).thenReturn(true);
        when(imagePreprocessor.prepare(IMAGE)).thenReturn(prepared);
        when(fingerprintRegistry.claim(eq("fp-abc"), any(UUID.class), any(UUID.class))).thenReturn(Optional.empty());
        when(jobDispatcher.enqueue(any(ProcessingJob.class))).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> intakeService.submit(request(JobPriority.NORMAL, null)))
                .isInstanceOf(IntakeUnavailableException.class);
        verify(fingerprintRegistry).release("fp-abc");
        verify(jobRepository).deleteById(any(UUID.class));
    }

    @Test
    @DisplayName("Should release the fingerprint when the job cannot be stored")
    void shouldReleaseFingerprintWhenJobCreationFails() {
        // Given
        when(jobDispatcher.isAccepting()).thenReturn(true);
        when(imagePreprocessor.prepare(IMAGE)).thenReturn(prepared);
        when(fingerprintRegistry.claim(eq("fp-abc"), any(UUID.class), any(UUID.class))).thenReturn(Optional.empty());
        when(jobTracker.create(any(ProcessingJob.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        assertThatThrownBy(() -> intakeService.submit(request(JobPriority.NORMAL, null)))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(fingerprintRegistry).release("fp-abc");
        verify(jobDispatcher, never()).enqueue(any());
        verify(jobRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("Should release the fingerprint when the dispatcher throws")
    void shouldReleaseFingerprintWhenEnqueueThrows() {
        // Given
        when(jobDispatcher.isAccepting()).thenReturn(true);
        when(imagePreprocessor.prepare(IMAGE)).thenReturn(prepared);
        when(fingerprintRegistry.claim(eq("fp-abc"), any(UUID.class), any(UUID.class))).thenReturn(Optional.empty());
        when(jobDispatcher.enqueue(any(ProcessingJob.class))).thenThrow(new IllegalStateException("queue closed"));

        // When / Then
        assertThatThrownBy(() -> intakeService.submit(request(JobPriority.NORMAL, null)))
                .isInstanceOf(IllegalStateException.class);
        verify(fingerprintRegistry).release("fp-abc");
        verify(jobRepository).deleteById(any(UUID.class));
    }

    @Test
    @DisplayName("Should require a source platform")
    void shouldRequireSourcePlatform() {
        // When / Then
        assertThatThrownBy(() -> intakeService.submit(new IntakeRequest(IMAGE, null, null, "buyer-7", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Source platform");
    }
}
