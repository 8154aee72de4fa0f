package com.example.jobscheduler.service.retry;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.config.RetrySweepProperties;
import com.example.jobscheduler.domain.entity.FailedSnapshot;
import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import com.example.jobscheduler.domain.repository.FailedSnapshotRepository;
import com.example.jobscheduler.integration.SnapshotPipeline;
import com.example.jobscheduler.integration.SnapshotRetryRequest;
import com.example.jobscheduler.service.lock.OverlapGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FailedSnapshotRetrySweep Tests")
class FailedSnapshotRetrySweepTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:15:00Z");

    @Mock
    private FailedSnapshotRepository snapshotRepository;

    @Mock
    private FailedSnapshotService snapshotService;

    @Mock
    private ObjectProvider<SnapshotPipeline> pipelineProvider;

    @Mock
    private SnapshotPipeline pipeline;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<SnapshotRetryRequest> requestCaptor;

    private RetrySweepProperties properties;
    private boolean lockAvailable;
    private String lastLockName;
    private FailedSnapshotRetrySweep sweep;

    @BeforeEach
    void setUp() {
        properties = new RetrySweepProperties();
        lockAvailable = true;
        OverlapGuard guard = (lockName, ttl, work) -> {
            lastLockName = lockName;
            if (!lockAvailable) {
                return false;
            }
            work.run();
            return true;
        };
        sweep = new FailedSnapshotRetrySweep(snapshotRepository, snapshotService, guard, pipelineProvider,
                properties, metricsConfig, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static FailedSnapshot snapshot(Duration age) {
        return FailedSnapshot.builder()
                .id(UUID.randomUUID())
                .webhookJobId("wh-" + age.toMinutes())
                .shopId(7L)
                .endpoint("customers")
                .status(FailedSnapshotStatus.PENDING)
                .retryCount(1)
                .context(Map.of("url", "https://example.test/snapshot.gz"))
                .firstFailedAt(NOW.minus(age))
                .lastFailedAt(NOW.minus(age))
                .build();
    }

    private void givenPipeline() {
        when(pipelineProvider.getIfAvailable()).thenReturn(pipeline);
    }

    @Nested
    @DisplayName("Candidate window")
    class WindowTests {

        @Test
        @DisplayName("Queries between now minus lookback and now minus minimum age")
        void queriesConfiguredWindow() {
            givenPipeline();
            when(snapshotRepository.findRetryCandidates(any(), any(), any(), any())).thenReturn(List.of());

            sweep.sweep();

            verify(snapshotRepository).findRetryCandidates(
                    eq(FailedSnapshotStatus.PENDING),
                    eq(NOW.minus(Duration.ofDays(3))),
                    eq(NOW.minus(Duration.ofMinutes(15))),
                    argThat((Pageable page) -> page.getPageSize() == 200));
        }

        @Test
        @DisplayName("Window follows configuration")
        void windowFollowsConfiguration() {
            givenPipeline();
            properties.setLookback(Duration.ofHours(6));
            properties.setMinimumAge(Duration.ofHours(1));
            properties.setBatchSize(10);
            when(snapshotRepository.findRetryCandidates(any(), any(), any(), any())).thenReturn(List.of());

            sweep.sweep();

            verify(snapshotRepository).findRetryCandidates(
                    eq(FailedSnapshotStatus.PENDING),
                    eq(NOW.minus(Duration.ofHours(6))),
                    eq(NOW.minus(Duration.ofHours(1))),
                    argThat((Pageable page) -> page.getPageSize() == 10));
        }
    }

    @Nested
    @DisplayName("Re-enqueue")
    class ReenqueueTests {

        @Test
        @DisplayName("Claimed candidate is handed to the pipeline once")
        void claimedCandidateHandedOver() {
            givenPipeline();
            var candidate = snapshot(Duration.ofHours(2));
            when(snapshotRepository.findRetryCandidates(any(), any(), any(), any())).thenReturn(List.of(candidate));
            when(snapshotService.claimForRetry(candidate.getId())).thenReturn(true);

            var retried = sweep.sweep();

            assertThat(retried).isEqualTo(1);
            verify(pipeline, times(1)).requestRetry(requestCaptor.capture());
            var request = requestCaptor.getValue();
            assertThat(request.getSnapshotId()).isEqualTo(candidate.getId());
            assertThat(request.getWebhookJobId()).isEqualTo(candidate.getWebhookJobId());
            assertThat(request.getAttempt()).isEqualTo(2);
            assertThat(request.getContext()).containsEntry("url", "https://example.test/snapshot.gz");
            assertThat(lastLockName).isEqualTo("job-lock:snapshots.process");
            verify(metricsConfig).recordSnapshotRetries(1);
        }

        @Test
        @DisplayName("Candidate claimed elsewhere is not handed over")
        void alreadyClaimedNotHandedOver() {
            givenPipeline();
            var candidate = snapshot(Duration.ofHours(2));
            when(snapshotRepository.findRetryCandidates(any(), any(), any(), any())).thenReturn(List.of(candidate));
            when(snapshotService.claimForRetry(candidate.getId())).thenReturn(false);

            assertThat(sweep.sweep()).isZero();
            verify(pipeline, never()).requestRetry(any());
        }

        @Test
        @DisplayName("Rejected hand-over releases the claim and the sweep continues")
        void rejectedHandOverReleasesClaim() {
            givenPipeline();
            var first = snapshot(Duration.ofHours(3));
            var second = snapshot(Duration.ofHours(2));
            when(snapshotRepository.findRetryCandidates(any(), any(), any(), any())).thenReturn(List.of(first, second));
            when(snapshotService.claimForRetry(any())).thenReturn(true);
            doThrow(new IllegalStateException("pipeline down"))
                    .doNothing()
                    .when(pipeline).requestRetry(any());

            var retried = sweep.sweep();

            assertThat(retried).isEqualTo(1);
            verify(snapshotService).releaseClaim(first.getId());
            verify(snapshotService, never()).releaseClaim(second.getId());
        }

        @Test
        @DisplayName("Running snapshot processing skips the whole pass")
        void heldLockSkipsPass() {
            givenPipeline();
            lockAvailable = false;

            assertThat(sweep.sweep()).isZero();
            verifyNoInteractions(snapshotRepository, snapshotService, pipeline);
        }

        @Test
        @DisplayName("Missing pipeline fails the pass before anything is claimed")
        void missingPipelineFailsPass() {
            when(pipelineProvider.getIfAvailable()).thenReturn(null);

            assertThatThrownBy(() -> sweep.sweep())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("SnapshotPipeline");

            assertThat(lastLockName).isNull();
            verifyNoInteractions(snapshotRepository, snapshotService);
        }
    }

    @Test
    @DisplayName("Disabled sweep does nothing on its schedule")
    void disabledSweepDoesNothing() {
        properties.setEnabled(false);

        sweep.scheduledSweep();

        verifyNoInteractions(snapshotRepository, snapshotService, pipelineProvider);
    }
}
