package com.example.jobscheduler.integration;

import com.example.jobscheduler.TestcontainersConfiguration;
import com.example.jobscheduler.domain.entity.DeliveryRecord;
import com.example.jobscheduler.domain.entity.FailedSnapshot;
import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import com.example.jobscheduler.domain.enums.RunStateWriter;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import com.example.jobscheduler.domain.repository.FailedSnapshotRepository;
import com.example.jobscheduler.domain.repository.JobScheduleRepository;
import com.example.jobscheduler.dto.CreateJobScheduleRequest;
import com.example.jobscheduler.dto.UpdateJobScheduleRequest;
import com.example.jobscheduler.service.JobScheduleService;
import com.example.jobscheduler.service.job.ScheduledJobExecutor;
import com.example.jobscheduler.service.notification.NotificationDeliveryLedger;
import com.example.jobscheduler.service.retry.FailedSnapshotRetrySweep;
import com.example.jobscheduler.service.state.RunStateTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "spring.main.web-application-type=servlet",
                "job-scheduler.sweep-cron=-",
                "job-scheduler.retry-sweep.cron=-",
                "job-scheduler.metrics-update-interval-ms=999999999",
                "slack.enabled=false"
        }
)
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Job Schedule Engine Integration Tests")
class JobScheduleEngineIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JobScheduleRepository scheduleRepository;

    @Autowired
    private FailedSnapshotRepository snapshotRepository;

    @Autowired
    private RunStateTracker runStateTracker;

    @Autowired
    private NotificationDeliveryLedger deliveryLedger;

    @Autowired
    private FailedSnapshotRetrySweep retrySweep;

    @Autowired
    private ScheduledJobExecutor jobExecutor;

    @Autowired
    private JobScheduleService scheduleService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StorefrontGateway storefrontGateway;

    @MockBean
    private SnapshotPipeline snapshotPipeline;

    @BeforeEach
    void setUp() {
        scheduleRepository.deleteAll();
        snapshotRepository.deleteAll();
        jdbcTemplate.update("DELETE FROM notification_deliveries");
        jdbcTemplate.update("DELETE FROM shedlock");
    }

    private JobSchedule saveSchedule(boolean enabled) {
        return saveSchedule(enabled, null);
    }

    private JobSchedule saveSchedule(boolean enabled, Long shopId) {
        return scheduleRepository.save(JobSchedule.builder()
                .name("Fetch new orders")
                .jobType("orders.fetch_new")
                .shopId(shopId)
                .frequency(ScheduleFrequency.EVERY_FIVE_MINUTES)
                .cronExpression("*/5 * * * *")
                .timezone("Europe/Prague")
                .options(new HashMap<>(Map.of("fallback_lookback_hours", 24)))
                .enabled(enabled)
                .build());
    }

    @Nested
    @DisplayName("Run state")
    class RunStateTests {

        @Test
        @DisplayName("Should queue a schedule only once within the same minute")
        void shouldQueueOncePerMinute() {
            var schedule = saveSchedule(true);
            var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

            assertThat(runStateTracker.markQueued(schedule.getId(), now)).isTrue();
            assertThat(runStateTracker.markQueued(schedule.getId(), now.plusSeconds(1))).isFalse();

            var stored = scheduleRepository.findById(schedule.getId()).orElseThrow();
            assertThat(stored.getLastRunStatus()).isEqualTo(RunStatus.QUEUED);
            assertThat(stored.getLastRunAt()).isEqualTo(now);
        }

        @Test
        @DisplayName("Should not queue a disabled schedule")
        void shouldNotQueueDisabledSchedule() {
            var schedule = saveSchedule(false);

            assertThat(runStateTracker.markQueued(schedule.getId(), Instant.now())).isFalse();
            assertThat(scheduleRepository.findById(schedule.getId()).orElseThrow().getLastRunStatus()).isNull();
        }

        @Test
        @DisplayName("Should follow queued, running, completed and reject out-of-order writes")
        void shouldEnforceTransitions() {
            var schedule = saveSchedule(true);
            var id = schedule.getId();

            assertThat(runStateTracker.markRunning(id)).isFalse();
            assertThat(runStateTracker.markQueued(id, Instant.now())).isTrue();
            assertThat(runStateTracker.markRunning(id)).isTrue();
            assertThat(runStateTracker.markCompleted(id, "Imported 3 orders")).isTrue();
            assertThat(runStateTracker.markSkipped(RunStateWriter.SWEEP, id, "late skip")).isFalse();

            var stored = scheduleRepository.findById(id).orElseThrow();
            assertThat(stored.getLastRunStatus()).isEqualTo(RunStatus.COMPLETED);
            assertThat(stored.getLastRunMessage()).isEqualTo("Imported 3 orders");
            assertThat(stored.getLastRunEndedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should keep the failure of a long run when the next tick fires while it is running")
        void shouldKeepFailureOfLongRun() {
            var id = saveSchedule(true, 1L).getId();
            var queuedAt = Instant.now().truncatedTo(ChronoUnit.SECONDS);
            var nextTickQueued = new ArrayList<Boolean>();
            assertThat(runStateTracker.markQueued(id, queuedAt)).isTrue();

            when(storefrontGateway.fetchNewOrders(eq(1L), anyInt())).thenAnswer(invocation -> {
                nextTickQueued.add(runStateTracker.markQueued(id, queuedAt.plusSeconds(61)));
                jobExecutor.execute("orders.fetch_new", id);
                throw new IllegalStateException("Shoptet API down");
            });

            jobExecutor.execute("orders.fetch_new", id);

            assertThat(nextTickQueued).containsExactly(false);
            verify(storefrontGateway, times(1)).fetchNewOrders(eq(1L), anyInt());
            var stored = scheduleRepository.findById(id).orElseThrow();
            assertThat(stored.getLastRunStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(stored.getLastRunMessage()).contains("Shoptet API down");
        }

        @Test
        @DisplayName("Should queue a run again once it was left in flight longer than the lock TTL")
        void shouldRequeueStaleRun() {
            var id = saveSchedule(true).getId();
            var now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

            assertThat(runStateTracker.markQueued(id, now)).isTrue();
            assertThat(runStateTracker.markRunning(id)).isTrue();
            assertThat(runStateTracker.markQueued(id, now.plusSeconds(61))).isFalse();
            assertThat(runStateTracker.markQueued(id, now.plus(Duration.ofHours(2)))).isTrue();

            assertThat(scheduleRepository.findById(id).orElseThrow().getLastRunStatus()).isEqualTo(RunStatus.QUEUED);
        }

        @Test
        @DisplayName("Should keep a run outcome written while an operator edit was in progress")
        void operatorEditKeepsRunOutcome() {
            var id = saveSchedule(true).getId();
            assertThat(runStateTracker.markQueued(id, Instant.now())).isTrue();
            assertThat(runStateTracker.markRunning(id)).isTrue();

            new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                assertThat(scheduleRepository.findById(id).orElseThrow().getLastRunStatus())
                        .isEqualTo(RunStatus.RUNNING);
                CompletableFuture.runAsync(() -> runStateTracker.markCompleted(id, "Imported 3 orders")).join();
                scheduleService.update(id, UpdateJobScheduleRequest.builder().name("Fetch new orders (EU)").build());
            });

            var stored = scheduleRepository.findById(id).orElseThrow();
            assertThat(stored.getName()).isEqualTo("Fetch new orders (EU)");
            assertThat(stored.getLastRunStatus()).isEqualTo(RunStatus.COMPLETED);
            assertThat(stored.getLastRunMessage()).isEqualTo("Imported 3 orders");
            assertThat(stored.getLastRunEndedAt()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Notification delivery ledger")
    class DeliveryLedgerTests {

        @Test
        @DisplayName("Should record a delivery once per notification and channel")
        void shouldRecordOnce() {
            var record = DeliveryRecord.builder()
                    .notificationId("n-1")
                    .eventId("order.created")
                    .channel("slack")
                    .payload(Map.of("text", "New order"))
                    .deliveredAt(Instant.now())
                    .build();

            assertThat(deliveryLedger.recordDelivery(record)).isTrue();
            assertThat(deliveryLedger.recordDelivery(record)).isFalse();

            assertThat(deliveryLedger.hasDelivered("slack", "n-1")).isTrue();
            assertThat(deliveryLedger.hasDelivered("email", "n-1")).isFalse();
            assertThat(deliveryLedger.hasDelivered("slack", "n-2")).isFalse();
        }
    }

    @Test
    @DisplayName("Retry sweep should hand over only failures inside the retry window")
    void retrySweepShouldRespectWindow() {
        var now = Instant.now();
        var tooYoung = saveSnapshot("job-young", now.minus(Duration.ofMinutes(5)));
        var inWindow = saveSnapshot("job-window", now.minus(Duration.ofHours(1)));
        var tooOld = saveSnapshot("job-old", now.minus(Duration.ofDays(4)));

        assertThat(retrySweep.sweep()).isEqualTo(1);
        assertThat(retrySweep.sweep()).isZero();

        verify(snapshotPipeline, times(1)).requestRetry(argThat(request ->
                request.getSnapshotId().equals(inWindow.getId()) && request.getAttempt() == 1));

        var claimed = snapshotRepository.findById(inWindow.getId()).orElseThrow();
        assertThat(claimed.getStatus()).isEqualTo(FailedSnapshotStatus.RETRYING);
        assertThat(claimed.getRetryCount()).isEqualTo(1);

        assertThat(snapshotRepository.findById(tooYoung.getId()).orElseThrow().getStatus())
                .isEqualTo(FailedSnapshotStatus.PENDING);
        assertThat(snapshotRepository.findById(tooOld.getId()).orElseThrow().getRetryCount()).isZero();
    }

    private FailedSnapshot saveSnapshot(String webhookJobId, Instant lastFailedAt) {
        return snapshotRepository.save(FailedSnapshot.builder()
                .webhookJobId(webhookJobId)
                .shopId(1L)
                .endpoint("/api/customers/snapshot")
                .errorMessage("Timed out")
                .firstFailedAt(lastFailedAt)
                .lastFailedAt(lastFailedAt)
                .build());
    }

    @Nested
    @DisplayName("Schedule API")
    class ScheduleApiTests {

        @Test
        @DisplayName("Should create schedule with catalog defaults")
        void shouldCreateWithDefaults() throws Exception {
            var request = CreateJobScheduleRequest.builder().jobType("orders.fetch_new").build();

            mockMvc.perform(post("/api/v1/job-schedules")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.jobType").value("orders.fetch_new"))
                    .andExpect(jsonPath("$.data.cronExpression").value("*/5 * * * *"))
                    .andExpect(jsonPath("$.data.timezone").value("Europe/Prague"))
                    .andExpect(jsonPath("$.data.options.fallback_lookback_hours").value(24))
                    .andExpect(jsonPath("$.data.enabled").value(true))
                    .andExpect(jsonPath("$.data.id").isNotEmpty());

            assertThat(scheduleRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject invalid cron expression")
        void shouldRejectInvalidCron() throws Exception {
            var json = """
                    {"jobType": "orders.fetch_new", "cronExpression": "every day"}
                    """;

            mockMvc.perform(post("/api/v1/job-schedules")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false));

            assertThat(scheduleRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should list the job type catalog")
        void shouldListCatalog() throws Exception {
            mockMvc.perform(get("/api/v1/job-schedules/catalog"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(12)))
                    .andExpect(jsonPath("$.data[0].jobType").value("orders.fetch_new"));
        }

        @Test
        @DisplayName("Should treat deleting an absent schedule as success")
        void shouldDeleteIdempotently() throws Exception {
            var schedule = saveSchedule(true);

            mockMvc.perform(delete("/api/v1/job-schedules/{id}", schedule.getId()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Schedule deleted"));
            mockMvc.perform(delete("/api/v1/job-schedules/{id}", schedule.getId()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Schedule already absent"));
        }
    }
}
