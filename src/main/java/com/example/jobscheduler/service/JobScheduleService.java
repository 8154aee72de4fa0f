package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import com.example.jobscheduler.domain.repository.JobScheduleRepository;
import com.example.jobscheduler.dto.CreateJobScheduleRequest;
import com.example.jobscheduler.dto.JobScheduleResponse;
import com.example.jobscheduler.dto.JobTypeResponse;
import com.example.jobscheduler.dto.UpdateJobScheduleRequest;
import com.example.jobscheduler.exception.JobScheduleNotFoundException;
import com.example.jobscheduler.mapper.JobScheduleMapper;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import com.example.jobscheduler.service.catalog.JobTypeDefinition;
import com.example.jobscheduler.service.job.JobHandlerRegistry;
import com.example.jobscheduler.service.sweep.DueEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operator-side management of job schedules.
 * <p>
 * Provides:
 * - Creation with defaults from the job type catalog
 * - Edits of definition fields (the job type is fixed)
 * - Enable/disable and idempotent deletion
 * <p>
 * Cron, timezone and options are validated on every write, so an enabled schedule
 * created here always carries a parseable cron expression.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobScheduleService {

    private final JobScheduleRepository scheduleRepository;
    private final JobTypeCatalog catalog;
    private final JobHandlerRegistry handlerRegistry;
    private final DueEvaluator dueEvaluator;
    private final JobScheduleMapper mapper;
    private final Clock clock;

    @Transactional
    public JobScheduleResponse create(CreateJobScheduleRequest request) {
        var definition = catalog.getOrThrow(request.getJobType());
        log.info("Creating schedule for job type {}", definition.getJobType());

        requireShopSupport(definition, request.getShopId());

        var frequency = request.getFrequency() != null ? request.getFrequency() : definition.getDefaultFrequency();
        var cron = resolveCron(definition, frequency, request.getCronExpression());
        var timezone = isBlank(request.getTimezone()) ? definition.getDefaultTimezone() : request.getTimezone().trim();
        requireValidTimezone(timezone);

        var options = new HashMap<String, Object>(definition.getDefaultOptions());
        if (request.getOptions() != null) {
            options.putAll(request.getOptions());
        }
        requireValidOptions(definition.getJobType(), options);

        var schedule = JobSchedule.builder()
                .name(isBlank(request.getName()) ? definition.getLabel() : request.getName().trim())
                .jobType(definition.getJobType())
                .shopId(request.getShopId())
                .options(options)
                .frequency(frequency)
                .cronExpression(cron)
                .timezone(timezone)
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();

        schedule = scheduleRepository.save(schedule);
        log.info("Created schedule {} ({}) with cron '{}' in {}", schedule.getId(), schedule.getJobType(), cron, timezone);

        return mapper.toResponse(schedule);
    }

    @Transactional
    public JobScheduleResponse update(UUID scheduleId, UpdateJobScheduleRequest request) {
        var schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new JobScheduleNotFoundException(scheduleId));
        var definition = catalog.getOrThrow(schedule.getJobType());

        if (!isBlank(request.getName())) {
            schedule.setName(request.getName().trim());
        }
        if (request.getShopId() != null) {
            requireShopSupport(definition, request.getShopId());
            schedule.setShopId(request.getShopId());
        }
        if (request.getFrequency() != null || !isBlank(request.getCronExpression())) {
            var frequency = request.getFrequency() != null ? request.getFrequency() : schedule.getFrequency();
            schedule.setFrequency(frequency);
            schedule.setCronExpression(resolveCron(definition, frequency, request.getCronExpression()));
        }
        if (!isBlank(request.getTimezone())) {
            requireValidTimezone(request.getTimezone().trim());
            schedule.setTimezone(request.getTimezone().trim());
        }
        if (request.getOptions() != null) {
            var options = new HashMap<String, Object>();
            if (schedule.getOptions() != null) {
                options.putAll(schedule.getOptions());
            }
            options.putAll(request.getOptions());
            requireValidOptions(schedule.getJobType(), options);
            schedule.setOptions(options);
        }
        if (request.getEnabled() != null) {
            schedule.setEnabled(request.getEnabled());
        }

        log.info("Updated schedule {} ({})", scheduleId, schedule.getJobType());
        return mapper.toResponse(scheduleRepository.save(schedule));
    }

    @Transactional(readOnly = true)
    public JobScheduleResponse get(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .map(mapper::toResponse)
                .orElseThrow(() -> new JobScheduleNotFoundException(scheduleId));
    }

    @Transactional(readOnly = true)
    public List<JobScheduleResponse> list() {
        return mapper.toResponseList(scheduleRepository.findAllByOrderByJobTypeAscNameAsc());
    }

    /**
     * Pause or resume automation. A run already queued is not cancelled.
     */
    @Transactional
    public JobScheduleResponse setEnabled(UUID scheduleId, boolean enabled) {
        if (scheduleRepository.updateEnabled(scheduleId, enabled, clock.instant()) == 0) {
            throw new JobScheduleNotFoundException(scheduleId);
        }
        log.info("Schedule {} {}", scheduleId, enabled ? "enabled" : "disabled");
        return get(scheduleId);
    }

    /**
     * Delete a schedule; deleting an absent schedule is a no-op.
     *
     * @return true if a schedule was deleted
     */
    @Transactional
    public boolean delete(UUID scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            log.debug("Schedule {} already absent", scheduleId);
            return false;
        }
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
        return true;
    }

    public List<JobTypeResponse> catalog() {
        return catalog.all().stream()
                .map(definition -> {
                    var response = mapper.toJobTypeResponse(definition);
                    response.setRoutable(handlerRegistry.hasHandler(definition.getJobType()));
                    return response;
                })
                .toList();
    }

    private String resolveCron(JobTypeDefinition definition, ScheduleFrequency frequency, String requestedCron) {
        String cron;
        if (!isBlank(requestedCron)) {
            cron = requestedCron.trim();
        } else if (frequency == definition.getDefaultFrequency() || frequency.getDefaultCronExpression() == null) {
            cron = definition.getDefaultCron();
        } else {
            cron = frequency.getDefaultCronExpression();
        }

        if (!dueEvaluator.isValidCron(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron);
        }
        return cron;
    }

    private void requireValidTimezone(String timezone) {
        if (!dueEvaluator.isValidTimezone(timezone)) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone);
        }
    }

    private void requireShopSupport(JobTypeDefinition definition, Long shopId) {
        if (shopId != null && !definition.isSupportsShop()) {
            throw new IllegalArgumentException("Job type " + definition.getJobType() + " cannot be limited to a shop");
        }
    }

    private void requireValidOptions(String jobType, Map<String, Object> options) {
        var errors = catalog.validateOptions(jobType, options);
        if (!errors.isEmpty()) {
            var details = errors.entrySet().stream()
                    .map(entry -> entry.getKey() + " " + entry.getValue())
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid options for " + jobType + ": " + details);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
