package com.example.jobscheduler.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One lock provider backs two kinds of locks:
 * - @SchedulerLock on the schedule sweep and the retry sweep (one replica per tick)
 * - per-kind overlap locks taken by the job executor around each run
 * <p>
 * Lock expiry uses database time so replicas with drifting clocks agree.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(JdbcTemplate jdbcTemplate, JobSchedulerProperties properties) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(jdbcTemplate)
                        .withTableName(properties.getLockTable())
                        .usingDbTime()
                        .build()
        );
    }
}
