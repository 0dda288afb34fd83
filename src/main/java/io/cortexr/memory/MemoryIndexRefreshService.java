package io.cortexr.memory;

import io.cortexr.config.CortexProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers the memory index refresh as a recurring JobRunr job on startup, so completed
 * sessions become searchable without waiting for the next query.
 */
@Service
public class MemoryIndexRefreshService {

    private static final Logger log = LoggerFactory.getLogger(MemoryIndexRefreshService.class);
    static final String REFRESH_JOB_ID = "memory-index-refresh";

    private final JobScheduler jobScheduler;
    private final int intervalMinutes;
    private final boolean enabled;

    public MemoryIndexRefreshService(JobScheduler jobScheduler, CortexProperties properties) {
        this.jobScheduler = jobScheduler;
        this.intervalMinutes = properties.memory().refreshIntervalMinutes();
        this.enabled = properties.memory().refreshEnabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Memory index refresh disabled via configuration");
            return;
        }
        String cronExpression = buildCronExpression(intervalMinutes);
        jobScheduler.<MemoryIndexRefreshJob>scheduleRecurrently(REFRESH_JOB_ID,
                cronExpression,
                x -> x.execute());
        log.info("Memory index refresh registered with cron: {}", cronExpression);
    }

    /**
     * Builds a cron expression for an interval in minutes. Intervals of an hour or more
     * are rounded down to whole hours.
     */
    static String buildCronExpression(int intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("Refresh interval must be positive");
        }
        if (intervalMinutes < 60) {
            return "*/%d * * * *".formatted(intervalMinutes);
        }
        int hours = Math.min(intervalMinutes / 60, 23);
        return "0 */%d * * *".formatted(hours);
    }
}
