package io.cortexr.memory;

import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recurring JobRunr job that indexes session logs completed since the last run.
 */
@Component
public class MemoryIndexRefreshJob {

    private static final Logger log = LoggerFactory.getLogger(MemoryIndexRefreshJob.class);

    private final MemoryIndex memoryIndex;

    public MemoryIndexRefreshJob(MemoryIndex memoryIndex) {
        this.memoryIndex = memoryIndex;
    }

    @Job(name = "Memory index refresh")
    public void execute() {
        try {
            int added = memoryIndex.ensureFresh();
            if (added > 0) {
                log.info("Memory index refresh added {} pair(s)", added);
            } else {
                log.debug("Memory index refresh found nothing new");
            }
        } catch (IndexUnavailableException e) {
            log.warn("Memory index refresh skipped: {}", e.getMessage());
        }
    }
}
