package io.cortexr.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.File;

/**
 * Storage for JobRunr. The jobrunr-spring-boot-3-starter builds its StorageProvider from
 * this SQLite DataSource.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSource dataSource(
            @Value("${cortex.jobs.database-url:jdbc:sqlite:./data/jobs.db}") String url
    ) {
        ensureParentDirectory(url);
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("Job storage DataSource configured: {}", url);
        return ds;
    }

    private static void ensureParentDirectory(String url) {
        if (!url.startsWith(SQLITE_PREFIX) || url.contains(":memory:")) {
            return;
        }
        File parent = new File(url.substring(SQLITE_PREFIX.length())).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            log.warn("Could not create directory for job storage: {}", parent);
        }
    }
}
