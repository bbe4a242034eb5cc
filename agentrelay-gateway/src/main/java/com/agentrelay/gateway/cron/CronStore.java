package com.agentrelay.gateway.cron;

import com.agentrelay.common.infra.JsonFile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Job store: one JSON array of {@link ScheduledJob} records.
 *
 * <p>
 * A missing, blank or corrupt file loads as an empty list; save failures are logged.
 * </p>
 */
@Slf4j
public class CronStore {

    public static final String DEFAULT_FILE_NAME = "cron-jobs.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path storePath;

    public CronStore(Path storePath) {
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }

    public List<ScheduledJob> load() {
        try {
            String content = JsonFile.readIfPresent(storePath);
            if (content == null) {
                log.debug("Cron store file not found or empty: {}", storePath);
                return new ArrayList<>();
            }
            List<ScheduledJob> jobs = MAPPER.readValue(content, new TypeReference<List<ScheduledJob>>() {
            });
            List<ScheduledJob> valid = new ArrayList<>();
            for (ScheduledJob job : jobs) {
                if (job == null || job.getId() == null) {
                    log.warn("Skipping cron job entry without id in {}", storePath);
                    continue;
                }
                valid.add(job);
            }
            return valid;
        } catch (IOException e) {
            log.error("Failed to load cron store from {}: {}", storePath, e.getMessage());
            return new ArrayList<>();
        }
    }

    public void save(Collection<ScheduledJob> jobs) {
        try {
            JsonFile.save(MAPPER, storePath, new ArrayList<>(jobs));
            log.debug("Saved cron store to {} ({} jobs)", storePath, jobs.size());
        } catch (IOException e) {
            log.error("Failed to save cron store to {}: {}", storePath, e.getMessage());
        }
    }
}
