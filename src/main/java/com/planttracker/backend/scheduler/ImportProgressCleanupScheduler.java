package com.planttracker.backend.scheduler;

import com.planttracker.backend.config.ImportProperties;
import com.planttracker.backend.services.imports.ImportProgressStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts finished import jobs from the progress store.
 * Runs every {@code plant-import.progress-sweep-interval} (10 minutes by default).
 */
@Component
@Slf4j
public class ImportProgressCleanupScheduler {

    private final ImportProgressStore progressStore;
    private final ImportProperties properties;

    public ImportProgressCleanupScheduler(ImportProgressStore progressStore, ImportProperties properties) {
        this.progressStore = progressStore;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${plant-import.progress-sweep-interval:PT10M}",
            initialDelayString = "${plant-import.progress-sweep-interval:PT10M}")
    public void cleanupFinishedImports() {
        log.debug("Starting import progress cleanup...");

        try {
            int removed = progressStore.cleanup(properties.progressRetention());
            if (removed > 0) {
                log.info("Import progress cleanup completed. Removed {} finished jobs, {} remaining.",
                        removed, progressStore.size());
            }
        } catch (Exception e) {
            log.error("Error during import progress cleanup: {}", e.getMessage(), e);
        }
    }
}
