package com.planttracker.backend.services.imports;

import com.planttracker.backend.dto.imports.ImportProgress;
import com.planttracker.backend.exceptions.ImportNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local registry of import jobs.
 *
 * Entries are immutable {@link ImportProgress} snapshots replaced atomically, so pollers
 * always read a complete entry while the owning job writes. Nothing survives a restart;
 * callers report a missing id as unknown or expired.
 */
@Component
@Slf4j
public class ImportProgressStore {

    private final Map<String, ImportProgress> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public ImportProgressStore(Clock clock) {
        this.clock = clock;
    }

    public void set(String jobId, ImportProgress progress) {
        entries.put(jobId, Objects.requireNonNull(progress, "progress"));
    }

    public Optional<ImportProgress> get(String jobId) {
        return Optional.ofNullable(entries.get(jobId));
    }

    /**
     * Replaces the entry with {@code updater.apply(current)} in one atomic step
     *
     * @throws ImportNotFoundException when the entry is gone
     */
    public ImportProgress update(String jobId, UnaryOperator<ImportProgress> updater) {
        ImportProgress updated = entries.computeIfPresent(jobId, (id, current) -> updater.apply(current));
        if (updated == null) {
            throw new ImportNotFoundException(jobId);
        }
        return updated;
    }

    /**
     * Jobs of one user, newest first
     */
    public List<ImportProgress> getAllForUser(Long userId) {
        return entries.values().stream()
                .filter(progress -> Objects.equals(progress.getUserId(), userId))
                .sorted(Comparator.comparing(ImportProgress::getStartTime,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public void delete(String jobId) {
        entries.remove(jobId);
    }

    /**
     * Evicts completed and failed jobs that finished more than {@code maxAge} ago.
     * Pending and processing jobs stay regardless of age.
     *
     * @return number of evicted entries
     */
    public int cleanup(Duration maxAge) {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(maxAge);
        int before = entries.size();
        entries.values().removeIf(progress -> isExpired(progress, cutoff));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Evicted {} finished import jobs older than {}", removed, maxAge);
        }
        return Math.max(removed, 0);
    }

    public int size() {
        return entries.size();
    }

    private static boolean isExpired(ImportProgress progress, OffsetDateTime cutoff) {
        if (!progress.isTerminal()) {
            return false;
        }
        OffsetDateTime finishedAt = progress.getEndTime() != null ? progress.getEndTime() : progress.getStartTime();
        return finishedAt != null && finishedAt.isBefore(cutoff);
    }
}
