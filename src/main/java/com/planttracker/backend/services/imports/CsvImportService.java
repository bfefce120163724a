package com.planttracker.backend.services.imports;

import com.planttracker.backend.config.ImportProperties;
import com.planttracker.backend.dto.imports.ImportConfig;
import com.planttracker.backend.dto.imports.ImportConflict;
import com.planttracker.backend.dto.imports.ImportError;
import com.planttracker.backend.dto.imports.ImportProgress;
import com.planttracker.backend.dto.imports.ImportSummary;
import com.planttracker.backend.dto.imports.PlantMatchResult;
import com.planttracker.backend.dto.imports.ValidationReport;
import com.planttracker.backend.enums.DateFormatPreference;
import com.planttracker.backend.enums.DuplicateHandling;
import com.planttracker.backend.enums.ImportStatus;
import com.planttracker.backend.enums.ImportType;
import com.planttracker.backend.exceptions.CatalogUnavailableException;
import com.planttracker.backend.exceptions.CsvImportException;
import com.planttracker.backend.exceptions.ImportAccessDeniedException;
import com.planttracker.backend.exceptions.ImportNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs CSV imports: parse, validate, match, resolve and persist, one row at a time in file order.
 *
 * A job goes pending -> processing -> completed | failed and reaches a terminal state exactly once.
 * Row problems are recorded and the job moves on; only structural failures (unreadable file,
 * unrecognized columns, unreachable catalog) fail the job.
 */
@Service
@Slf4j
public class CsvImportService {

    private static final String DEFAULT_FILE_NAME = "import.csv";
    private static final int FILE_LEVEL_ROW = -1;

    private final CsvParser csvParser;
    private final RowSchemaValidator rowValidator;
    private final PlantMatcher plantMatcher;
    private final ImportConflictResolver conflictResolver;
    private final PlantCatalogGateway catalogGateway;
    private final ImportProgressStore progressStore;
    private final ImportProperties properties;
    private final TaskExecutor importTaskExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CsvImportService(CsvParser csvParser,
                            RowSchemaValidator rowValidator,
                            PlantMatcher plantMatcher,
                            ImportConflictResolver conflictResolver,
                            PlantCatalogGateway catalogGateway,
                            ImportProgressStore progressStore,
                            ImportProperties properties,
                            @Qualifier("importTaskExecutor") TaskExecutor importTaskExecutor,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        this.csvParser = csvParser;
        this.rowValidator = rowValidator;
        this.plantMatcher = plantMatcher;
        this.conflictResolver = conflictResolver;
        this.catalogGateway = catalogGateway;
        this.progressStore = progressStore;
        this.properties = properties;
        this.importTaskExecutor = importTaskExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    enum RowOutcome {
        PERSISTED, SKIPPED, CONFLICTED, ERRORED
    }

    // ---------------------------------------------------------------------
    // Job lifecycle
    // ---------------------------------------------------------------------

    /**
     * Registers a pending job and hands it to the import executor. Returns without waiting
     * for any row to be processed.
     *
     * @return the new job id
     */
    public String startImport(byte[] content, String fileName, ImportType importType,
                              ImportConfig config, Long userId) {
        if (importType == null) {
            throw new IllegalArgumentException("Import type is required");
        }
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("File is empty");
        }
        if (content.length > properties.maxFileSizeBytes()) {
            throw new IllegalArgumentException("File too large. Maximum size is "
                    + (properties.maxFileSizeBytes() / (1024 * 1024)) + "MB");
        }

        ImportConfig effectiveConfig = config != null ? config : ImportConfig.defaults();
        String jobId = UUID.randomUUID().toString();
        String name = fileName != null && !fileName.isBlank() ? fileName : DEFAULT_FILE_NAME;

        progressStore.set(jobId, ImportProgress.builder()
                .id(jobId)
                .userId(userId)
                .fileName(name)
                .importType(importType)
                .status(ImportStatus.PENDING)
                .progress(0)
                .errors(List.of())
                .conflicts(List.of())
                .startTime(now())
                .build());

        log.info("Queued {} import {} ({} bytes) for user {}", importType.getValue(), jobId, content.length, userId);

        try {
            importTaskExecutor.execute(() -> runImport(jobId, content, importType, effectiveConfig, userId));
        } catch (TaskRejectedException e) {
            log.warn("Import executor rejected job {}: {}", jobId, e.getMessage());
            ImportRun run = new ImportRun(jobId, importType, effectiveConfig, userId, false);
            failJob(run, "Import queue is full, try again later");
        }

        return jobId;
    }

    /**
     * @param userId caller, or null to skip the ownership check
     * @throws ImportNotFoundException     unknown or expired job
     * @throws ImportAccessDeniedException job of another user
     */
    public ImportProgress getProgress(String jobId, Long userId) {
        ImportProgress progress = progressStore.get(jobId)
                .orElseThrow(() -> new ImportNotFoundException(jobId));
        if (userId != null && !Objects.equals(progress.getUserId(), userId)) {
            throw new ImportAccessDeniedException(jobId);
        }
        return progress;
    }

    public List<ImportProgress> getImportsForUser(Long userId) {
        return progressStore.getAllForUser(userId);
    }

    /**
     * Job body. Never throws: every failure ends in a terminal progress entry.
     */
    void runImport(String jobId, byte[] content, ImportType importType, ImportConfig config, Long userId) {
        ImportRun run = new ImportRun(jobId, importType, config, userId, false);

        try {
            progressStore.update(jobId, current -> current.toBuilder().status(ImportStatus.PROCESSING).build());

            CsvParser.ParsedCsvData parsed = parseAndCheckColumns(
                    new String(content, StandardCharsets.UTF_8), importType);
            run.totalRows = parsed.getRowCount();
            progressStore.update(jobId, current -> current.toBuilder().totalRows(run.totalRows).build());
            log.info("Processing import {}: {} rows, delimiter '{}'", jobId, run.totalRows, parsed.getDelimiter());

            run.snapshot = catalogGateway.getCatalogSnapshot();

            List<Map<String, String>> rows = parsed.getRows();
            for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
                RowOutcome outcome = processRow(run, rows.get(rowIndex), rowIndex);
                run.record(outcome);
                countRow(outcome);
                publishProgress(run);
            }

            completeJob(run);

        } catch (CsvImportException e) {
            log.error("Import {} failed: {}", jobId, e.getMessage());
            failJob(run, e.getMessage());
        } catch (CatalogUnavailableException e) {
            log.error("Import {} failed after {} of {} rows: {}", jobId, run.processedRows, run.totalRows, e.getMessage(), e);
            failJob(run, e.getMessage());
        } catch (ImportNotFoundException e) {
            log.warn("Import {} was removed from the progress store while running", jobId);
        } catch (RuntimeException e) {
            log.error("Import {} failed unexpectedly", jobId, e);
            failJob(run, "Unexpected error: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------------
    // Dry run
    // ---------------------------------------------------------------------

    /**
     * Parses, validates, matches and classifies every row without writing anything.
     * Two calls on the same content and catalog return the same errors and conflicts.
     */
    public ValidationReport validateOnly(String csvContent, ImportType importType, ImportConfig config, Long userId) {
        if (importType == null) {
            throw new IllegalArgumentException("Import type is required");
        }
        ImportRun run = new ImportRun(null, importType, config != null ? config : ImportConfig.defaults(), userId, true);

        CsvParser.ParsedCsvData parsed = parseAndCheckColumns(csvContent, importType);
        run.totalRows = parsed.getRowCount();
        run.snapshot = catalogGateway.getCatalogSnapshot();

        List<Map<String, String>> rows = parsed.getRows();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            run.record(processRow(run, rows.get(rowIndex), rowIndex));
        }

        log.debug("Validated {} rows for user {}: {} records, {} errors, {} conflicts", run.totalRows, userId,
                run.successfulImports, run.errors.size(), run.conflicts.size());

        return ValidationReport.builder()
                .valid(run.errors.stream().noneMatch(ImportError::isBlocking))
                .recordCount(run.successfulImports)
                .errors(List.copyOf(run.errors))
                .warnings(List.copyOf(run.warnings))
                .conflicts(List.copyOf(run.conflicts))
                .build();
    }

    // ---------------------------------------------------------------------
    // Row pipeline
    // ---------------------------------------------------------------------

    /**
     * Puts the row into exactly one bucket. Any unexpected exception is converted into an
     * error of this row; only an unreachable catalog escapes.
     */
    RowOutcome processRow(ImportRun run, Map<String, String> row, int rowIndex) {
        try {
            if (!Boolean.FALSE.equals(run.config.getSkipEmptyRows()) && rowValidator.isEmptyRow(row, run.importType)) {
                return RowOutcome.SKIPPED;
            }

            StageResult<ProcessedRecord> validated = rowValidator.validate(row, rowIndex, run.importType, run.dateFormat());
            run.warnings.addAll(validated.getWarnings());
            if (!validated.isSuccess()) {
                run.errors.addAll(validated.getErrors());
                return RowOutcome.ERRORED;
            }

            ProcessedRecord record = validated.getValue();
            PlantMatchResult matchResult = plantMatcher.match(record, run.snapshot, run.matchOptions());
            ResolvedOutcome outcome = conflictResolver.resolve(record, matchResult, run.importType,
                    run.policy(), run.userId);

            if (outcome instanceof ResolvedOutcome.Conflict conflict) {
                run.conflicts.add(conflict.conflict());
                return RowOutcome.CONFLICTED;
            }
            if (outcome instanceof ResolvedOutcome.Error error) {
                run.errors.add(error.error());
                return RowOutcome.ERRORED;
            }

            ResolvedOutcome.Persist persist = (ResolvedOutcome.Persist) outcome;
            run.warnings.addAll(persist.warnings());
            if (!run.dryRun) {
                persist(run, persist);
            }
            return RowOutcome.PERSISTED;

        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Row {} of import {} failed unexpectedly", rowIndex, run.jobId, e);
            run.errors.add(ImportError.error(rowIndex, null, "Failed to import row: " + e.getMessage()));
            return RowOutcome.ERRORED;
        }
    }

    /**
     * Writes the row. Plants created here join the run's snapshot so later rows of the same
     * file match them instead of creating a second copy.
     */
    private void persist(ImportRun run, ResolvedOutcome.Persist persist) {
        ProcessedRecord record = persist.record();
        Long plantId = persist.matchedPlantId();

        if (persist.createsPlant()) {
            CatalogPlant created = catalogGateway.persistTaxonomy(record, run.userId);
            run.snapshot = run.snapshot.withPlant(created);
            plantId = created.getId();
        }

        if (record instanceof PlantInstanceRecord instance) {
            catalogGateway.persistInstance(instance, plantId, run.userId);
        } else if (record instanceof PropagationRecord propagation) {
            catalogGateway.persistPropagation(propagation, plantId, persist.parentInstanceId(), run.userId);
        }
    }

    private CsvParser.ParsedCsvData parseAndCheckColumns(String content, ImportType importType) {
        CsvParser.ParsedCsvData parsed = csvParser.parse(content, properties.maxRows());
        if (!rowValidator.recognizes(parsed.getHeaders(), importType)) {
            throw new CsvImportException("None of the columns " + parsed.getHeaders()
                    + " belong to a " + importType.getDisplayName() + " import");
        }
        return parsed;
    }

    // ---------------------------------------------------------------------
    // Progress and terminal transitions
    // ---------------------------------------------------------------------

    private void publishProgress(ImportRun run) {
        double percent = run.totalRows == 0 ? 100.0 : (run.processedRows * 100.0) / run.totalRows;
        List<ImportError> errors = List.copyOf(run.errors);
        List<ImportConflict> conflicts = List.copyOf(run.conflicts);
        progressStore.update(run.jobId, current -> current.toBuilder()
                .processedRows(run.processedRows)
                .progress(Math.max(current.getProgress(), percent))
                .errors(errors)
                .conflicts(conflicts)
                .build());
    }

    private void completeJob(ImportRun run) {
        OffsetDateTime endTime = now();
        boolean transitioned = finish(run, ImportStatus.COMPLETED, endTime, run.errors);
        if (transitioned) {
            log.info("Import {} completed: {} rows, {} imported, {} skipped, {} conflicts, {} errored rows",
                    run.jobId, run.totalRows, run.successfulImports, run.skippedRows,
                    run.conflicts.size(), run.erroredRows);
        }
    }

    private void failJob(ImportRun run, String reason) {
        List<ImportError> errors = new ArrayList<>(run.errors);
        errors.add(ImportError.error(FILE_LEVEL_ROW, null, reason));
        finish(run, ImportStatus.FAILED, now(), errors);
    }

    /**
     * Moves the job to a terminal state unless it already is in one
     *
     * @return whether this call made the transition
     */
    private boolean finish(ImportRun run, ImportStatus status, OffsetDateTime endTime, List<ImportError> errors) {
        boolean[] transitioned = {false};
        try {
            progressStore.update(run.jobId, current -> {
                if (current.isTerminal()) {
                    return current;
                }
                transitioned[0] = true;
                ImportSummary summary = ImportSummary.builder()
                        .totalRows(run.totalRows)
                        .processedRows(run.processedRows)
                        .successfulImports(run.successfulImports)
                        .skippedRows(run.skippedRows)
                        .errors(List.copyOf(errors))
                        .warnings(List.copyOf(run.warnings))
                        .conflicts(List.copyOf(run.conflicts))
                        .importType(run.importType)
                        .startTime(current.getStartTime())
                        .endTime(endTime)
                        .userId(run.userId)
                        .build();
                return current.toBuilder()
                        .status(status)
                        .progress(status == ImportStatus.COMPLETED ? 100.0 : current.getProgress())
                        .processedRows(run.processedRows)
                        .totalRows(run.totalRows)
                        .errors(summary.getErrors())
                        .conflicts(summary.getConflicts())
                        .endTime(endTime)
                        .summary(summary)
                        .build();
            });
        } catch (ImportNotFoundException e) {
            log.warn("Import {} left the progress store before reaching {}", run.jobId, status.getValue());
            return false;
        }

        if (transitioned[0]) {
            Counter.builder("plant_import.jobs")
                    .description("Number of finished CSV import jobs")
                    .tag("status", status.getValue())
                    .tag("import_type", run.importType.getValue())
                    .register(meterRegistry)
                    .increment();
        }
        return transitioned[0];
    }

    private void countRow(RowOutcome outcome) {
        Counter.builder("plant_import.rows")
                .description("Number of CSV rows processed by import jobs")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    // ---------------------------------------------------------------------
    // Per-run state
    // ---------------------------------------------------------------------

    /**
     * Mutable accumulator owned by the single thread running one job
     */
    final class ImportRun {
        final String jobId;
        final ImportType importType;
        final ImportConfig config;
        final Long userId;
        final boolean dryRun;

        CatalogSnapshot snapshot = CatalogSnapshot.empty();
        final List<ImportError> errors = new ArrayList<>();
        final List<ImportError> warnings = new ArrayList<>();
        final List<ImportConflict> conflicts = new ArrayList<>();

        int totalRows;
        int processedRows;
        int successfulImports;
        int skippedRows;
        int erroredRows;

        private final double threshold;
        private final double tieEpsilon;

        ImportRun(String jobId, ImportType importType, ImportConfig config, Long userId, boolean dryRun) {
            this.jobId = jobId;
            this.importType = importType;
            this.config = config;
            this.userId = userId;
            this.dryRun = dryRun;

            double configured = config.getMatchingThreshold() != null
                    ? config.getMatchingThreshold()
                    : properties.matchingThreshold();
            // Propagation names are often nicknames, so they match on a lower bar
            this.threshold = importType == ImportType.PROPAGATIONS
                    ? Math.min(properties.propagationMatchingThreshold(), configured)
                    : configured;
            this.tieEpsilon = config.getTieEpsilon() != null ? config.getTieEpsilon() : properties.tieEpsilon();
        }

        void record(RowOutcome outcome) {
            processedRows++;
            switch (outcome) {
                case PERSISTED -> successfulImports++;
                case SKIPPED -> skippedRows++;
                case ERRORED -> erroredRows++;
                case CONFLICTED -> { }
            }
        }

        DateFormatPreference dateFormat() {
            return config.getDateFormat() != null ? config.getDateFormat() : DateFormatPreference.AUTO;
        }

        PlantMatcher.MatchOptions matchOptions() {
            return PlantMatcher.MatchOptions.from(properties, threshold, tieEpsilon,
                    importType == ImportType.PROPAGATIONS);
        }

        ImportConflictResolver.Policy policy() {
            return ImportConflictResolver.Policy.builder()
                    .handleDuplicates(config.getHandleDuplicates() != null
                            ? config.getHandleDuplicates()
                            : DuplicateHandling.SKIP)
                    .createMissingPlants(!Boolean.FALSE.equals(config.getCreateMissingPlants()))
                    .threshold(threshold)
                    .tieEpsilon(tieEpsilon)
                    .build();
        }
    }
}
