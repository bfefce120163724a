package com.planttracker.backend.controllers;

import com.planttracker.backend.config.ImportProperties;
import com.planttracker.backend.dto.imports.ConflictResolutionBatch;
import com.planttracker.backend.dto.imports.ImportConfig;
import com.planttracker.backend.dto.imports.ImportProgress;
import com.planttracker.backend.dto.imports.ImportStartResponse;
import com.planttracker.backend.dto.imports.ImportSummary;
import com.planttracker.backend.dto.imports.SuggestedResolution;
import com.planttracker.backend.dto.imports.ValidateCsvRequest;
import com.planttracker.backend.dto.imports.ValidationReport;
import com.planttracker.backend.enums.DateFormatPreference;
import com.planttracker.backend.enums.DuplicateHandling;
import com.planttracker.backend.enums.ImportType;
import com.planttracker.backend.services.imports.ConflictResolutionService;
import com.planttracker.backend.services.imports.CsvImportService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/imports/csv")
public class CsvImportController {

    private static final Logger logger = LoggerFactory.getLogger(CsvImportController.class);

    static final String USER_HEADER = "X-User-Id";
    private static final Set<String> ALLOWED_CONTENT_TYPES = Set.of("text/csv", "application/vnd.ms-excel", "text/plain");

    @Autowired
    private CsvImportService csvImportService;

    @Autowired
    private ConflictResolutionService conflictResolutionService;

    @Autowired
    private ImportProperties importProperties;

    /**
     * Upload a CSV file and start an import job. Poll the returned job id for progress.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportStartResponse> startImport(
            @RequestHeader(USER_HEADER) Long userId,
            @RequestParam("file") MultipartFile file,
            @RequestParam("importType") String importType,
            @RequestParam(required = false) Boolean skipEmptyRows,
            @RequestParam(required = false) Double matchingThreshold,
            @RequestParam(required = false) Double tieEpsilon,
            @RequestParam(required = false) Boolean createMissingPlants,
            @RequestParam(required = false) String handleDuplicates,
            @RequestParam(required = false) String dateFormat) throws IOException {

        validateUpload(file);
        ImportType type = ImportType.fromValue(importType);

        ImportConfig config = ImportConfig.builder()
                .skipEmptyRows(skipEmptyRows != null ? skipEmptyRows : Boolean.TRUE)
                .matchingThreshold(checkFraction("matchingThreshold", matchingThreshold))
                .tieEpsilon(checkFraction("tieEpsilon", tieEpsilon))
                .createMissingPlants(createMissingPlants != null ? createMissingPlants : Boolean.TRUE)
                .handleDuplicates(handleDuplicates != null ? DuplicateHandling.fromValue(handleDuplicates) : DuplicateHandling.SKIP)
                .dateFormat(DateFormatPreference.fromValue(dateFormat))
                .build();

        String jobId = csvImportService.startImport(file.getBytes(), file.getOriginalFilename(), type, config, userId);
        ImportProgress progress = csvImportService.getProgress(jobId, userId);

        logger.info("User {} started {} import {} from '{}'", userId, type.getValue(), jobId, file.getOriginalFilename());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ImportStartResponse(jobId, progress));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ImportProgress> getImportStatus(@PathVariable String jobId,
                                                          @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(csvImportService.getProgress(jobId, userId));
    }

    @GetMapping
    public ResponseEntity<List<ImportProgress>> getImports(@RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(csvImportService.getImportsForUser(userId));
    }

    /**
     * Dry run: validation and matching without writing anything
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validateCsv(@RequestHeader(USER_HEADER) Long userId,
                                                        @Valid @RequestBody ValidateCsvRequest request) {
        ImportType type = ImportType.fromValue(request.getImportType());
        ValidationReport report = csvImportService.validateOnly(request.getCsvContent(), type, request.getConfig(), userId);

        logger.debug("User {} validated {} CSV: {} records, {} errors, {} conflicts", userId, type.getValue(),
                report.getRecordCount(), report.getErrors().size(), report.getConflicts().size());

        return ResponseEntity.ok(report);
    }

    @GetMapping("/{jobId}/conflicts")
    public ResponseEntity<List<SuggestedResolution>> getConflictSuggestions(@PathVariable String jobId,
                                                                            @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(conflictResolutionService.getSuggestedResolutions(jobId, userId));
    }

    @PostMapping("/{jobId}/conflicts")
    public ResponseEntity<ImportSummary> resolveConflicts(@PathVariable String jobId,
                                                          @RequestHeader(USER_HEADER) Long userId,
                                                          @Valid @RequestBody ConflictResolutionBatch batch) {
        ImportSummary summary = conflictResolutionService.resolveConflicts(jobId, userId, batch.getResolutions());

        logger.info("User {} resolved conflicts of import {}: {} applied, {} skipped, {} errors", userId, jobId,
                summary.getSuccessfulImports(), summary.getSkippedRows(), summary.getErrors().size());

        return ResponseEntity.ok(summary);
    }

    private void validateUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file provided");
        }
        if (file.getSize() > importProperties.maxFileSizeBytes()) {
            throw new IllegalArgumentException("File too large. Maximum size is "
                    + (importProperties.maxFileSizeBytes() / (1024 * 1024)) + "MB");
        }
        String contentType = file.getContentType();
        if (contentType == null || !ALLOWED_CONTENT_TYPES.contains(baseType(contentType))) {
            throw new IllegalArgumentException("Invalid file type. Only CSV files are allowed");
        }
    }

    private static String baseType(String contentType) {
        int separator = contentType.indexOf(';');
        return (separator >= 0 ? contentType.substring(0, separator) : contentType).trim().toLowerCase();
    }

    private static Double checkFraction(String name, Double value) {
        if (value != null && (value < 0.0 || value > 1.0)) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
        return value;
    }
}
