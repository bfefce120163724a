package com.planttracker.backend.dto.imports;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.planttracker.backend.enums.ImportStatus;
import com.planttracker.backend.enums.ImportType;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Live view of one import job. Instances are immutable; the progress store swaps
 * in a new snapshot on every update so pollers never see a half-written entry.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportProgress {
    String id;
    Long userId;
    String fileName;
    ImportType importType;
    ImportStatus status;
    double progress;
    int totalRows;
    int processedRows;
    List<ImportError> errors;
    List<ImportConflict> conflicts;
    OffsetDateTime startTime;
    OffsetDateTime endTime;
    ImportSummary summary;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
