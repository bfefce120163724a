package com.planttracker.backend.dto.imports;

import com.planttracker.backend.enums.ImportType;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

@Value
@Builder
public class ImportSummary {
    int totalRows;
    int processedRows;
    int successfulImports;
    int skippedRows;
    List<ImportError> errors;
    List<ImportError> warnings;
    List<ImportConflict> conflicts;
    ImportType importType;
    OffsetDateTime startTime;
    OffsetDateTime endTime;
    Long userId;
}
