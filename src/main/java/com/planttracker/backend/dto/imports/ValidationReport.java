package com.planttracker.backend.dto.imports;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Dry-run outcome: validation and matching without persistence
 */
@Value
@Builder
public class ValidationReport {
    boolean valid;
    int recordCount;
    List<ImportError> errors;
    List<ImportError> warnings;
    List<ImportConflict> conflicts;
}
