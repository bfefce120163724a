package com.planttracker.backend.dto.imports;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.planttracker.backend.enums.ErrorSeverity;
import lombok.Builder;
import lombok.Value;

/**
 * Row/field scoped validation failure. Errors block persistence of the row, warnings do not.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportError {
    int rowIndex;
    String field;
    String message;
    ErrorSeverity severity;
    String originalValue;

    public static ImportError error(int rowIndex, String field, String message) {
        return ImportError.builder()
                .rowIndex(rowIndex)
                .field(field)
                .message(message)
                .severity(ErrorSeverity.ERROR)
                .build();
    }

    public static ImportError warning(int rowIndex, String field, String message) {
        return ImportError.builder()
                .rowIndex(rowIndex)
                .field(field)
                .message(message)
                .severity(ErrorSeverity.WARNING)
                .build();
    }

    public boolean isBlocking() {
        return severity == ErrorSeverity.ERROR;
    }
}
