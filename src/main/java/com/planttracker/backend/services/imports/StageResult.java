package com.planttracker.backend.services.imports;

import com.planttracker.backend.dto.imports.ImportError;

import java.util.List;

/**
 * Success-or-failure value returned by pipeline stages instead of throwing.
 * A successful result may still carry warnings; a failed one carries at least one error.
 */
public final class StageResult<T> {

    private final T value;
    private final List<ImportError> errors;
    private final List<ImportError> warnings;

    private StageResult(T value, List<ImportError> errors, List<ImportError> warnings) {
        this.value = value;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public static <T> StageResult<T> success(T value, List<ImportError> warnings) {
        return new StageResult<>(value, List.of(), warnings);
    }

    public static <T> StageResult<T> failure(List<ImportError> errors, List<ImportError> warnings) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one error");
        }
        return new StageResult<>(null, errors, warnings);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on a failed result");
        }
        return value;
    }

    public List<ImportError> getErrors() { return errors; }
    public List<ImportError> getWarnings() { return warnings; }
}
