package com.planttracker.backend.dto.imports;

import com.planttracker.backend.enums.DateFormatPreference;
import com.planttracker.backend.enums.DuplicateHandling;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-job import options. Unset fields fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportConfig {

    @Builder.Default
    private Boolean skipEmptyRows = true;

    @DecimalMin(value = "0.0", message = "Matching threshold must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Matching threshold must be between 0 and 1")
    private Double matchingThreshold;

    @DecimalMin(value = "0.0", message = "Tie epsilon must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Tie epsilon must be between 0 and 1")
    private Double tieEpsilon;

    @Builder.Default
    private Boolean createMissingPlants = true;

    @Builder.Default
    private DuplicateHandling handleDuplicates = DuplicateHandling.SKIP;

    @Builder.Default
    private DateFormatPreference dateFormat = DateFormatPreference.AUTO;

    public static ImportConfig defaults() {
        return ImportConfig.builder().build();
    }
}
