package com.planttracker.backend.dto.imports;

import com.planttracker.backend.enums.SuggestedAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reviewer's decision for one conflict of a finished import
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictResolutionRequest {

    @NotBlank(message = "Conflict ID is required")
    private String conflictId;

    @NotNull(message = "Action is required")
    private SuggestedAction action;

    // Corrected taxonomy for create_new; any blank field keeps the imported value
    private String family;
    private String genus;
    private String species;
    private String cultivar;
    private String commonName;

    private Long existingPlantId;   // link to this catalog plant instead of creating one
    private Long parentInstanceId;  // missing_parent merge: link to this parent
}
