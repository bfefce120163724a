package com.planttracker.backend.dto.imports;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.planttracker.backend.enums.ConflictType;
import com.planttracker.backend.enums.SuggestedAction;
import com.planttracker.backend.services.imports.CatalogPlant;
import com.planttracker.backend.services.imports.ProcessedRecord;
import lombok.Builder;
import lombok.Value;

/**
 * Classified disagreement between a row and the catalog. Never mutated once recorded.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportConflict {
    ConflictType type;
    int rowIndex;
    String message;
    CatalogPlant existingRecord;
    SuggestedAction suggestedAction;

    // Validated row kept so the conflict can be applied later; not part of the wire format
    @JsonIgnore
    ProcessedRecord pendingRecord;

    public String getId() {
        return type.getValue() + "_" + rowIndex;
    }
}
