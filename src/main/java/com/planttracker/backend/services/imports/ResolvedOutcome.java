package com.planttracker.backend.services.imports;

import com.planttracker.backend.dto.imports.ImportConflict;
import com.planttracker.backend.dto.imports.ImportError;

import java.util.List;

/**
 * What should happen to a validated row: persist it, record a conflict, or record an error.
 */
public sealed interface ResolvedOutcome permits ResolvedOutcome.Persist, ResolvedOutcome.Conflict, ResolvedOutcome.Error {

    /**
     * @param matchedPlantId   catalog plant to link to, or null when a new catalog plant must be created
     * @param parentInstanceId resolved parent for internal propagations, null otherwise
     */
    record Persist(ProcessedRecord record, Long matchedPlantId, Long parentInstanceId,
                   List<ImportError> warnings) implements ResolvedOutcome {

        public boolean createsPlant() {
            return matchedPlantId == null;
        }
    }

    record Conflict(ImportConflict conflict) implements ResolvedOutcome {
    }

    record Error(ImportError error) implements ResolvedOutcome {
    }
}
