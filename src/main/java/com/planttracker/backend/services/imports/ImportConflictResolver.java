package com.planttracker.backend.services.imports;

import com.planttracker.backend.dto.imports.ImportConflict;
import com.planttracker.backend.dto.imports.ImportError;
import com.planttracker.backend.dto.imports.PlantMatch;
import com.planttracker.backend.dto.imports.PlantMatchResult;
import com.planttracker.backend.enums.ConflictType;
import com.planttracker.backend.enums.DuplicateHandling;
import com.planttracker.backend.enums.ImportType;
import com.planttracker.backend.enums.SuggestedAction;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides what happens to a validated, matched row.
 *
 * Nothing here writes to the catalog. The only collaborator call is the read-only parent
 * lookup for internal propagations, which runs before any other decision so an unresolved
 * parent never leaves a half-written row behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportConflictResolver {

    private final PlantCatalogGateway catalogGateway;

    @Value
    @Builder
    public static class Policy {
        DuplicateHandling handleDuplicates;
        boolean createMissingPlants;
        double threshold;
        double tieEpsilon;
    }

    public ResolvedOutcome resolve(ProcessedRecord record, PlantMatchResult matchResult,
                                   ImportType importType, Policy policy, Long userId) {
        if (record.importType() != importType) {
            return new ResolvedOutcome.Error(ImportError.error(record.getRowIndex(), null,
                    "Row was validated as " + record.importType().getValue() + " but the import is "
                            + importType.getValue()));
        }

        Long parentInstanceId = null;
        if (record instanceof PropagationRecord propagation && propagation.isInternal()) {
            parentInstanceId = catalogGateway.resolveParentInstance(propagation.getParentPlantName(), userId);
            if (parentInstanceId == null) {
                log.debug("Row {}: parent plant '{}' not found", record.getRowIndex(), propagation.getParentPlantName());
                return conflict(ConflictType.MISSING_PARENT, record, null, SuggestedAction.MANUAL_REVIEW,
                        "Parent plant '" + propagation.getParentPlantName() + "' was not found among your plants");
            }
        }

        PlantMatch best = matchResult.getBestMatch();

        if (matchResult.isExactMatch() && best != null) {
            if (importType == ImportType.PLANT_TAXONOMY) {
                return conflict(ConflictType.DUPLICATE_PLANT, record, best.getPlant(),
                        policy.getHandleDuplicates().toSuggestedAction(),
                        "Plant already exists in the catalog: " + best.getPlant().displayName());
            }
            return persist(record, best.getPlantId(), parentInstanceId, List.of());
        }

        if (matchResult.isAmbiguous(policy.getTieEpsilon())) {
            return conflict(ConflictType.INVALID_TAXONOMY, record, best.getPlant(), SuggestedAction.MANUAL_REVIEW,
                    "Multiple catalog plants match equally well ("
                            + matchResult.getMatches().size() + " candidates)");
        }

        if (best != null && best.getScore() >= policy.getThreshold()) {
            if (importType == ImportType.PLANT_TAXONOMY) {
                return conflict(ConflictType.DUPLICATE_PLANT, record, best.getPlant(), SuggestedAction.MANUAL_REVIEW,
                        "Possible duplicate of " + best.getPlant().displayName()
                                + " (score " + best.getScore() + ")");
            }
            List<ImportError> warnings = matchResult.isTaxonomyOnly()
                    ? List.of(ImportError.warning(record.getRowIndex(), null,
                            "Using taxonomy match for propagation: " + record.getCommonName()
                                    + " -> " + best.getPlant().getCommonName()))
                    : List.of();
            return persist(record, best.getPlantId(), parentInstanceId, warnings);
        }

        // Only weak candidates: a reviewer picks one or creates a new plant
        if (best != null) {
            return conflict(ConflictType.INVALID_TAXONOMY, record, best.getPlant(), SuggestedAction.MANUAL_REVIEW,
                    "Closest catalog plant for '" + record.getCommonName() + "' is "
                            + best.getPlant().displayName() + " (score " + best.getScore()
                            + "), below the matching threshold of " + policy.getThreshold());
        }

        // No candidates at all
        if (!record.hasCompleteTaxonomy()) {
            return conflict(ConflictType.INVALID_TAXONOMY, record, null, SuggestedAction.MANUAL_REVIEW,
                    "No catalog plant matches '" + record.getCommonName()
                            + "' and the row lacks the family, genus and species needed to create one");
        }

        if (!policy.isCreateMissingPlants()) {
            return conflict(ConflictType.INVALID_TAXONOMY, record, null, SuggestedAction.CREATE_NEW,
                    "No catalog plant matches '" + record.getCommonName() + "' and plant creation is disabled");
        }

        List<ImportError> warnings = importType == ImportType.PLANT_TAXONOMY
                ? List.of()
                : List.of(ImportError.warning(record.getRowIndex(), null,
                        "No catalog match for '" + record.getCommonName() + "', a new catalog plant will be created"));
        return persist(record, null, parentInstanceId, warnings);
    }

    private static ResolvedOutcome persist(ProcessedRecord record, Long plantId, Long parentInstanceId,
                                           List<ImportError> warnings) {
        return new ResolvedOutcome.Persist(record, plantId, parentInstanceId, warnings);
    }

    private static ResolvedOutcome conflict(ConflictType type, ProcessedRecord record, CatalogPlant existing,
                                            SuggestedAction action, String message) {
        return new ResolvedOutcome.Conflict(ImportConflict.builder()
                .type(type)
                .rowIndex(record.getRowIndex())
                .message(message)
                .existingRecord(existing)
                .suggestedAction(action)
                .pendingRecord(record)
                .build());
    }
}
