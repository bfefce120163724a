package com.planttracker.backend.services.imports;

import com.planttracker.backend.dto.imports.ConflictResolutionRequest;
import com.planttracker.backend.dto.imports.ImportConflict;
import com.planttracker.backend.dto.imports.ImportError;
import com.planttracker.backend.dto.imports.ImportProgress;
import com.planttracker.backend.dto.imports.ImportSummary;
import com.planttracker.backend.dto.imports.SuggestedResolution;
import com.planttracker.backend.enums.ConflictType;
import com.planttracker.backend.enums.ExternalSource;
import com.planttracker.backend.enums.ImportStatus;
import com.planttracker.backend.enums.SourceType;
import com.planttracker.backend.enums.SuggestedAction;
import com.planttracker.backend.exceptions.CatalogUnavailableException;
import com.planttracker.backend.exceptions.ImportNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Applies reviewer decisions to the conflicts left by a finished import.
 *
 * Conflicts are looked up by id ({@code <type>_<rowIndex>}) in the job's progress entry. A
 * resolved conflict leaves the entry's pending list; the job's own summary is never rewritten.
 */
@Service
@Slf4j
public class ConflictResolutionService {

    private static final Map<ConflictType, List<SuggestedAction>> ALLOWED_ACTIONS = Map.of(
            ConflictType.DUPLICATE_PLANT, List.of(SuggestedAction.SKIP, SuggestedAction.MERGE, SuggestedAction.CREATE_NEW),
            ConflictType.MISSING_PARENT, List.of(SuggestedAction.SKIP, SuggestedAction.CREATE_NEW, SuggestedAction.MERGE),
            ConflictType.INVALID_TAXONOMY, List.of(SuggestedAction.SKIP, SuggestedAction.CREATE_NEW, SuggestedAction.MANUAL_REVIEW)
    );

    private final CsvImportService importService;
    private final ImportProgressStore progressStore;
    private final PlantCatalogGateway catalogGateway;
    private final Clock clock;

    public ConflictResolutionService(CsvImportService importService,
                                     ImportProgressStore progressStore,
                                     PlantCatalogGateway catalogGateway,
                                     Clock clock) {
        this.importService = importService;
        this.progressStore = progressStore;
        this.catalogGateway = catalogGateway;
        this.clock = clock;
    }

    public List<SuggestedResolution> getSuggestedResolutions(String jobId, Long userId) {
        ImportProgress progress = importService.getProgress(jobId, userId);
        List<ImportConflict> conflicts = progress.getConflicts() != null ? progress.getConflicts() : List.of();
        return conflicts.stream()
                .map(conflict -> new SuggestedResolution(conflict.getId(), conflict.getSuggestedAction(),
                        ALLOWED_ACTIONS.get(conflict.getType())))
                .toList();
    }

    /**
     * Applies each decision in order. A decision that cannot be applied becomes an error of the
     * returned summary and leaves its conflict pending; the others still go through.
     *
     * The requested conflicts are taken out of the job's pending list before any catalog write,
     * so a conflict is applied by at most one request. Conflicts that end up not applied are put
     * back.
     *
     * @throws IllegalStateException when the job has not completed
     */
    public ImportSummary resolveConflicts(String jobId, Long userId, List<ConflictResolutionRequest> resolutions) {
        ImportProgress progress = importService.getProgress(jobId, userId);
        if (progress.getStatus() != ImportStatus.COMPLETED) {
            throw new IllegalStateException("Conflicts can only be resolved on a completed import, job "
                    + jobId + " is " + progress.getStatus().getValue());
        }

        OffsetDateTime startTime = OffsetDateTime.now(clock);
        Map<String, ImportConflict> claimed = claim(jobId, resolutions);
        List<ImportError> errors = new ArrayList<>();
        Set<String> resolvedIds = new HashSet<>();
        Set<String> attemptedIds = new HashSet<>();
        int applied = 0;
        int skipped = 0;

        try {
            for (ConflictResolutionRequest request : resolutions) {
                ImportConflict conflict = claimed.get(request.getConflictId());
                if (conflict == null) {
                    errors.add(ImportError.error(-1, null,
                            "Unknown or already resolved conflict: " + request.getConflictId()));
                    continue;
                }
                if (!attemptedIds.add(conflict.getId())) {
                    errors.add(ImportError.error(conflict.getRowIndex(), null,
                            "Conflict " + request.getConflictId() + " was already resolved in this request"));
                    continue;
                }

                try {
                    ImportError error = apply(conflict, request, userId);
                    if (error != null) {
                        errors.add(error);
                        continue;
                    }
                    resolvedIds.add(conflict.getId());
                    if (request.getAction() == SuggestedAction.SKIP) {
                        skipped++;
                    } else {
                        applied++;
                    }
                } catch (CatalogUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Resolving conflict {} of import {} failed", conflict.getId(), jobId, e);
                    errors.add(ImportError.error(conflict.getRowIndex(), null,
                            "Failed to resolve conflict: " + e.getMessage()));
                }
            }
        } finally {
            release(jobId, claimed.values().stream()
                    .filter(conflict -> !resolvedIds.contains(conflict.getId()))
                    .toList());
        }

        List<ImportConflict> remaining = progressStore.get(jobId)
                .map(ImportProgress::getConflicts)
                .orElse(List.of());

        log.info("Resolved {} of {} conflicts for import {} ({} applied, {} skipped, {} errors)",
                resolvedIds.size(), resolutions.size(), jobId, applied, skipped, errors.size());

        return ImportSummary.builder()
                .totalRows(resolutions.size())
                .processedRows(resolutions.size())
                .successfulImports(applied)
                .skippedRows(skipped)
                .errors(List.copyOf(errors))
                .warnings(List.of())
                .conflicts(remaining)
                .importType(progress.getImportType())
                .startTime(startTime)
                .endTime(OffsetDateTime.now(clock))
                .userId(userId)
                .build();
    }

    /**
     * Removes the requested conflicts from the pending list in one store update
     *
     * @return the conflicts this call took, by id
     */
    private Map<String, ImportConflict> claim(String jobId, List<ConflictResolutionRequest> resolutions) {
        Set<String> requestedIds = new HashSet<>();
        resolutions.forEach(request -> requestedIds.add(request.getConflictId()));
        Map<String, ImportConflict> claimed = new LinkedHashMap<>();

        progressStore.update(jobId, current -> {
            claimed.clear();
            List<ImportConflict> pending = current.getConflicts() != null ? current.getConflicts() : List.of();
            List<ImportConflict> kept = new ArrayList<>();
            for (ImportConflict conflict : pending) {
                if (requestedIds.contains(conflict.getId())) {
                    claimed.put(conflict.getId(), conflict);
                } else {
                    kept.add(conflict);
                }
            }
            return current.toBuilder().conflicts(List.copyOf(kept)).build();
        });
        return claimed;
    }

    /**
     * Puts conflicts that were claimed but not applied back into the pending list, in row order
     */
    private void release(String jobId, List<ImportConflict> unresolved) {
        if (unresolved.isEmpty()) {
            return;
        }
        try {
            progressStore.update(jobId, current -> {
                List<ImportConflict> pending = new ArrayList<>();
                if (current.getConflicts() != null) {
                    pending.addAll(current.getConflicts());
                }
                pending.addAll(unresolved);
                pending.sort(Comparator.comparingInt(ImportConflict::getRowIndex));
                return current.toBuilder().conflicts(List.copyOf(pending)).build();
            });
        } catch (ImportNotFoundException e) {
            log.warn("Import {} expired while its conflicts were being resolved, {} conflicts dropped",
                    jobId, unresolved.size());
        }
    }

    /**
     * @return null when applied, otherwise the reason it was not
     */
    private ImportError apply(ImportConflict conflict, ConflictResolutionRequest request, Long userId) {
        SuggestedAction action = request.getAction();
        int rowIndex = conflict.getRowIndex();

        if (action == SuggestedAction.MANUAL_REVIEW) {
            return ImportError.error(rowIndex, null, "Manual review required");
        }
        if (!ALLOWED_ACTIONS.get(conflict.getType()).contains(action)) {
            return ImportError.error(rowIndex, null, "Action " + action.getValue()
                    + " is not allowed for " + conflict.getType().getValue() + " conflicts");
        }
        if (action == SuggestedAction.SKIP) {
            return null;
        }

        ProcessedRecord record = conflict.getPendingRecord();
        if (record == null) {
            return ImportError.error(rowIndex, null, "The imported row is no longer available");
        }

        switch (conflict.getType()) {
            case DUPLICATE_PLANT:
                return resolveDuplicate(conflict, request, record, userId);
            case MISSING_PARENT:
                return resolveMissingParent(request, record, userId);
            case INVALID_TAXONOMY:
                return resolveInvalidTaxonomy(request, record, userId);
            default:
                return ImportError.error(rowIndex, null, "Unsupported conflict type " + conflict.getType());
        }
    }

    private ImportError resolveDuplicate(ImportConflict conflict, ConflictResolutionRequest request,
                                         ProcessedRecord record, Long userId) {
        CatalogPlant existing = conflict.getExistingRecord();

        if (request.getAction() == SuggestedAction.MERGE) {
            Long targetId = request.getExistingPlantId() != null
                    ? request.getExistingPlantId()
                    : existing != null ? existing.getId() : null;
            if (targetId == null) {
                return ImportError.error(record.getRowIndex(), null, "No catalog plant to merge into");
            }
            catalogGateway.mergeTaxonomy(targetId, withCorrections(record, request));
            return null;
        }

        ProcessedRecord corrected = withCorrections(record, request);
        if (!corrected.hasCompleteTaxonomy()) {
            return ImportError.error(record.getRowIndex(), null, "Family, genus, species and common name are required");
        }
        if (existing != null && sameTaxonomy(corrected, existing)) {
            return ImportError.error(record.getRowIndex(), null,
                    "Change the taxonomy to create a plant separate from " + existing.displayName());
        }
        CatalogPlant plant = catalogGateway.persistTaxonomy(corrected, userId);
        persistOwned(corrected, plant.getId(), null, userId);
        return null;
    }

    private ImportError resolveMissingParent(ConflictResolutionRequest request, ProcessedRecord record, Long userId) {
        if (!(record instanceof PropagationRecord propagation)) {
            return ImportError.error(record.getRowIndex(), null, "Only propagations can have a missing parent");
        }

        Long parentInstanceId = null;
        PropagationRecord toPersist = (PropagationRecord) withCorrections(propagation, request);
        if (request.getAction() == SuggestedAction.MERGE) {
            if (request.getParentInstanceId() == null) {
                return ImportError.error(record.getRowIndex(), "Parent Plant", "A parent plant must be selected");
            }
            parentInstanceId = request.getParentInstanceId();
        } else {
            // Stored without a parent link; the unresolved name is kept in the source details
            toPersist = toPersist.toBuilder()
                    .sourceType(SourceType.EXTERNAL)
                    .externalSource(ExternalSource.OTHER)
                    .externalSourceDetails("Parent plant: " + propagation.getParentPlantName())
                    .build();
        }

        Long plantId = plantIdFor(toPersist, request, userId);
        if (plantId == null) {
            return ImportError.error(record.getRowIndex(), null,
                    "Select a catalog plant or supply family, genus and species");
        }
        catalogGateway.persistPropagation(toPersist, plantId, parentInstanceId, userId);
        return null;
    }

    private ImportError resolveInvalidTaxonomy(ConflictResolutionRequest request, ProcessedRecord record, Long userId) {
        ProcessedRecord corrected = withCorrections(record, request);
        Long plantId = plantIdFor(corrected, request, userId);
        if (plantId == null) {
            return ImportError.error(record.getRowIndex(), null, "Family, genus, species and common name are required");
        }
        persistOwned(corrected, plantId, null, userId);
        return null;
    }

    /**
     * Catalog plant for the record: the reviewer's pick, else one created from the taxonomy
     */
    private Long plantIdFor(ProcessedRecord record, ConflictResolutionRequest request, Long userId) {
        if (request.getExistingPlantId() != null) {
            return request.getExistingPlantId();
        }
        if (!record.hasCompleteTaxonomy()) {
            return null;
        }
        return catalogGateway.persistTaxonomy(record, userId).getId();
    }

    private void persistOwned(ProcessedRecord record, Long plantId, Long parentInstanceId, Long userId) {
        if (record instanceof PlantInstanceRecord instance) {
            catalogGateway.persistInstance(instance, plantId, userId);
        } else if (record instanceof PropagationRecord propagation) {
            catalogGateway.persistPropagation(propagation, plantId, parentInstanceId, userId);
        }
    }

    /**
     * Copy of the record with the reviewer's non-blank taxonomy fields applied
     */
    static ProcessedRecord withCorrections(ProcessedRecord record, ConflictResolutionRequest request) {
        String family = corrected(record.getFamily(), RowSchemaValidator.capitalize(RowSchemaValidator.cleanField(request.getFamily())));
        String genus = corrected(record.getGenus(), RowSchemaValidator.capitalize(RowSchemaValidator.cleanField(request.getGenus())));
        String speciesInput = RowSchemaValidator.cleanField(request.getSpecies());
        String species = corrected(record.getSpecies(), speciesInput != null ? speciesInput.toLowerCase(Locale.ROOT) : null);
        String cultivar = corrected(record.getCultivar(), RowSchemaValidator.cleanField(request.getCultivar()));
        String commonName = corrected(record.getCommonName(), RowSchemaValidator.cleanField(request.getCommonName()));

        if (record instanceof TaxonomyRecord taxonomy) {
            return taxonomy.toBuilder().family(family).genus(genus).species(species)
                    .cultivar(cultivar).commonName(commonName).build();
        }
        if (record instanceof PlantInstanceRecord instance) {
            return instance.toBuilder().family(family).genus(genus).species(species)
                    .cultivar(cultivar).commonName(commonName).build();
        }
        PropagationRecord propagation = (PropagationRecord) record;
        return propagation.toBuilder().family(family).genus(genus).species(species)
                .cultivar(cultivar).commonName(commonName).build();
    }

    private static String corrected(String imported, String correction) {
        return correction != null ? correction : imported;
    }

    private static boolean sameTaxonomy(ProcessedRecord record, CatalogPlant plant) {
        return equalsIgnoreCase(record.getFamily(), plant.getFamily())
                && equalsIgnoreCase(record.getGenus(), plant.getGenus())
                && equalsIgnoreCase(record.getSpecies(), plant.getSpecies())
                && equalsIgnoreCase(record.getCultivar(), plant.getCultivar());
    }

    private static boolean equalsIgnoreCase(String left, String right) {
        return left == null ? right == null : left.equalsIgnoreCase(right);
    }
}
