package com.planttracker.backend.services.imports;

/**
 * Boundary to the plant catalog and the user's plant collection.
 *
 * Implementations throw {@link com.planttracker.backend.exceptions.CatalogUnavailableException}
 * when the store cannot be reached; any other runtime exception is a failure of the single
 * call. Calls are never retried here or by the import pipeline.
 */
public interface PlantCatalogGateway {

    /**
     * Full catalog, verified and unverified, as of now
     */
    CatalogSnapshot getCatalogSnapshot();

    /**
     * Creates a catalog plant from the record's taxonomy, or returns the existing one when the
     * exact taxonomy is already stored.
     */
    CatalogPlant persistTaxonomy(ProcessedRecord record, Long userId);

    Long persistInstance(PlantInstanceRecord record, Long plantId, Long userId);

    Long persistPropagation(PropagationRecord record, Long plantId, Long parentInstanceId, Long userId);

    /**
     * Id of the user's active plant instance with this nickname, or null when there is none
     */
    Long resolveParentInstance(String parentName, Long userId);

    /**
     * Folds a duplicate row into an existing catalog plant
     */
    CatalogPlant mergeTaxonomy(Long existingPlantId, ProcessedRecord record);
}
