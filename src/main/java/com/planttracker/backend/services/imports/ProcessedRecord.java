package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.ImportType;

/**
 * Validated, typed result of one CSV row. One implementation per import type.
 */
public sealed interface ProcessedRecord permits TaxonomyRecord, PlantInstanceRecord, PropagationRecord {

    int getRowIndex();

    String getFamily();

    String getGenus();

    String getSpecies();

    String getCultivar();

    String getCommonName();

    ImportType importType();

    /**
     * Family, genus, species and common name are all present, so a catalog plant can be created from the row
     */
    default boolean hasCompleteTaxonomy() {
        return getFamily() != null && getGenus() != null && getSpecies() != null && getCommonName() != null;
    }
}
