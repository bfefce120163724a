package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.ImportType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TaxonomyRecord implements ProcessedRecord {
    int rowIndex;
    String family;
    String genus;
    String species;
    String cultivar;
    String commonName;

    @Override
    public ImportType importType() {
        return ImportType.PLANT_TAXONOMY;
    }
}
