package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.ExternalSource;
import com.planttracker.backend.enums.ImportType;
import com.planttracker.backend.enums.SourceType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class PropagationRecord implements ProcessedRecord {
    int rowIndex;
    String family;
    String genus;
    String species;
    String cultivar;
    String commonName;
    String nickname;
    String location;
    LocalDate dateStarted;
    SourceType sourceType;
    ExternalSource externalSource;
    String externalSourceDetails;
    String parentPlantName;

    @Override
    public ImportType importType() {
        return ImportType.PROPAGATIONS;
    }

    public boolean isInternal() {
        return sourceType == SourceType.INTERNAL;
    }
}
