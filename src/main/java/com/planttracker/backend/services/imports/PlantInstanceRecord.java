package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.ImportType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class PlantInstanceRecord implements ProcessedRecord {
    int rowIndex;
    String family;
    String genus;
    String species;
    String cultivar;
    String commonName;
    String nickname;
    String location;
    LocalDate lastFertilized;
    String fertilizerSchedule;
    LocalDate fertilizerDue;
    LocalDate lastRepot;

    @Override
    public ImportType importType() {
        return ImportType.PLANT_INSTANCES;
    }
}
