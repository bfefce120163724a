package com.planttracker.backend.dto.imports;

import com.planttracker.backend.services.imports.CatalogPlant;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PlantMatch {
    Long plantId;
    double score;
    List<String> matchedFields;
    CatalogPlant plant;
}
