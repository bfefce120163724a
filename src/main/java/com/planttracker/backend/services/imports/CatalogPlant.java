package com.planttracker.backend.services.imports;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of one catalog plant as seen by an import run
 */
@Value
@Builder
public class CatalogPlant {
    Long id;
    String family;
    String genus;
    String species;
    String cultivar;
    String commonName;
    boolean verified;

    public String displayName() {
        StringBuilder sb = new StringBuilder();
        sb.append(genus).append(' ').append(species);
        if (cultivar != null) {
            sb.append(" '").append(cultivar).append('\'');
        }
        return sb.append(" (").append(commonName).append(')').toString();
    }
}
