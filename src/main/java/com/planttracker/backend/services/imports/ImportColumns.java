package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.ImportType;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed column contract per import type
 */
public final class ImportColumns {

    public static final String FAMILY = "Family";
    public static final String GENUS = "Genus";
    public static final String SPECIES = "Species";
    public static final String CULTIVAR = "Cultivar";
    public static final String COMMON_NAME = "Common Name";
    // Older spreadsheets carry cultivar and common name in one column
    public static final String LEGACY_COMMON_NAME = "Common Name/Variety";

    public static final String LOCATION = "Location";
    public static final String LAST_FERTILIZED = "Last Fertilized";
    public static final String FERTILIZER_SCHEDULE = "Fertilizer Schedule";
    public static final String FERTILIZER_DUE = "Fertilizer Due";
    public static final String LAST_REPOT = "Last Repot";

    public static final String DATE_STARTED = "Date Started";
    public static final String SOURCE = "Source";
    public static final String SOURCE_DETAILS = "Source Details";
    public static final String PARENT_PLANT = "Parent Plant";

    private static final List<String> TAXONOMY_COLUMNS =
            List.of(FAMILY, GENUS, SPECIES, CULTIVAR, COMMON_NAME, LEGACY_COMMON_NAME);

    private ImportColumns() {
    }

    public static List<String> recognizedColumns(ImportType importType) {
        switch (importType) {
            case PLANT_TAXONOMY:
                return TAXONOMY_COLUMNS;
            case PLANT_INSTANCES:
                return concat(TAXONOMY_COLUMNS,
                        List.of(LOCATION, LAST_FERTILIZED, FERTILIZER_SCHEDULE, FERTILIZER_DUE, LAST_REPOT));
            case PROPAGATIONS:
                return concat(TAXONOMY_COLUMNS,
                        List.of(LOCATION, DATE_STARTED, SOURCE, SOURCE_DETAILS, PARENT_PLANT));
            default:
                throw new IllegalArgumentException("Unsupported import type: " + importType);
        }
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return List.copyOf(all);
    }
}
