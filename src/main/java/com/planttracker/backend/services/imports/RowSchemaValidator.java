package com.planttracker.backend.services.imports;

import com.planttracker.backend.dto.imports.ImportError;
import com.planttracker.backend.enums.DateFormatPreference;
import com.planttracker.backend.enums.ErrorSeverity;
import com.planttracker.backend.enums.ExternalSource;
import com.planttracker.backend.enums.ImportType;
import com.planttracker.backend.enums.SourceType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.planttracker.backend.services.imports.ImportColumns.*;

/**
 * Turns a raw CSV row into a typed {@link ProcessedRecord}.
 *
 * All problems of a row are collected before returning, so one response can list every
 * missing field. Required-field problems are errors and stop the row; unparseable optional
 * dates are warnings and leave the field null.
 */
@Component
public class RowSchemaValidator {

    private static final String DEFAULT_LOCATION = "Unknown";

    private final DateParser dateParser;
    private final ScheduleParser scheduleParser;

    public RowSchemaValidator(DateParser dateParser, ScheduleParser scheduleParser) {
        this.dateParser = dateParser;
        this.scheduleParser = scheduleParser;
    }

    public StageResult<ProcessedRecord> validate(Map<String, String> row, int rowIndex,
                                                 ImportType importType, DateFormatPreference dateFormat) {
        switch (importType) {
            case PLANT_TAXONOMY:
                return validateTaxonomy(row, rowIndex);
            case PLANT_INSTANCES:
                return validateInstance(row, rowIndex, dateFormat);
            case PROPAGATIONS:
                return validatePropagation(row, rowIndex, dateFormat);
            default:
                throw new IllegalArgumentException("Unsupported import type: " + importType);
        }
    }

    /**
     * Row carries none of the fields that identify a record of this type
     */
    public boolean isEmptyRow(Map<String, String> row, ImportType importType) {
        boolean noName = isBlank(value(row, COMMON_NAME)) && isBlank(value(row, LEGACY_COMMON_NAME));
        switch (importType) {
            case PLANT_TAXONOMY:
                return noName && isBlank(value(row, FAMILY)) && isBlank(value(row, GENUS)) && isBlank(value(row, SPECIES));
            case PLANT_INSTANCES:
                return noName && isBlank(value(row, LOCATION));
            case PROPAGATIONS:
                return noName && isBlank(value(row, LOCATION)) && isBlank(value(row, DATE_STARTED));
            default:
                return false;
        }
    }

    /**
     * At least one header belongs to the column contract of the import type
     */
    public boolean recognizes(Collection<String> headers, ImportType importType) {
        List<String> known = ImportColumns.recognizedColumns(importType);
        return headers.stream().anyMatch(header -> known.stream().anyMatch(k -> k.equalsIgnoreCase(header)));
    }

    // ---------------------------------------------------------------------
    // Per-type validation
    // ---------------------------------------------------------------------

    private StageResult<ProcessedRecord> validateTaxonomy(Map<String, String> row, int rowIndex) {
        List<ImportError> errors = new ArrayList<>();
        Taxonomy taxonomy = extractTaxonomy(row);

        requireField(errors, rowIndex, FAMILY, taxonomy.family, "Family is required");
        requireField(errors, rowIndex, GENUS, taxonomy.genus, "Genus is required");
        requireField(errors, rowIndex, SPECIES, taxonomy.species, "Species is required");
        requireField(errors, rowIndex, COMMON_NAME, taxonomy.commonName, "Common name is required");

        if (!errors.isEmpty()) {
            return StageResult.failure(errors, List.of());
        }

        return StageResult.success(TaxonomyRecord.builder()
                .rowIndex(rowIndex)
                .family(taxonomy.family)
                .genus(taxonomy.genus)
                .species(taxonomy.species)
                .cultivar(taxonomy.cultivar)
                .commonName(taxonomy.commonName)
                .build(), List.of());
    }

    private StageResult<ProcessedRecord> validateInstance(Map<String, String> row, int rowIndex,
                                                          DateFormatPreference dateFormat) {
        List<ImportError> errors = new ArrayList<>();
        List<ImportError> warnings = new ArrayList<>();
        Taxonomy taxonomy = extractTaxonomy(row);

        requireField(errors, rowIndex, COMMON_NAME, taxonomy.commonName, "Common name is required");

        LocalDate lastFertilized = optionalDate(row, LAST_FERTILIZED, rowIndex, dateFormat, warnings);
        LocalDate explicitDue = optionalDate(row, FERTILIZER_DUE, rowIndex, dateFormat, warnings);
        LocalDate lastRepot = optionalDate(row, LAST_REPOT, rowIndex, dateFormat, warnings);
        String schedule = emptyToNull(scheduleParser.normalize(value(row, FERTILIZER_SCHEDULE)));

        if (!errors.isEmpty()) {
            return StageResult.failure(errors, warnings);
        }

        LocalDate fertilizerDue = explicitDue != null ? explicitDue : scheduleParser.calculateNextDue(lastFertilized, schedule);
        String location = cleanField(value(row, LOCATION));

        return StageResult.success(PlantInstanceRecord.builder()
                .rowIndex(rowIndex)
                .family(taxonomy.family)
                .genus(taxonomy.genus)
                .species(taxonomy.species)
                .cultivar(taxonomy.cultivar)
                .commonName(taxonomy.commonName)
                .nickname(taxonomy.commonName)
                .location(location != null ? location : DEFAULT_LOCATION)
                .lastFertilized(lastFertilized)
                .fertilizerSchedule(schedule)
                .fertilizerDue(fertilizerDue)
                .lastRepot(lastRepot)
                .build(), warnings);
    }

    private StageResult<ProcessedRecord> validatePropagation(Map<String, String> row, int rowIndex,
                                                             DateFormatPreference dateFormat) {
        List<ImportError> errors = new ArrayList<>();
        List<ImportError> warnings = new ArrayList<>();
        Taxonomy taxonomy = extractTaxonomy(row);

        requireField(errors, rowIndex, COMMON_NAME, taxonomy.commonName, "Common name is required");

        String rawDateStarted = value(row, DATE_STARTED);
        LocalDate dateStarted = dateParser.parse(rawDateStarted, dateFormat);
        if (dateStarted == null) {
            errors.add(ImportError.builder()
                    .rowIndex(rowIndex)
                    .field(DATE_STARTED)
                    .message("Invalid or missing date started")
                    .severity(ErrorSeverity.ERROR)
                    .originalValue(rawDateStarted)
                    .build());
        }

        if (!errors.isEmpty()) {
            return StageResult.failure(errors, warnings);
        }

        String parentPlantName = cleanField(value(row, PARENT_PLANT));
        String sourceText = cleanField(value(row, SOURCE));
        String location = cleanField(value(row, LOCATION));

        PropagationRecord.PropagationRecordBuilder builder = PropagationRecord.builder()
                .rowIndex(rowIndex)
                .family(taxonomy.family)
                .genus(taxonomy.genus)
                .species(taxonomy.species)
                .cultivar(taxonomy.cultivar)
                .commonName(taxonomy.commonName)
                .nickname(taxonomy.commonName)
                .location(location != null ? location : DEFAULT_LOCATION)
                .dateStarted(dateStarted)
                .externalSourceDetails(cleanField(value(row, SOURCE_DETAILS)))
                .parentPlantName(parentPlantName);

        if (parentPlantName != null) {
            builder.sourceType(SourceType.INTERNAL);
        } else {
            builder.sourceType(SourceType.EXTERNAL)
                    .externalSource(ExternalSource.detect(sourceText));
        }

        return StageResult.success(builder.build(), warnings);
    }

    // ---------------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------------

    private static final class Taxonomy {
        String family;
        String genus;
        String species;
        String cultivar;
        String commonName;
    }

    private Taxonomy extractTaxonomy(Map<String, String> row) {
        Taxonomy taxonomy = new Taxonomy();
        taxonomy.family = capitalize(cleanField(value(row, FAMILY)));
        taxonomy.genus = capitalize(cleanField(value(row, GENUS)));
        String species = cleanField(value(row, SPECIES));
        taxonomy.species = species != null ? species.toLowerCase(Locale.ROOT) : null;

        // Separate columns win over the legacy combined one
        String commonName = cleanField(value(row, COMMON_NAME));
        taxonomy.commonName = commonName != null ? commonName : cleanField(value(row, LEGACY_COMMON_NAME));
        taxonomy.cultivar = stripCultivarQuotes(cleanField(value(row, CULTIVAR)));
        return taxonomy;
    }

    private LocalDate optionalDate(Map<String, String> row, String column, int rowIndex,
                                   DateFormatPreference dateFormat, List<ImportError> warnings) {
        String raw = value(row, column);
        if (dateParser.isAbsent(raw)) {
            return null;
        }
        LocalDate parsed = dateParser.parse(raw, dateFormat);
        if (parsed == null) {
            warnings.add(ImportError.builder()
                    .rowIndex(rowIndex)
                    .field(column)
                    .message("Could not parse " + column + ", leaving it empty")
                    .severity(ErrorSeverity.WARNING)
                    .originalValue(raw)
                    .build());
        }
        return parsed;
    }

    /**
     * Column lookup tolerant of header casing ("common name" vs "Common Name")
     */
    static String value(Map<String, String> row, String column) {
        if (row.containsKey(column)) {
            return row.get(column);
        }
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private void requireField(List<ImportError> errors, int rowIndex, String field, String value, String message) {
        if (value == null) {
            errors.add(ImportError.error(rowIndex, field, message));
        }
    }

    /**
     * Trim, collapse inner whitespace, normalize curly quotes. Blank becomes null.
     */
    static String cleanField(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replaceAll("\\s+", " ")
                .trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    static String capitalize(String value) {
        if (value == null) {
            return null;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String stripCultivarQuotes(String cultivar) {
        if (cultivar == null) {
            return null;
        }
        String stripped = cultivar.replaceAll("^['\"]+|['\"]+$", "").trim();
        return stripped.isEmpty() ? null : stripped;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
