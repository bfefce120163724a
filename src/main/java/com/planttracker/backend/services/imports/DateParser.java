package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.DateFormatPreference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date spellings found in exported plant spreadsheets
 */
@Component
public class DateParser {

    private static final Logger logger = LoggerFactory.getLogger(DateParser.class);

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern NUMERIC_DATE = Pattern.compile("^(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2}|\\d{4})$");
    private static final Pattern MONTH_YEAR = Pattern.compile("^(\\d{1,2})/(\\d{2}|\\d{4})$");
    private static final Pattern YEAR_ONLY = Pattern.compile("^\\d{4}$");

    private static final String ESTIMATE_PREFIX = "est ";
    private static final String DUE_MARKER = "DUE";
    private static final Set<String> NULL_MARKERS = Set.of("N/A", "#VALUE!");

    private final Clock clock;

    public DateParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * True when the cell carries no date at all (blank or a spreadsheet null marker)
     */
    public boolean isAbsent(String value) {
        return value == null || value.trim().isEmpty() || NULL_MARKERS.contains(value.trim().toUpperCase());
    }

    /**
     * Parse a date cell. Returns null when the value is absent or cannot be understood;
     * use {@link #isAbsent(String)} to tell the two apart.
     */
    public LocalDate parse(String value, DateFormatPreference preference) {
        if (isAbsent(value)) {
            return null;
        }

        String trimmed = value.trim();

        try {
            if (trimmed.toLowerCase().startsWith(ESTIMATE_PREFIX)) {
                return parseEstimate(trimmed.substring(ESTIMATE_PREFIX.length()).trim(), preference);
            }

            if (DUE_MARKER.equalsIgnoreCase(trimmed)) {
                return LocalDate.now(clock);
            }

            Matcher iso = ISO_DATE.matcher(trimmed);
            if (iso.matches()) {
                return LocalDate.of(toInt(iso.group(1)), toInt(iso.group(2)), toInt(iso.group(3)));
            }

            Matcher numeric = NUMERIC_DATE.matcher(trimmed);
            if (numeric.matches()) {
                return fromNumericParts(toInt(numeric.group(1)), toInt(numeric.group(2)),
                        expandYear(numeric.group(3)), preference);
            }

            if (YEAR_ONLY.matcher(trimmed).matches()) {
                return LocalDate.of(toInt(trimmed), 1, 1);
            }
        } catch (DateTimeException e) {
            logger.debug("Rejected impossible date {}: {}", trimmed, e.getMessage());
            return null;
        }

        logger.debug("Failed to parse date: {}", trimmed);
        return null;
    }

    // "est 4/25" is the 15th of the month, "est 4/12/25" is a full date
    private LocalDate parseEstimate(String datePart, DateFormatPreference preference) {
        Matcher monthYear = MONTH_YEAR.matcher(datePart);
        if (monthYear.matches()) {
            return LocalDate.of(expandYear(monthYear.group(2)), toInt(monthYear.group(1)), 15);
        }

        Matcher full = NUMERIC_DATE.matcher(datePart);
        if (full.matches()) {
            return fromNumericParts(toInt(full.group(1)), toInt(full.group(2)), expandYear(full.group(3)), preference);
        }

        return null;
    }

    private LocalDate fromNumericParts(int first, int second, int year, DateFormatPreference preference) {
        if (preference == DateFormatPreference.DAY_MONTH_YEAR) {
            return LocalDate.of(year, second, first);
        }
        if (preference == DateFormatPreference.MONTH_DAY_YEAR) {
            return LocalDate.of(year, first, second);
        }
        // auto (and ISO, which has no slash form): month first unless the first part cannot be a month
        if (first > 12 && second <= 12) {
            return LocalDate.of(year, second, first);
        }
        return LocalDate.of(year, first, second);
    }

    private int expandYear(String year) {
        int parsed = toInt(year);
        if (year.length() == 2) {
            return parsed < 50 ? 2000 + parsed : 1900 + parsed;
        }
        return parsed;
    }

    private int toInt(String digits) {
        return Integer.parseInt(digits);
    }
}
