package com.planttracker.backend.services.imports;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fertilizer schedule cells ("every 2-3 weeks") and the next due date they imply
 */
@Component
public class ScheduleParser {

    private static final Pattern WEEK_RANGE = Pattern.compile("every (\\d+)\\s*-\\s*(\\d+) weeks?");
    private static final Pattern WEEK_SINGLE = Pattern.compile("every (\\d+) weeks?");

    /**
     * Normalize a schedule string. Recognized "every N weeks" forms are lower-cased with
     * single spacing; anything else is kept as written. Blank or N/A yields "".
     */
    public String normalize(String schedule) {
        if (schedule == null || schedule.trim().isEmpty() || "N/A".equalsIgnoreCase(schedule.trim())) {
            return "";
        }

        String lower = schedule.trim().toLowerCase().replaceAll("\\s+", " ");
        if (WEEK_RANGE.matcher(lower).matches() || WEEK_SINGLE.matcher(lower).matches()) {
            return lower.replaceAll("\\s*-\\s*", "-");
        }
        return schedule.trim();
    }

    /**
     * Next due date: last fertilized plus the schedule interval. Ranges use the rounded midpoint.
     */
    public LocalDate calculateNextDue(LocalDate lastFertilized, String schedule) {
        if (lastFertilized == null || schedule == null || schedule.isEmpty()) {
            return null;
        }

        Integer weeks = extractWeeks(schedule);
        if (weeks == null) {
            return null;
        }
        return lastFertilized.plusWeeks(weeks);
    }

    Integer extractWeeks(String schedule) {
        String lower = schedule.toLowerCase();

        Matcher range = WEEK_RANGE.matcher(lower);
        if (range.find()) {
            int min = Integer.parseInt(range.group(1));
            int max = Integer.parseInt(range.group(2));
            return (int) Math.round((min + max) / 2.0);
        }

        Matcher single = WEEK_SINGLE.matcher(lower);
        if (single.find()) {
            return Integer.parseInt(single.group(1));
        }
        return null;
    }
}
