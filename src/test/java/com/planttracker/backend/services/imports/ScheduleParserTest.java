package com.planttracker.backend.services.imports;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

class ScheduleParserTest {

    private final ScheduleParser scheduleParser = new ScheduleParser();

    @Test
    void normalize_ShouldCleanKnownFormsAndKeepOthers() {
        assertThat(scheduleParser.normalize("Every 2 - 3  Weeks")).isEqualTo("every 2-3 weeks");
        assertThat(scheduleParser.normalize("every 4 weeks")).isEqualTo("every 4 weeks");
        assertThat(scheduleParser.normalize("  monthly ")).isEqualTo("monthly");
        assertThat(scheduleParser.normalize("N/A")).isEmpty();
        assertThat(scheduleParser.normalize(null)).isEmpty();
    }

    @Test
    void calculateNextDue_WithRange_ShouldUseRoundedMidpoint() {
        // Given
        LocalDate lastFertilized = LocalDate.of(2025, 3, 1);

        // When & Then
        assertThat(scheduleParser.calculateNextDue(lastFertilized, "every 2-3 weeks"))
                .isEqualTo(lastFertilized.plusWeeks(3));
        assertThat(scheduleParser.calculateNextDue(lastFertilized, "every 2-4 weeks"))
                .isEqualTo(lastFertilized.plusWeeks(3));
        assertThat(scheduleParser.calculateNextDue(lastFertilized, "every 1 week"))
                .isEqualTo(lastFertilized.plusWeeks(1));
    }

    @Test
    void calculateNextDue_WithoutUsableInput_ShouldReturnNull() {
        assertThat(scheduleParser.calculateNextDue(null, "every 2 weeks")).isNull();
        assertThat(scheduleParser.calculateNextDue(LocalDate.of(2025, 3, 1), "monthly")).isNull();
        assertThat(scheduleParser.calculateNextDue(LocalDate.of(2025, 3, 1), "")).isNull();
    }
}
