package com.planttracker.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Defaults for the CSV import pipeline, bound from the {@code plant-import.*} properties
 */
@ConfigurationProperties(prefix = "plant-import")
public record ImportProperties(
        @DefaultValue("5242880") long maxFileSizeBytes,
        @DefaultValue("10000") int maxRows,
        @DefaultValue("0.7") double matchingThreshold,
        @DefaultValue("0.6") double propagationMatchingThreshold,
        @DefaultValue("0.03") double tieEpsilon,
        @DefaultValue("0.5") double candidateFloor,
        @DefaultValue("20") int maxCandidates,
        @DefaultValue MatchWeights weights,
        @DefaultValue("PT2H") Duration progressRetention,
        @DefaultValue("PT10M") Duration progressSweepInterval
) {

    public static ImportProperties defaults() {
        return new ImportProperties(5L * 1024 * 1024, 10_000, 0.7, 0.6, 0.03, 0.5, 20,
                MatchWeights.defaults(), Duration.ofHours(2), Duration.ofMinutes(10));
    }

    /**
     * Relative weight of each taxonomy field in the fuzzy score. Common name and species
     * separate look-alike entries best; family is shared by many genera and counts least.
     */
    public record MatchWeights(
            @DefaultValue("1.0") double family,
            @DefaultValue("2.0") double genus,
            @DefaultValue("2.5") double species,
            @DefaultValue("1.5") double cultivar,
            @DefaultValue("2.5") double commonName
    ) {

        public static MatchWeights defaults() {
            return new MatchWeights(1.0, 2.0, 2.5, 1.5, 2.5);
        }
    }
}
