package com.planttracker.backend.services.imports;

import com.planttracker.backend.config.ImportProperties;
import com.planttracker.backend.dto.imports.PlantMatch;
import com.planttracker.backend.dto.imports.PlantMatchResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fuzzy taxonomy matcher: scores one validated row against every plant of a catalog snapshot.
 *
 * An exact family + genus + species + cultivar hit scores 1.0 and ends the search. Otherwise
 * each plant gets a weighted average of per-field similarities; a field only contributes
 * when its similarity clears the field floor. Candidates whose score lies within the tie
 * window of the best one are all returned and force a manual review.
 *
 * With the taxonomy fallback enabled, a row whose best score stays under the threshold is
 * scored a second time on family, genus, species and cultivar alone. Propagation common names
 * are usually nicknames and would otherwise drag a correct taxonomy below the bar.
 *
 * Stateless and side-effect free; the snapshot is never modified.
 */
@Service
@Slf4j
public class PlantMatcher {

    static final double TAXONOMY_FIELD_FLOOR = 0.8;
    static final double COMMON_NAME_FIELD_FLOOR = 0.6;
    static final double SUBSTRING_SIMILARITY = 0.9;
    static final double TAXONOMY_FALLBACK_THRESHOLD = 0.8;

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    @Value
    @Builder
    public static class MatchOptions {
        double threshold;
        double tieEpsilon;
        double candidateFloor;
        int maxCandidates;
        ImportProperties.MatchWeights weights;
        boolean taxonomyFallback;

        public static MatchOptions from(ImportProperties properties, double threshold, double tieEpsilon) {
            return from(properties, threshold, tieEpsilon, false);
        }

        public static MatchOptions from(ImportProperties properties, double threshold, double tieEpsilon,
                                        boolean taxonomyFallback) {
            return MatchOptions.builder()
                    .threshold(threshold)
                    .tieEpsilon(tieEpsilon)
                    .candidateFloor(Math.min(properties.candidateFloor(), threshold))
                    .maxCandidates(properties.maxCandidates())
                    .weights(properties.weights())
                    .taxonomyFallback(taxonomyFallback)
                    .build();
        }
    }

    public PlantMatchResult match(ProcessedRecord record, CatalogSnapshot snapshot, MatchOptions options) {
        Map<String, String> originalData = describe(record);

        CatalogPlant exact = findExact(record, snapshot);
        if (exact != null) {
            PlantMatch match = PlantMatch.builder()
                    .plantId(exact.getId())
                    .score(1.0)
                    .matchedFields(List.of("family", "genus", "species", "cultivar"))
                    .plant(exact)
                    .build();
            return PlantMatchResult.builder()
                    .rowIndex(record.getRowIndex())
                    .originalData(originalData)
                    .matches(List.of(match))
                    .bestMatch(match)
                    .requiresManualReview(false)
                    .confidence(1.0)
                    .exactMatch(true)
                    .build();
        }

        PlantMatchResult result = rank(record, snapshot, options, originalData, true);

        if (options.isTaxonomyFallback() && result.getConfidence() < options.getThreshold()
                && record.getFamily() != null && record.getGenus() != null && record.getSpecies() != null) {
            PlantMatchResult taxonomyOnly = rank(record, snapshot, options, originalData, false);
            if (taxonomyOnly.getConfidence() > TAXONOMY_FALLBACK_THRESHOLD) {
                log.debug("Row {}: common name ignored, taxonomy alone matches {} ({})", record.getRowIndex(),
                        taxonomyOnly.getBestMatch().getPlantId(), taxonomyOnly.getConfidence());
                return taxonomyOnly;
            }
        }
        return result;
    }

    private PlantMatchResult rank(ProcessedRecord record, CatalogSnapshot snapshot, MatchOptions options,
                                  Map<String, String> originalData, boolean withCommonName) {
        List<PlantMatch> candidates = new ArrayList<>();
        for (CatalogPlant plant : snapshot.getPlants()) {
            PlantMatch scored = score(record, plant, options.getWeights(), withCommonName);
            if (scored.getScore() > 0 && scored.getScore() >= options.getCandidateFloor()) {
                candidates.add(scored);
            }
        }

        candidates.sort(Comparator.comparingDouble(PlantMatch::getScore).reversed()
                .thenComparing(PlantMatch::getPlantId, Comparator.nullsLast(Comparator.naturalOrder())));
        if (candidates.size() > options.getMaxCandidates()) {
            candidates = new ArrayList<>(candidates.subList(0, options.getMaxCandidates()));
        }

        PlantMatch best = candidates.isEmpty() ? null : candidates.get(0);
        double confidence = best != null ? best.getScore() : 0.0;

        boolean tied = candidates.size() > 1
                && best.getScore() - candidates.get(1).getScore() <= options.getTieEpsilon();
        boolean manualReview = best == null || confidence < options.getThreshold() || tied;

        if (log.isDebugEnabled()) {
            log.debug("Row {}: {} candidates, best {} ({}), manual review {}", record.getRowIndex(),
                    candidates.size(), best != null ? best.getPlantId() : null, confidence, manualReview);
        }

        return PlantMatchResult.builder()
                .rowIndex(record.getRowIndex())
                .originalData(originalData)
                .matches(List.copyOf(candidates))
                .bestMatch(best)
                .confidence(confidence)
                .exactMatch(false)
                .taxonomyOnly(!withCommonName)
                .requiresManualReview(manualReview)
                .build();
    }

    /**
     * Case-insensitive equality on family, genus, species and cultivar. A missing cultivar
     * only equals a missing cultivar.
     */
    CatalogPlant findExact(ProcessedRecord record, CatalogSnapshot snapshot) {
        if (record.getFamily() == null || record.getGenus() == null || record.getSpecies() == null) {
            return null;
        }
        for (CatalogPlant plant : snapshot.getPlants()) {
            if (equalsIgnoreCase(record.getFamily(), plant.getFamily())
                    && equalsIgnoreCase(record.getGenus(), plant.getGenus())
                    && equalsIgnoreCase(record.getSpecies(), plant.getSpecies())
                    && equalsIgnoreCase(record.getCultivar(), plant.getCultivar())) {
                return plant;
            }
        }
        return null;
    }

    PlantMatch score(ProcessedRecord record, CatalogPlant plant, ImportProperties.MatchWeights weights) {
        return score(record, plant, weights, true);
    }

    PlantMatch score(ProcessedRecord record, CatalogPlant plant, ImportProperties.MatchWeights weights,
                     boolean withCommonName) {
        List<String> matchedFields = new ArrayList<>();
        double totalScore = 0;
        double maxScore = 0;

        if (record.getFamily() != null && plant.getFamily() != null) {
            maxScore += weights.family();
            double similarity = similarity(record.getFamily(), plant.getFamily());
            if (similarity >= TAXONOMY_FIELD_FLOOR) {
                totalScore += similarity * weights.family();
                matchedFields.add("family");
            }
        }

        if (record.getGenus() != null && plant.getGenus() != null) {
            maxScore += weights.genus();
            double similarity = similarity(record.getGenus(), plant.getGenus());
            if (similarity >= TAXONOMY_FIELD_FLOOR) {
                totalScore += similarity * weights.genus();
                matchedFields.add("genus");
            }
        }

        if (record.getSpecies() != null && plant.getSpecies() != null) {
            maxScore += weights.species();
            double similarity = similarity(record.getSpecies(), plant.getSpecies());
            if (similarity >= TAXONOMY_FIELD_FLOOR) {
                totalScore += similarity * weights.species();
                matchedFields.add("species");
            }
        }

        // Cultivar counts when either side has one; a one-sided cultivar earns nothing
        if (record.getCultivar() != null || plant.getCultivar() != null) {
            maxScore += weights.cultivar();
            if (record.getCultivar() != null && plant.getCultivar() != null) {
                double similarity = similarity(record.getCultivar(), plant.getCultivar());
                if (similarity >= TAXONOMY_FIELD_FLOOR) {
                    totalScore += similarity * weights.cultivar();
                    matchedFields.add("cultivar");
                }
            }
        }

        if (withCommonName && record.getCommonName() != null && plant.getCommonName() != null) {
            maxScore += weights.commonName();
            double similarity = similarity(record.getCommonName(), plant.getCommonName());
            if (similarity >= COMMON_NAME_FIELD_FLOOR) {
                totalScore += similarity * weights.commonName();
                matchedFields.add("commonName");
            }
        }

        double score = maxScore > 0 ? Math.min(totalScore / maxScore, 1.0) : 0.0;

        return PlantMatch.builder()
                .plantId(plant.getId())
                .score(round(score))
                .matchedFields(List.copyOf(matchedFields))
                .plant(plant)
                .build();
    }

    /**
     * 1.0 for equal strings, 0.9 when one contains the other, otherwise normalized Levenshtein
     */
    static double similarity(String left, String right) {
        String s1 = left.toLowerCase(Locale.ROOT).trim();
        String s2 = right.toLowerCase(Locale.ROOT).trim();

        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.contains(s2) || s2.contains(s1)) {
            return SUBSTRING_SIMILARITY;
        }

        int distance = LEVENSHTEIN.apply(s1, s2);
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - (double) distance / maxLength;
    }

    private static boolean equalsIgnoreCase(String left, String right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        return left.trim().equalsIgnoreCase(right.trim());
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }

    private static Map<String, String> describe(ProcessedRecord record) {
        Map<String, String> data = new LinkedHashMap<>();
        putIfPresent(data, "family", record.getFamily());
        putIfPresent(data, "genus", record.getGenus());
        putIfPresent(data, "species", record.getSpecies());
        putIfPresent(data, "cultivar", record.getCultivar());
        putIfPresent(data, "commonName", record.getCommonName());
        return data;
    }

    private static void putIfPresent(Map<String, String> data, String key, String value) {
        if (value != null) {
            data.put(key, value);
        }
    }
}
