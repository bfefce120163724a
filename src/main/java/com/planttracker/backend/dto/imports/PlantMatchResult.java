package com.planttracker.backend.dto.imports;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Candidates for one row, ordered by descending score.
 */
@Value
@Builder
public class PlantMatchResult {
    int rowIndex;
    Map<String, String> originalData;
    List<PlantMatch> matches;
    PlantMatch bestMatch;
    boolean requiresManualReview;
    double confidence;
    boolean exactMatch;
    /** Scored without the common name */
    boolean taxonomyOnly;

    public boolean hasBestMatch() {
        return bestMatch != null;
    }

    /**
     * More than one candidate sits within the tie window of the top score
     */
    public boolean isAmbiguous(double tieEpsilon) {
        if (bestMatch == null || matches.size() < 2) {
            return false;
        }
        return bestMatch.getScore() - matches.get(1).getScore() <= tieEpsilon;
    }
}
