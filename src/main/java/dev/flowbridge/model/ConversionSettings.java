package dev.flowbridge.model;

/**
 * Scoring and layout knobs for a conversion run.
 */
public record ConversionSettings(
    int mappingConfidence,
    int danglingPenalty,
    int scriptConfidence,
    int expressionConfidence,
    int approximationConfidence,
    int manualReviewCeiling,
    int unattendedThreshold,
    int patternMinimumConfidence,
    int maxRetryCount,
    int columnSpacing,
    int rowSpacing
) {
    public static final int DEFAULT_MAPPING_CONFIDENCE = 90;
    public static final int DEFAULT_DANGLING_PENALTY = 15;
    public static final int DEFAULT_SCRIPT_CONFIDENCE = 60;
    public static final int DEFAULT_EXPRESSION_CONFIDENCE = 75;
    public static final int DEFAULT_APPROXIMATION_CONFIDENCE = 60;
    public static final int DEFAULT_MANUAL_REVIEW_CEILING = 70;
    public static final int DEFAULT_UNATTENDED_THRESHOLD = 80;
    public static final int DEFAULT_PATTERN_MINIMUM_CONFIDENCE = 85;
    public static final int DEFAULT_MAX_RETRY_COUNT = 5;
    public static final int DEFAULT_COLUMN_SPACING = 250;
    public static final int DEFAULT_ROW_SPACING = 150;

    public ConversionSettings {
        if (unattendedThreshold <= manualReviewCeiling) {
            throw new IllegalArgumentException(
                "unattendedThreshold (%d) must be above manualReviewCeiling (%d)"
                    .formatted(unattendedThreshold, manualReviewCeiling));
        }
        if (scriptConfidence > manualReviewCeiling) {
            throw new IllegalArgumentException(
                "scriptConfidence (%d) must not exceed manualReviewCeiling (%d)"
                    .formatted(scriptConfidence, manualReviewCeiling));
        }
    }

    public static ConversionSettings defaults() {
        return new ConversionSettings(
            DEFAULT_MAPPING_CONFIDENCE, DEFAULT_DANGLING_PENALTY, DEFAULT_SCRIPT_CONFIDENCE,
            DEFAULT_EXPRESSION_CONFIDENCE, DEFAULT_APPROXIMATION_CONFIDENCE,
            DEFAULT_MANUAL_REVIEW_CEILING, DEFAULT_UNATTENDED_THRESHOLD,
            DEFAULT_PATTERN_MINIMUM_CONFIDENCE, DEFAULT_MAX_RETRY_COUNT,
            DEFAULT_COLUMN_SPACING, DEFAULT_ROW_SPACING);
    }

    public ConversionSettings withUnattendedThreshold(int threshold) {
        return new ConversionSettings(
            mappingConfidence, danglingPenalty, scriptConfidence, expressionConfidence,
            approximationConfidence, manualReviewCeiling, threshold, patternMinimumConfidence,
            maxRetryCount, columnSpacing, rowSpacing);
    }
}
