package dev.flowbridge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowbridge.model.ConversionSettings;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads {@link ConversionSettings} from JSON. Every field is optional and
 * falls back to its default.
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {}

    public static ConversionSettings loadFromFile(Path path) throws IOException {
        return parse(MAPPER.readTree(path.toFile()));
    }

    public static ConversionSettings loadFromString(String json) throws IOException {
        return parse(MAPPER.readTree(json));
    }

    static ConversionSettings parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ConversionSettings.defaults();
        }
        return new ConversionSettings(
            intField(node, "mappingConfidence", ConversionSettings.DEFAULT_MAPPING_CONFIDENCE),
            intField(node, "danglingPenalty", ConversionSettings.DEFAULT_DANGLING_PENALTY),
            intField(node, "scriptConfidence", ConversionSettings.DEFAULT_SCRIPT_CONFIDENCE),
            intField(node, "expressionConfidence", ConversionSettings.DEFAULT_EXPRESSION_CONFIDENCE),
            intField(node, "approximationConfidence", ConversionSettings.DEFAULT_APPROXIMATION_CONFIDENCE),
            intField(node, "manualReviewCeiling", ConversionSettings.DEFAULT_MANUAL_REVIEW_CEILING),
            intField(node, "unattendedThreshold", ConversionSettings.DEFAULT_UNATTENDED_THRESHOLD),
            intField(node, "patternMinimumConfidence", ConversionSettings.DEFAULT_PATTERN_MINIMUM_CONFIDENCE),
            intField(node, "maxRetryCount", ConversionSettings.DEFAULT_MAX_RETRY_COUNT),
            intField(node, "columnSpacing", ConversionSettings.DEFAULT_COLUMN_SPACING),
            intField(node, "rowSpacing", ConversionSettings.DEFAULT_ROW_SPACING));
    }

    private static int intField(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("Setting '%s' must be an integer, found %s".formatted(field, value));
        }
        return value.asInt();
    }
}
