package dev.flowbridge.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowbridge.catalog.PatternTemplate.ElementMatcher;
import dev.flowbridge.catalog.PatternTemplate.Requirement;
import dev.flowbridge.catalog.PatternTemplate.ShapeSpec;
import dev.flowbridge.model.ConversionSettings;
import dev.flowbridge.model.FieldDecl;
import dev.flowbridge.model.FieldType;
import dev.flowbridge.model.ShapeKind;
import dev.flowbridge.model.Verb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the service catalog and the pattern catalog from JSON.
 * Both are read once per run and shared read-only afterwards.
 */
public final class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String BUILT_IN_SERVICES = "/catalog/services.json";
    public static final String BUILT_IN_PATTERNS = "/catalog/patterns.json";

    private CatalogLoader() {}

    /**
     * The service catalog shipped on the classpath.
     */
    public static ServiceCatalog builtInServices() throws IOException {
        return parseServices(readResource(BUILT_IN_SERVICES), BUILT_IN_SERVICES);
    }

    public static ServiceCatalog loadServices(Path path) throws IOException {
        return parseServices(MAPPER.readTree(path.toFile()), path.toString());
    }

    public static ServiceCatalog loadServicesFromString(String json) throws IOException {
        return parseServices(MAPPER.readTree(json), "<string>");
    }

    /**
     * The built-in catalog with each extra file merged over it, in order.
     */
    public static ServiceCatalog servicesWithOverlays(List<Path> overlays) throws IOException {
        ServiceCatalog catalog = builtInServices();
        for (Path overlay : overlays) {
            catalog = catalog.merge(loadServices(overlay));
        }
        return catalog;
    }

    /**
     * The pattern catalog shipped on the classpath.
     */
    public static PatternCatalog builtInPatterns() throws IOException {
        return parsePatterns(readResource(BUILT_IN_PATTERNS), BUILT_IN_PATTERNS);
    }

    public static PatternCatalog loadPatterns(Path path) throws IOException {
        return parsePatterns(MAPPER.readTree(path.toFile()), path.toString());
    }

    public static PatternCatalog loadPatternsFromString(String json) throws IOException {
        return parsePatterns(MAPPER.readTree(json), "<string>");
    }

    private static JsonNode readResource(String resource) throws IOException {
        try (InputStream in = CatalogLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Catalog resource not found on classpath: " + resource);
            }
            return MAPPER.readTree(in);
        }
    }

    // --- services ---

    private static ServiceCatalog parseServices(JsonNode root, String source) {
        String version = text(root, "version", "unversioned");
        JsonNode servicesNode = root.get("services");
        if (servicesNode == null || !servicesNode.isObject()) {
            throw new IllegalArgumentException("Service catalog %s has no 'services' object".formatted(source));
        }
        var templates = new LinkedHashMap<String, ServiceTemplate>();
        for (var entry : servicesNode.properties()) {
            templates.put(entry.getKey(), parseService(entry.getKey(), entry.getValue()));
        }
        log.debug("Loaded {} service templates from {} (version {})", templates.size(), source, version);
        return new ServiceCatalog(version, templates);
    }

    private static ServiceTemplate parseService(String id, JsonNode node) {
        String shapeName = text(node, "shape", null);
        ShapeKind shape = ShapeKind.fromName(shapeName)
            .orElseThrow(() -> new IllegalArgumentException(
                "Service '%s' has unknown shape '%s'".formatted(id, shapeName)));
        if (shape == ShapeKind.START || shape == ShapeKind.STOP || shape == ShapeKind.PLACEHOLDER) {
            throw new IllegalArgumentException(
                "Service '%s' may not map to a %s shape".formatted(id, shape));
        }

        Map<String, String> configuration = stringMap(node.get("configuration"));
        for (String key : shape.requiredConfiguration()) {
            if (!configuration.containsKey(key)) {
                throw new IllegalArgumentException(
                    "Service '%s' is missing required %s configuration '%s'".formatted(id, shape, key));
            }
        }

        var outputs = new ArrayList<FieldDecl>();
        JsonNode outputsNode = node.get("outputs");
        if (outputsNode != null) {
            for (JsonNode output : outputsNode) {
                String name = text(output, "name", null);
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("Service '%s' declares an output without a name".formatted(id));
                }
                String typeCode = text(output, "type", "unknown");
                FieldType type = FieldType.fromCode(typeCode)
                    .orElseThrow(() -> new IllegalArgumentException(
                        "Service '%s' output '%s' has unknown type '%s'".formatted(id, name, typeCode)));
                outputs.add(new FieldDecl(name, type));
            }
        }

        int confidence = node.has("confidence") ? node.get("confidence").asInt() : 90;
        checkConfidence(confidence, "Service '%s'".formatted(id));
        String note = text(node, "note", null);
        return new ServiceTemplate(id, shape, configuration, outputs, confidence, note);
    }

    // --- patterns ---

    private static PatternCatalog parsePatterns(JsonNode root, String source) {
        String version = text(root, "version", "unversioned");
        JsonNode patternsNode = root.get("patterns");
        if (patternsNode == null || !patternsNode.isArray()) {
            throw new IllegalArgumentException("Pattern catalog %s has no 'patterns' array".formatted(source));
        }
        var patterns = new ArrayList<PatternTemplate>();
        var seen = new HashSet<String>();
        for (JsonNode node : patternsNode) {
            PatternTemplate pattern = parsePattern(node);
            if (!seen.add(pattern.id())) {
                throw new IllegalArgumentException("Duplicate pattern id '%s'".formatted(pattern.id()));
            }
            patterns.add(pattern);
        }
        log.debug("Loaded {} pattern templates from {} (version {})", patterns.size(), source, version);
        return new PatternCatalog(version, patterns);
    }

    private static PatternTemplate parsePattern(JsonNode node) {
        String id = text(node, "id", null);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Pattern without an id: " + node);
        }
        String description = text(node, "description", "");
        int confidence = node.has("confidence")
            ? node.get("confidence").asInt() : ConversionSettings.DEFAULT_PATTERN_MINIMUM_CONFIDENCE;
        checkConfidence(confidence, "Pattern '%s'".formatted(id));

        List<ElementMatcher> sequence = parseMatchers(id, node.get("sequence"));
        if (sequence.isEmpty()) {
            throw new IllegalArgumentException("Pattern '%s' has an empty sequence".formatted(id));
        }

        var shapes = new ArrayList<ShapeSpec>();
        JsonNode shapesNode = node.get("shapes");
        if (shapesNode == null || shapesNode.isEmpty()) {
            throw new IllegalArgumentException("Pattern '%s' declares no shapes".formatted(id));
        }
        for (JsonNode shapeNode : shapesNode) {
            String kindName = text(shapeNode, "kind", null);
            ShapeKind kind = ShapeKind.fromName(kindName)
                .orElseThrow(() -> new IllegalArgumentException(
                    "Pattern '%s' has unknown shape kind '%s'".formatted(id, kindName)));
            shapes.add(new ShapeSpec(kind, text(shapeNode, "label", kind.name()),
                stringMap(shapeNode.get("configuration"))));
        }

        var notes = new ArrayList<String>();
        JsonNode notesNode = node.get("notes");
        if (notesNode != null) {
            notesNode.forEach(n -> notes.add(n.asText()));
        }
        return new PatternTemplate(id, description, confidence, sequence, shapes, notes);
    }

    private static List<ElementMatcher> parseMatchers(String patternId, JsonNode node) {
        var matchers = new ArrayList<ElementMatcher>();
        if (node == null) {
            return matchers;
        }
        for (JsonNode matcherNode : node) {
            String verbName = text(matcherNode, "verb", null);
            Verb verb = Verb.fromTag(verbName)
                .orElseThrow(() -> new IllegalArgumentException(
                    "Pattern '%s' has unknown verb '%s'".formatted(patternId, verbName)));

            Set<Requirement> requires = EnumSet.noneOf(Requirement.class);
            JsonNode requiresNode = matcherNode.get("requires");
            if (requiresNode != null) {
                for (JsonNode r : requiresNode) {
                    try {
                        requires.add(Requirement.valueOf(r.asText().trim().toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException(
                            "Pattern '%s' has unknown requirement '%s'".formatted(patternId, r.asText()), e);
                    }
                }
            }

            List<ElementMatcher> body = parseMatchers(patternId, matcherNode.get("body"));
            if (!body.isEmpty() && verb != Verb.LOOP) {
                throw new IllegalArgumentException(
                    "Pattern '%s': only LOOP matchers may declare a body, found %s".formatted(patternId, verb));
            }
            matchers.add(new ElementMatcher(verb, requires, text(matcherNode, "as", null), body));
        }
        return matchers;
    }

    // --- helpers ---

    private static void checkConfidence(int confidence, String owner) {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("%s confidence %d is outside 0..100".formatted(owner, confidence));
        }
    }

    private static Map<String, String> stringMap(JsonNode node) {
        var map = new LinkedHashMap<String, String>();
        if (node != null) {
            for (var entry : node.properties()) {
                map.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return map;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }
}
