package dev.flowbridge.engine;

import dev.flowbridge.model.*;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Parses a {@code flow.xml} document into a {@link FlowDefinition}.
 *
 * <p>Tags and attribute names are matched without regard to case. Any
 * structural problem is reported as a {@link FlowParseException} naming the
 * step path where it was found; a partial tree is never returned.
 */
public final class FlowParser {

    private static final String ROOT = FlowDefinition.ROOT_PATH;

    private FlowParser() {}

    public static FlowDefinition parse(String xml) throws FlowParseException {
        return parse(new InputSource(new StringReader(xml)));
    }

    public static FlowDefinition parse(Path path) throws IOException, FlowParseException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(new InputSource(in));
        }
    }

    private static FlowDefinition parse(InputSource source) throws FlowParseException {
        Document doc;
        try {
            doc = Xml.secureBuilder(false).parse(source);
        } catch (SAXException | IOException e) {
            throw new FlowParseException("Malformed XML: " + e.getMessage(), ROOT, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration rejected", e);
        }

        Element root = doc.getDocumentElement();
        if (!ROOT.equals(Xml.tag(root))) {
            throw new FlowParseException("Root element must be FLOW, found " + root.getTagName(), ROOT);
        }
        String name = Xml.attr(root, "NAME");
        if (name == null || name.isBlank()) {
            name = "unnamed";
        }

        var signature = new ArrayList<FieldDecl>();
        var stepElements = new ArrayList<Element>();
        for (Element child : Xml.children(root)) {
            if ("SIGNATURE".equals(Xml.tag(child))) {
                signature.addAll(parseSignature(child));
            } else {
                stepElements.add(child);
            }
        }
        return new FlowDefinition(name, signature, parseSteps(stepElements, ROOT));
    }

    private static List<FieldDecl> parseSignature(Element signature) throws FlowParseException {
        var fields = new ArrayList<FieldDecl>();
        String locator = ROOT + "/SIGNATURE";
        for (Element field : Xml.children(signature)) {
            if (!"FIELD".equals(Xml.tag(field))) {
                throw new FlowParseException("SIGNATURE accepts only FIELD elements, found " + field.getTagName(), locator);
            }
            String fieldName = required(field, "NAME", locator);
            FieldType type = type(field, locator);
            fields.add(new FieldDecl(fieldName, type == null ? FieldType.UNKNOWN : type));
        }
        return fields;
    }

    private static List<Step> parseSteps(List<Element> elements, String parentPath) throws FlowParseException {
        var steps = new ArrayList<Step>();
        for (Element element : elements) {
            String tag = Xml.tag(element);
            String path = "%s/%s[%d]".formatted(parentPath, tag, steps.size());
            if ("CASE".equals(tag)) {
                throw new FlowParseException("CASE is only allowed directly under BRANCH", path);
            }
            Verb verb = Verb.fromTag(tag)
                .orElseThrow(() -> new FlowParseException("Unknown verb " + element.getTagName(), path));
            if (verb == Verb.CATCH && (steps.isEmpty() || !(steps.get(steps.size() - 1) instanceof Step.TryStep))) {
                throw new FlowParseException("CATCH must directly follow a TRY", path);
            }
            steps.add(parseStep(verb, element, path));
        }
        return steps;
    }

    private static Step parseStep(Verb verb, Element element, String path) throws FlowParseException {
        String name = Xml.attr(element, "NAME");
        return switch (verb) {
            case MAP -> new Step.MapStep(path, name, parseMapOperations(element, path, MAP_OPERATIONS));
            case BRANCH -> parseBranch(element, path, name);
            case LOOP -> new Step.LoopStep(path, name,
                required(element, "INPUT", path), Xml.attr(element, "OUTPUT"),
                parseSteps(Xml.children(element), path), promote(element));
            case REPEAT -> new Step.RepeatStep(path, name, count(element, path),
                enumAttr(element, "REPEAT-ON", Step.RepeatOn.class, Step.RepeatOn.FAILURE, path),
                parseSteps(Xml.children(element), path), promote(element));
            case SEQUENCE -> new Step.SequenceStep(path, name,
                enumAttr(element, "EXIT-ON", Step.ExitOn.class, Step.ExitOn.FAILURE, path),
                parseSteps(Xml.children(element), path), promote(element));
            case TRY -> new Step.TryStep(path, name, parseSteps(Xml.children(element), path), promote(element));
            case CATCH -> new Step.CatchStep(path, name, Xml.attr(element, "EXCEPTION"),
                parseSteps(Xml.children(element), path), promote(element));
            case INVOKE -> parseInvoke(element, path, name);
            case EXIT -> {
                noChildren(element, path);
                String from = Xml.attr(element, "FROM");
                yield new Step.ExitStep(path, name,
                    from == null || from.isBlank() ? Step.ExitStep.FROM_FLOW : from,
                    enumAttr(element, "SIGNAL", Step.Signal.class, Step.Signal.SUCCESS, path),
                    Xml.attr(element, "MESSAGE"));
            }
        };
    }

    private static Step parseBranch(Element element, String path, String name) throws FlowParseException {
        var cases = new ArrayList<BranchCase>();
        var labels = new HashSet<String>();
        boolean sawDefault = false;
        for (Element child : Xml.children(element)) {
            if (!"CASE".equals(Xml.tag(child))) {
                throw new FlowParseException("BRANCH accepts only CASE children, found " + child.getTagName(), path);
            }
            String label = Xml.attr(child, "LABEL");
            boolean isDefault = BranchCase.DEFAULT_LABEL.equals(label)
                || "true".equalsIgnoreCase(Xml.attr(child, "DEFAULT"));
            if (isDefault) {
                if (sawDefault) {
                    throw new FlowParseException("BRANCH has more than one default case", path);
                }
                sawDefault = true;
                label = BranchCase.DEFAULT_LABEL;
            } else if (label == null) {
                throw new FlowParseException("CASE is missing LABEL", path);
            }
            if (!labels.add(label)) {
                throw new FlowParseException("Duplicate CASE label '%s'".formatted(label), path);
            }
            String casePath = "%s/CASE[%s]".formatted(path, label);
            cases.add(new BranchCase(label, isDefault, parseSteps(Xml.children(child), casePath)));
        }
        return new Step.BranchStep(path, name, Xml.attr(element, "SWITCH"), cases, promote(element));
    }

    private static Step parseInvoke(Element element, String path, String name) throws FlowParseException {
        String service = required(element, "SERVICE", path);
        var inputs = new ArrayList<MapOperation>();
        var outputs = new ArrayList<MapOperation>();
        for (Element child : Xml.children(element)) {
            switch (Xml.tag(child)) {
                case "INPUT" -> inputs.addAll(parseMapOperations(child, path + "/INPUT", INPUT_OPERATIONS));
                case "OUTPUT" -> outputs.addAll(parseMapOperations(child, path + "/OUTPUT", OUTPUT_OPERATIONS));
                default -> throw new FlowParseException(
                    "INVOKE accepts only INPUT and OUTPUT, found " + child.getTagName(), path);
            }
        }
        return new Step.InvokeStep(path, name, service, inputs, outputs);
    }

    // --- map operations ---

    private static final Set<String> MAP_OPERATIONS = Set.of("MAPCOPY", "MAPSET", "MAPDROP", "MAPINVOKE");
    private static final Set<String> INPUT_OPERATIONS = Set.of("MAPCOPY", "MAPSET");
    private static final Set<String> OUTPUT_OPERATIONS = Set.of("MAPCOPY", "MAPDROP");

    private static List<MapOperation> parseMapOperations(Element parent, String path, Set<String> allowed)
            throws FlowParseException {
        var operations = new ArrayList<MapOperation>();
        for (Element child : Xml.children(parent)) {
            String tag = Xml.tag(child);
            String locator = "%s/%s[%d]".formatted(path, tag, operations.size());
            if (!allowed.contains(tag)) {
                if (Verb.fromTag(tag).isPresent()) {
                    throw new FlowParseException("%s does not accept child steps".formatted(Xml.tag(parent)), path);
                }
                throw new FlowParseException("Unexpected element %s, expected one of %s"
                    .formatted(child.getTagName(), new TreeSet<>(allowed)), locator);
            }
            operations.add(switch (tag) {
                case "MAPCOPY" -> new MapOperation.Copy(
                    required(child, "FROM", locator), required(child, "TO", locator), type(child, locator));
                case "MAPSET" -> new MapOperation.Set(
                    required(child, "FIELD", locator), literal(child), type(child, locator));
                case "MAPDROP" -> new MapOperation.Drop(required(child, "FIELD", locator));
                default -> parseTransform(child, locator);
            });
        }
        return operations;
    }

    private static MapOperation parseTransform(Element element, String locator) throws FlowParseException {
        String service = required(element, "SERVICE", locator);
        String to = required(element, "TO", locator);
        var arguments = new ArrayList<String>();
        for (Element arg : Xml.children(element)) {
            if (!"ARG".equals(Xml.tag(arg))) {
                throw new FlowParseException("MAPINVOKE accepts only ARG children, found " + arg.getTagName(), locator);
            }
            arguments.add(required(arg, "FROM", locator));
        }
        return new MapOperation.Transform(service, arguments, to, type(element, locator));
    }

    private static String literal(Element element) {
        String value = Xml.attr(element, "VALUE");
        return value != null ? value : element.getTextContent().trim();
    }

    // --- attributes ---

    private static String required(Element element, String attribute, String locator) throws FlowParseException {
        String value = Xml.attr(element, attribute);
        if (value == null || value.isBlank()) {
            throw new FlowParseException("%s is missing required attribute %s"
                .formatted(Xml.tag(element), attribute), locator);
        }
        return value.trim();
    }

    private static FieldType type(Element element, String locator) throws FlowParseException {
        String code = Xml.attr(element, "TYPE");
        if (code == null || code.isBlank()) {
            return null;
        }
        return FieldType.fromCode(code)
            .orElseThrow(() -> new FlowParseException("Unknown field type '%s'".formatted(code), locator));
    }

    private static int count(Element element, String path) throws FlowParseException {
        String value = Xml.attr(element, "COUNT");
        if (value == null || value.isBlank()) {
            return -1;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new FlowParseException("REPEAT COUNT must be numeric, found '%s'".formatted(value), path, e);
        }
    }

    private static <E extends Enum<E>> E enumAttr(Element element, String attribute, Class<E> type,
                                                  E fallback, String path) throws FlowParseException {
        String value = Xml.attr(element, attribute);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new FlowParseException("Invalid %s value '%s', expected one of %s"
                .formatted(attribute, value, Arrays.toString(type.getEnumConstants())), path, e);
        }
    }

    private static List<String> promote(Element element) {
        String value = Xml.attr(element, "PROMOTE");
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static void noChildren(Element element, String path) throws FlowParseException {
        if (!Xml.children(element).isEmpty()) {
            throw new FlowParseException("%s does not accept child steps".formatted(Xml.tag(element)), path);
        }
    }
}
