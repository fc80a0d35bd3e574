package dev.flowbridge.engine;

import dev.flowbridge.model.MapOperation;
import dev.flowbridge.model.Step;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates the Groovy data-process script for a MAP step that a plain map
 * shape cannot express. Each document is parsed as JSON, the operations are
 * applied in order, and the result is stored back.
 */
final class ScriptGenerator {

    private static final Pattern TOKEN = Pattern.compile("%([^%]+)%");

    private static final String HEADER = """
        import groovy.json.JsonSlurper
        import groovy.json.JsonOutput

        // generated from %s
        def read = { Map d, String p -> p.split('/').inject(d) { m, k -> m instanceof Map ? m.get(k) : null } }
        def write = { Map d, String p, v ->
            def keys = p.split('/')
            def m = d
            keys[0..<-1].each { k -> m = m.computeIfAbsent(k) { [:] } }
            m.put(keys[-1], v)
        }
        def drop = { Map d, String p ->
            def keys = p.split('/')
            def m = keys.size() > 1 ? read(d, keys[0..<-1].join('/')) : d
            if (m instanceof Map) { m.remove(keys[-1]) }
        }
        def transform = { String service, List args ->
            throw new IllegalStateException("No generated equivalent for " + service + "; implement before deploying")
        }

        for (int i = 0; i < dataContext.getDataCount(); i++) {
            InputStream is = dataContext.getStream(i)
            Properties props = dataContext.getProperties(i)
            def doc = new JsonSlurper().parse(is)

        """;

    private static final String FOOTER = """

            dataContext.storeStream(new ByteArrayInputStream(JsonOutput.toJson(doc).getBytes('UTF-8')), props)
        }
        """;

    private ScriptGenerator() {}

    static String forMap(Step.MapStep map) {
        var body = new StringBuilder();
        for (MapOperation op : map.operations()) {
            body.append("    ").append(statement(op)).append('\n');
        }
        return HEADER.formatted(map.path()) + body.toString().stripTrailing() + FOOTER;
    }

    private static String statement(MapOperation op) {
        if (op instanceof MapOperation.Copy copy) {
            return "write(doc, %s, read(doc, %s))".formatted(quote(copy.to()), quote(copy.from()));
        }
        if (op instanceof MapOperation.Set set) {
            return "write(doc, %s, %s)".formatted(quote(set.field()), expression(set.value()));
        }
        if (op instanceof MapOperation.Drop drop) {
            return "drop(doc, %s)".formatted(quote(drop.field()));
        }
        MapOperation.Transform transform = (MapOperation.Transform) op;
        var args = transform.arguments().stream()
            .map(a -> "read(doc, %s)".formatted(quote(a)))
            .toList();
        return "write(doc, %s, transform(%s, [%s]))".formatted(
            quote(transform.to()), quote(transform.service()), String.join(", ", args));
    }

    /** A literal with {@code %name%} tokens becomes string concatenation. */
    static String expression(String value) {
        if (value == null || value.isEmpty()) {
            return "''";
        }
        var parts = new StringBuilder();
        Matcher m = TOKEN.matcher(value);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                append(parts, quote(value.substring(last, m.start())));
            }
            append(parts, "String.valueOf(read(doc, %s))".formatted(quote(m.group(1).trim())));
            last = m.end();
        }
        if (last < value.length()) {
            append(parts, quote(value.substring(last)));
        }
        return parts.toString();
    }

    private static void append(StringBuilder parts, String part) {
        if (!parts.isEmpty()) {
            parts.append(" + ");
        }
        parts.append(part);
    }

    static String quote(String text) {
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'")
            .replace("\n", "\\n").replace("\r", "\\r") + "'";
    }
}
