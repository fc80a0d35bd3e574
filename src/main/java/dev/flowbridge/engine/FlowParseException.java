package dev.flowbridge.engine;

/**
 * A flow definition that cannot be parsed. Fatal for that flow; nothing partial is returned.
 */
public class FlowParseException extends Exception {

    private final String locator;

    public FlowParseException(String message, String locator) {
        super("%s (at %s)".formatted(message, locator));
        this.locator = locator;
    }

    public FlowParseException(String message, String locator, Throwable cause) {
        super("%s (at %s)".formatted(message, locator), cause);
        this.locator = locator;
    }

    /** Step path of the malformed construct, e.g. {@code FLOW/LOOP[1]}. */
    public String locator() {
        return locator;
    }
}
