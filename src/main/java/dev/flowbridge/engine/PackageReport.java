package dev.flowbridge.engine;

import dev.flowbridge.model.ConversionOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-flow results of converting a package, in input order.
 */
public record PackageReport(List<Entry> entries) {

    public PackageReport {
        entries = List.copyOf(entries);
    }

    public sealed interface Entry {
        Path source();
    }

    /** The flow parsed; its outcome may still be a rejection. */
    public record Converted(Path source, ConversionOutcome outcome) implements Entry {}

    /** The flow could not be read or parsed. {@code locator} is null for I/O failures. */
    public record Failed(Path source, String locator, String message) implements Entry {}

    public List<ConversionOutcome.Validated> validated() {
        return entries.stream()
            .filter(e -> e instanceof Converted c && c.outcome() instanceof ConversionOutcome.Validated)
            .map(e -> (ConversionOutcome.Validated) ((Converted) e).outcome())
            .toList();
    }

    public List<ConversionOutcome.Rejected> rejected() {
        return entries.stream()
            .filter(e -> e instanceof Converted c && c.outcome() instanceof ConversionOutcome.Rejected)
            .map(e -> (ConversionOutcome.Rejected) ((Converted) e).outcome())
            .toList();
    }

    public List<Failed> failed() {
        return entries.stream().filter(e -> e instanceof Failed).map(e -> (Failed) e).toList();
    }

    public boolean allValidated() {
        return validated().size() == entries.size();
    }
}
