package dev.flowbridge.model;

import java.util.List;

/**
 * Final verdict for one flow conversion.
 */
public sealed interface ConversionOutcome {

    String flowName();

    ValidationReport report();

    /** The document passed validation and may be published. */
    record Validated(ConversionResult result, ValidationReport report) implements ConversionOutcome {
        @Override
        public String flowName() { return result.flowName(); }
    }

    /** The document had blocking errors; no graph is exposed. */
    record Rejected(String flowName, ValidationReport report, List<ReviewNote> reviewNotes,
                    List<ConversionWarning> warnings) implements ConversionOutcome {
        public Rejected {
            reviewNotes = List.copyOf(reviewNotes);
            warnings = List.copyOf(warnings);
        }
    }
}
