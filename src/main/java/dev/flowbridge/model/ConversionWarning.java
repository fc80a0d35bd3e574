package dev.flowbridge.model;

/**
 * A recoverable problem found while converting a flow. Warnings never abort a conversion;
 * they lower confidence and are reported with the result.
 */
public sealed interface ConversionWarning {

    String stepPath();

    String message();

    /** A step reads a variable that is not in its pre-state. */
    record DanglingReference(String stepPath, String variable) implements ConversionWarning {
        @Override
        public String message() {
            return "Variable '%s' is not in the pipeline at this point".formatted(variable);
        }
    }

    /** An invocation targets a service absent from the catalog. */
    record UnresolvedInvocation(String stepPath, String service) implements ConversionWarning {
        @Override
        public String message() {
            return "Service '%s' has no catalog entry; emitted a placeholder".formatted(service);
        }
    }
}
