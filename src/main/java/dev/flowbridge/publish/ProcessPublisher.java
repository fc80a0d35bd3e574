package dev.flowbridge.publish;

import dev.flowbridge.model.ConversionOutcome;

import java.io.IOException;

/**
 * Destination for validated processes (a directory, a platform API, ...).
 * Rejected outcomes carry no process and can never be published.
 */
public interface ProcessPublisher {

    /**
     * Publish one validated conversion.
     *
     * @param outcome a conversion whose document passed validation
     * @return where the process and its report ended up
     */
    PublishReceipt publish(ConversionOutcome.Validated outcome) throws IOException;

    /** Get publisher display name. */
    String getName();
}
