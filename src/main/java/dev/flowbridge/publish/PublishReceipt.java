package dev.flowbridge.publish;

import java.nio.file.Path;

/**
 * Where one published process was written.
 */
public record PublishReceipt(
    String flowName,
    Path processFile,
    Path reportFile,
    int aggregateConfidence,
    boolean readyForUnattendedDeployment
) {}
