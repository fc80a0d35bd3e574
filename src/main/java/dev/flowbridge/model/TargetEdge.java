package dev.flowbridge.model;

/**
 * Directed connection between two shapes. {@code label} is null for unlabelled paths.
 */
public record TargetEdge(String fromId, String toId, String label) {}
