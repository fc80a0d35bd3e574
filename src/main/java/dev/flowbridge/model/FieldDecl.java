package dev.flowbridge.model;

/**
 * A named, typed field from a flow signature or a service's declared outputs.
 */
public record FieldDecl(String name, FieldType type) {}
