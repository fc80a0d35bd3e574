package dev.flowbridge.model;

import java.util.Optional;

/**
 * Declared type of a pipeline variable, using the source language's type codes.
 */
public enum FieldType {
    STRING("string"),
    STRING_LIST("stringList"),
    DOCUMENT("document"),
    DOCUMENT_LIST("documentList"),
    OBJECT("object"),
    OBJECT_LIST("objectList"),
    UNKNOWN("unknown");

    private final String code;

    FieldType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isList() {
        return this == STRING_LIST || this == DOCUMENT_LIST || this == OBJECT_LIST;
    }

    /** Type of one element when iterating a list; non-list types map to themselves. */
    public FieldType elementType() {
        return switch (this) {
            case STRING_LIST -> STRING;
            case DOCUMENT_LIST -> DOCUMENT;
            case OBJECT_LIST -> OBJECT;
            default -> this;
        };
    }

    /** List type collecting elements of this type. */
    public FieldType listType() {
        return switch (this) {
            case STRING, STRING_LIST -> STRING_LIST;
            case DOCUMENT, DOCUMENT_LIST -> DOCUMENT_LIST;
            default -> OBJECT_LIST;
        };
    }

    public static Optional<FieldType> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        for (FieldType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
