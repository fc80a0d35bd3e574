package dev.flowbridge.catalog;

/**
 * Result of a catalog lookup: a known target template, or an explicit miss.
 */
public sealed interface CatalogEntry {

    String service();

    record Known(ServiceTemplate template) implements CatalogEntry {
        @Override
        public String service() { return template.service(); }
    }

    record Unresolved(String service) implements CatalogEntry {}
}
