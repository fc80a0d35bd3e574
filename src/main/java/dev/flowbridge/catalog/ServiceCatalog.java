package dev.flowbridge.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Versioned, read-only table from source service identifier to target template.
 * Safe to share between concurrent conversions.
 */
public final class ServiceCatalog {

    private final String version;
    private final Map<String, ServiceTemplate> templates;

    public ServiceCatalog(String version, Map<String, ServiceTemplate> templates) {
        this.version = version;
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    public static ServiceCatalog empty() {
        return new ServiceCatalog("empty", Map.of());
    }

    public String version() {
        return version;
    }

    public CatalogEntry lookup(String service) {
        ServiceTemplate template = service == null ? null : templates.get(service.trim());
        if (template == null) {
            return new CatalogEntry.Unresolved(service);
        }
        return new CatalogEntry.Known(template);
    }

    public int size() {
        return templates.size();
    }

    /**
     * Overlay another catalog on this one. Entries of {@code overlay} win;
     * the version string records both sources.
     */
    public ServiceCatalog merge(ServiceCatalog overlay) {
        var merged = new LinkedHashMap<>(templates);
        merged.putAll(overlay.templates);
        return new ServiceCatalog(version + "+" + overlay.version, merged);
    }
}
