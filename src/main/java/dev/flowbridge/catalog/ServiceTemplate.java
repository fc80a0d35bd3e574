package dev.flowbridge.catalog;

import dev.flowbridge.model.FieldDecl;
import dev.flowbridge.model.ShapeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How one source service is expressed in the target platform.
 */
public record ServiceTemplate(
    String service,
    ShapeKind shape,
    Map<String, String> configuration,
    List<FieldDecl> outputs,
    int confidence,
    String note // nullable; review note attached whenever the template is used
) {
    public ServiceTemplate {
        configuration = Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        outputs = List.copyOf(outputs);
    }

    public boolean isConnector() {
        return shape == ShapeKind.CONNECTOR;
    }

    public String connectorType() {
        return configuration.get("connectorType");
    }
}
