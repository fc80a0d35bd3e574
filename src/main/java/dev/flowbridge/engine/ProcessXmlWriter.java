package dev.flowbridge.engine;

import dev.flowbridge.model.ProcessDocument;
import dev.flowbridge.model.TargetEdge;
import dev.flowbridge.model.TargetNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.util.List;
import java.util.Map;

/**
 * Writes a process document as a platform component XML file.
 */
public final class ProcessXmlWriter {

    public static final String NAMESPACE = "http://api.platform.boomi.com/";

    private ProcessXmlWriter() {}

    public static String write(ProcessDocument process) {
        Document doc = Xml.newDocument(true);
        Element component = doc.createElementNS(NAMESPACE, "bns:Component");
        component.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:bns", NAMESPACE);
        component.setAttribute("name", process.name());
        component.setAttribute("type", "process");
        doc.appendChild(component);

        Element description = doc.createElementNS(NAMESPACE, "bns:description");
        description.setTextContent(process.description());
        component.appendChild(description);

        Element object = doc.createElementNS(NAMESPACE, "bns:object");
        component.appendChild(object);
        Element processEl = doc.createElement("process");
        object.appendChild(processEl);
        Element shapes = doc.createElement("shapes");
        processEl.appendChild(shapes);

        for (TargetNode node : process.nodes()) {
            shapes.appendChild(shape(doc, node, process.outgoing(node.id())));
        }
        return Xml.serialize(doc);
    }

    private static Element shape(Document doc, TargetNode node, List<TargetEdge> outgoing) {
        Element shape = doc.createElement("shape");
        shape.setAttribute("name", node.id());
        shape.setAttribute("shapetype", node.kind().shapeType());
        shape.setAttribute("userlabel", node.label());
        shape.setAttribute("x", Integer.toString(node.position().x()));
        shape.setAttribute("y", Integer.toString(node.position().y()));

        Element configuration = doc.createElement("configuration");
        configuration.setAttribute("kind", node.kind().name());
        for (var entry : node.configuration().entrySet()) {
            configuration.appendChild(entry(doc, entry.getKey(), entry.getValue()));
        }
        shape.appendChild(configuration);

        Element dragpoints = doc.createElement("dragpoints");
        int n = 1;
        for (TargetEdge edge : outgoing) {
            Element dragpoint = doc.createElement("dragpoint");
            dragpoint.setAttribute("name", "%s.dragpoint%d".formatted(node.id(), n++));
            dragpoint.setAttribute("toShape", edge.toId());
            Xml.setIfPresent(dragpoint, "text", edge.label());
            dragpoints.appendChild(dragpoint);
        }
        shape.appendChild(dragpoints);
        return shape;
    }

    private static Element entry(Document doc, String key, Object value) {
        Element entry = doc.createElement("entry");
        entry.setAttribute("key", key);
        if (value instanceof List<?> items) {
            for (Object item : items) {
                Element itemEl = doc.createElement("item");
                if (item instanceof Map<?, ?> fields) {
                    fields.forEach((k, v) -> {
                        Element field = doc.createElement("field");
                        field.setAttribute("name", String.valueOf(k));
                        field.setTextContent(String.valueOf(v));
                        itemEl.appendChild(field);
                    });
                } else {
                    itemEl.setTextContent(String.valueOf(item));
                }
                entry.appendChild(itemEl);
            }
        } else {
            entry.setTextContent(String.valueOf(value));
        }
        return entry;
    }
}
