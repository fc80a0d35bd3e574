package dev.flowbridge.engine;

import dev.flowbridge.model.*;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Serializes a {@link FlowDefinition} back to {@code flow.xml}. Reading the
 * output with {@link FlowParser} yields an equal definition.
 */
public final class FlowWriter {

    private FlowWriter() {}

    public static String write(FlowDefinition flow) {
        Document doc = Xml.newDocument(false);
        Element root = doc.createElement("FLOW");
        root.setAttribute("NAME", flow.name());
        doc.appendChild(root);

        if (!flow.signature().isEmpty()) {
            Element signature = doc.createElement("SIGNATURE");
            for (FieldDecl field : flow.signature()) {
                Element el = doc.createElement("FIELD");
                el.setAttribute("NAME", field.name());
                el.setAttribute("TYPE", field.type().code());
                signature.appendChild(el);
            }
            root.appendChild(signature);
        }
        writeSteps(doc, root, flow.steps());
        return Xml.serialize(doc);
    }

    private static void writeSteps(Document doc, Element parent, List<Step> steps) {
        for (Step step : steps) {
            parent.appendChild(writeStep(doc, step));
        }
    }

    private static Element writeStep(Document doc, Step step) {
        Element el = doc.createElement(step.verb().name());
        Xml.setIfPresent(el, "NAME", step.name());
        if (!step.promote().isEmpty()) {
            el.setAttribute("PROMOTE", String.join(",", step.promote()));
        }

        if (step instanceof Step.MapStep map) {
            writeOperations(doc, el, map.operations());
        } else if (step instanceof Step.BranchStep branch) {
            Xml.setIfPresent(el, "SWITCH", branch.switchOn());
            for (BranchCase branchCase : branch.cases()) {
                Element caseEl = doc.createElement("CASE");
                caseEl.setAttribute("LABEL", branchCase.label());
                writeSteps(doc, caseEl, branchCase.steps());
                el.appendChild(caseEl);
            }
        } else if (step instanceof Step.LoopStep loop) {
            el.setAttribute("INPUT", loop.inputArray());
            Xml.setIfPresent(el, "OUTPUT", loop.outputArray());
            writeSteps(doc, el, loop.steps());
        } else if (step instanceof Step.RepeatStep repeat) {
            if (repeat.count() >= 0) {
                el.setAttribute("COUNT", Integer.toString(repeat.count()));
            }
            el.setAttribute("REPEAT-ON", repeat.repeatOn().name());
            writeSteps(doc, el, repeat.steps());
        } else if (step instanceof Step.SequenceStep sequence) {
            el.setAttribute("EXIT-ON", sequence.exitOn().name());
            writeSteps(doc, el, sequence.steps());
        } else if (step instanceof Step.TryStep tryStep) {
            writeSteps(doc, el, tryStep.steps());
        } else if (step instanceof Step.CatchStep catchStep) {
            Xml.setIfPresent(el, "EXCEPTION", catchStep.exceptionFilter());
            writeSteps(doc, el, catchStep.steps());
        } else if (step instanceof Step.InvokeStep invoke) {
            el.setAttribute("SERVICE", invoke.service());
            if (!invoke.inputs().isEmpty()) {
                Element input = doc.createElement("INPUT");
                writeOperations(doc, input, invoke.inputs());
                el.appendChild(input);
            }
            if (!invoke.outputs().isEmpty()) {
                Element output = doc.createElement("OUTPUT");
                writeOperations(doc, output, invoke.outputs());
                el.appendChild(output);
            }
        } else if (step instanceof Step.ExitStep exit) {
            el.setAttribute("FROM", exit.from());
            el.setAttribute("SIGNAL", exit.signal().name());
            Xml.setIfPresent(el, "MESSAGE", exit.message());
        }
        return el;
    }

    private static void writeOperations(Document doc, Element parent, List<MapOperation> operations) {
        for (MapOperation op : operations) {
            Element el;
            if (op instanceof MapOperation.Copy copy) {
                el = doc.createElement("MAPCOPY");
                el.setAttribute("FROM", copy.from());
                el.setAttribute("TO", copy.to());
                typeAttr(el, copy.type());
            } else if (op instanceof MapOperation.Set set) {
                el = doc.createElement("MAPSET");
                el.setAttribute("FIELD", set.field());
                el.setAttribute("VALUE", set.value());
                typeAttr(el, set.type());
            } else if (op instanceof MapOperation.Drop drop) {
                el = doc.createElement("MAPDROP");
                el.setAttribute("FIELD", drop.field());
            } else {
                MapOperation.Transform transform = (MapOperation.Transform) op;
                el = doc.createElement("MAPINVOKE");
                el.setAttribute("SERVICE", transform.service());
                el.setAttribute("TO", transform.to());
                typeAttr(el, transform.type());
                for (String argument : transform.arguments()) {
                    Element arg = doc.createElement("ARG");
                    arg.setAttribute("FROM", argument);
                    el.appendChild(arg);
                }
            }
            parent.appendChild(el);
        }
    }

    private static void typeAttr(Element el, FieldType type) {
        if (type != null) {
            el.setAttribute("TYPE", type.code());
        }
    }
}
