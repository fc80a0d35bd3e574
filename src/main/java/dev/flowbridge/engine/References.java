package dev.flowbridge.engine;

import dev.flowbridge.model.MapOperation;
import dev.flowbridge.model.Step;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Which pipeline variables a step reads. Only the root segment of a path
 * counts: {@code order/id} reads {@code order}.
 */
public final class References {

    private static final Pattern TOKEN = Pattern.compile("%([^%]+)%");

    private References() {}

    /** Roots read directly by this step, excluding its children. */
    public static Set<String> of(Step step) {
        var roots = new LinkedHashSet<String>();
        if (step instanceof Step.MapStep map) {
            for (MapOperation op : map.operations()) {
                roots.addAll(of(op));
            }
        } else if (step instanceof Step.InvokeStep invoke) {
            for (MapOperation op : invoke.inputs()) {
                roots.addAll(of(op));
            }
        } else if (step instanceof Step.BranchStep branch) {
            if (branch.switchOn() != null && !branch.switchOn().isBlank()) {
                roots.add(root(branch.switchOn()));
            }
        } else if (step instanceof Step.LoopStep loop) {
            roots.add(root(loop.inputArray()));
        } else if (step instanceof Step.ExitStep exit) {
            roots.addAll(tokens(exit.message()));
        }
        return roots;
    }

    /** Roots read by one map operation. */
    public static Set<String> of(MapOperation op) {
        var roots = new LinkedHashSet<String>();
        if (op instanceof MapOperation.Copy copy) {
            roots.add(root(copy.from()));
        } else if (op instanceof MapOperation.Set set) {
            roots.addAll(tokens(set.value()));
        } else if (op instanceof MapOperation.Drop drop) {
            roots.add(root(drop.field()));
        } else if (op instanceof MapOperation.Transform transform) {
            transform.arguments().forEach(a -> roots.add(root(a)));
        }
        return roots;
    }

    /** Roots read by this step and everything nested inside it. */
    public static Set<String> deep(Step step) {
        var roots = new LinkedHashSet<>(of(step));
        for (Step child : step.children()) {
            roots.addAll(deep(child));
        }
        return roots;
    }

    /** Variable names in {@code %name%} tokens, as roots. */
    public static List<String> tokens(String text) {
        var names = new ArrayList<String>();
        if (text == null) {
            return names;
        }
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            names.add(root(m.group(1).trim()));
        }
        return names;
    }

    public static boolean hasTokens(String text) {
        return text != null && TOKEN.matcher(text).find();
    }

    public static String root(String path) {
        String trimmed = path.trim();
        if (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        int slash = trimmed.indexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(0, slash);
    }
}
