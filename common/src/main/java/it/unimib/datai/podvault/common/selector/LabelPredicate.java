package it.unimib.datai.podvault.common.selector;

import java.util.Map;

/**
 * A parsed label selector, evaluated against the labels of a single object.
 */
@FunctionalInterface
public interface LabelPredicate {

    boolean matches(Map<String, String> labels);

    static LabelPredicate everything() {
        return labels -> true;
    }

    static LabelPredicate nothing() {
        return labels -> false;
    }
}
