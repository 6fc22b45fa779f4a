package it.unimib.datai.podvault.nodeagent.concurrency;

import java.util.List;

/**
 * Result of resolving the data path concurrency for a node.
 *
 * @param number       the resolved number, always positive for a positive fallback
 * @param source       which tier of the configuration produced {@code number}
 * @param globalNumber the configured global number, {@code 0} when no configuration was read
 * @param error        the collaborator failure behind a fallback, {@code null} otherwise
 * @param rules        per-rule outcomes in configuration order, empty when rules were not evaluated
 */
public record ConcurrencyDecision(
        int number,
        Source source,
        int globalNumber,
        String error,
        List<RuleOutcome> rules
) {

    public enum Source {
        FALLBACK_CONFIG_ERROR,
        FALLBACK_NOT_FOUND,
        FALLBACK_INVALID_GLOBAL,
        GLOBAL,
        GLOBAL_NODE_UNAVAILABLE,
        GLOBAL_NO_MATCH,
        PER_NODE
    }

    public ConcurrencyDecision {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    static ConcurrencyDecision fallback(int fallback, Source source, int globalNumber, String error) {
        return new ConcurrencyDecision(fallback, source, globalNumber, error, List.of());
    }

    static ConcurrencyDecision global(int globalNumber, Source source, String error, List<RuleOutcome> rules) {
        return new ConcurrencyDecision(globalNumber, source, globalNumber, error, rules);
    }
}
