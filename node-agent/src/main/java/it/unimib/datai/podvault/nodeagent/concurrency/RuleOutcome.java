package it.unimib.datai.podvault.nodeagent.concurrency;

/**
 * How a single per-node rule was evaluated against the current node.
 *
 * @param selector the rule's selector as rendered in logs
 * @param number   the rule's configured number
 */
public record RuleOutcome(String selector, int number, Kind kind) {

    public enum Kind {
        INVALID_SELECTOR,
        INVALID_NUMBER,
        NOT_MATCHED,
        MATCHED
    }

    public boolean isCandidate() {
        return kind == Kind.MATCHED;
    }
}
