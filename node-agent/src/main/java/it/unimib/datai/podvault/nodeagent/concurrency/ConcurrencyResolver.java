package it.unimib.datai.podvault.nodeagent.concurrency;

import io.fabric8.kubernetes.api.model.Node;
import it.unimib.datai.podvault.common.model.DataPathConcurrency;
import it.unimib.datai.podvault.common.model.NodeAgentConfigs;
import it.unimib.datai.podvault.common.model.RuledConfigs;
import it.unimib.datai.podvault.common.selector.InvalidSelectorException;
import it.unimib.datai.podvault.common.selector.LabelPredicate;
import it.unimib.datai.podvault.common.selector.NodeSelectors;
import it.unimib.datai.podvault.nodeagent.config.NodeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Resolves how many data path operations (volume backups and restores) this node may run at once.
 * <p>
 * Tiers, from least to most specific: the caller's fallback, the cluster-wide global number, and
 * the per-node rules whose label selector matches this node. Among matching rules the smallest
 * number wins. Invalid configuration never fails the resolution; it is logged and skipped.
 */
@Component
public class ConcurrencyResolver {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyResolver.class);

    private final ConcurrencyConfigSource configSource;
    private final NodeLookup nodeLookup;
    private final NodeIdentity identity;

    public ConcurrencyResolver(ConcurrencyConfigSource configSource, NodeLookup nodeLookup, NodeIdentity identity) {
        this.configSource = configSource;
        this.nodeLookup = nodeLookup;
        this.identity = identity;
    }

    public int resolve(int fallback) {
        return decide(fallback).number();
    }

    public ConcurrencyDecision decide(int fallback) {
        ConcurrencyDecision decision = evaluate(fallback);
        report(decision, fallback);
        return decision;
    }

    private ConcurrencyDecision evaluate(int fallback) {
        NodeAgentConfigs configs;
        try {
            configs = configSource.load(identity.namespace());
        } catch (ConfigLoadException | RuntimeException e) {
            return ConcurrencyDecision.fallback(fallback, ConcurrencyDecision.Source.FALLBACK_CONFIG_ERROR, 0,
                    errorText(e));
        }
        if (configs == null || configs.dataPathConcurrency() == null) {
            return ConcurrencyDecision.fallback(fallback, ConcurrencyDecision.Source.FALLBACK_NOT_FOUND, 0, null);
        }

        DataPathConcurrency concurrency = configs.dataPathConcurrency();
        int global = concurrency.globalConfig();
        if (global <= 0) {
            return ConcurrencyDecision.fallback(fallback, ConcurrencyDecision.Source.FALLBACK_INVALID_GLOBAL, global, null);
        }
        if (concurrency.perNodeConfig().isEmpty()) {
            return ConcurrencyDecision.global(global, ConcurrencyDecision.Source.GLOBAL, null, List.of());
        }

        Node node;
        try {
            node = nodeLookup.get(identity.nodeName());
        } catch (RuntimeException e) {
            return ConcurrencyDecision.global(global, ConcurrencyDecision.Source.GLOBAL_NODE_UNAVAILABLE,
                    errorText(e), List.of());
        }

        Map<String, String> labels = node.getMetadata() == null ? Map.of() : node.getMetadata().getLabels();
        List<RuleOutcome> outcomes = new ArrayList<>();
        for (RuledConfigs rule : concurrency.perNodeConfig()) {
            outcomes.add(evaluateRule(rule, labels));
        }

        OptionalInt chosen = outcomes.stream()
                .filter(RuleOutcome::isCandidate)
                .mapToInt(RuleOutcome::number)
                .min();
        if (chosen.isEmpty()) {
            return ConcurrencyDecision.global(global, ConcurrencyDecision.Source.GLOBAL_NO_MATCH, null, outcomes);
        }
        return new ConcurrencyDecision(chosen.getAsInt(), ConcurrencyDecision.Source.PER_NODE, global, null, outcomes);
    }

    // Selector and number are validated before matching, also for rules that would not match this node.
    private static RuleOutcome evaluateRule(RuledConfigs rule, Map<String, String> labels) {
        String selector = NodeSelectors.describe(rule.nodeSelector());
        LabelPredicate predicate;
        try {
            predicate = NodeSelectors.parse(rule.nodeSelector());
        } catch (InvalidSelectorException e) {
            return new RuleOutcome(selector, rule.number(), RuleOutcome.Kind.INVALID_SELECTOR);
        }
        if (rule.number() <= 0) {
            return new RuleOutcome(selector, rule.number(), RuleOutcome.Kind.INVALID_NUMBER);
        }
        RuleOutcome.Kind kind = predicate.matches(labels) ? RuleOutcome.Kind.MATCHED : RuleOutcome.Kind.NOT_MATCHED;
        return new RuleOutcome(selector, rule.number(), kind);
    }

    private static String errorText(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private void report(ConcurrencyDecision decision, int fallback) {
        for (RuleOutcome outcome : decision.rules()) {
            switch (outcome.kind()) {
                case INVALID_SELECTOR -> log.warn("Failed to parse rule with label selector {}, skip it", outcome.selector());
                case INVALID_NUMBER -> log.warn("Rule with label selector {} is with an invalid number {}, skip it",
                        outcome.selector(), outcome.number());
                default -> {
                }
            }
        }

        String nodeName = identity.nodeName();
        switch (decision.source()) {
            case FALLBACK_CONFIG_ERROR -> log.warn("Failed to get node agent configs: {}", decision.error());
            case FALLBACK_NOT_FOUND -> log.info("Concurrency configs are not found, use the default number {}", fallback);
            case FALLBACK_INVALID_GLOBAL -> log.warn("Global number {} is invalid, use the default value {}",
                    decision.globalNumber(), fallback);
            case GLOBAL_NODE_UNAVAILABLE -> log.warn("Failed to get node info for {}, use the global number {}: {}",
                    nodeName, decision.globalNumber(), decision.error());
            case GLOBAL_NO_MATCH -> log.info("Per node number for node {} is not found, use the global number {}",
                    nodeName, decision.globalNumber());
            case PER_NODE -> log.info("Use the per node number {} over global number {} for node {}",
                    decision.number(), decision.globalNumber(), nodeName);
            case GLOBAL -> {
            }
        }
    }
}
