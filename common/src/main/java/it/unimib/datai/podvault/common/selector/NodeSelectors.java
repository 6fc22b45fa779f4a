package it.unimib.datai.podvault.common.selector;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses Kubernetes label selectors into {@link LabelPredicate}s, applying the API server's
 * validation rules for label keys, values and operators.
 */
public final class NodeSelectors {
    static final String OP_IN = "In";
    static final String OP_NOT_IN = "NotIn";
    static final String OP_EXISTS = "Exists";
    static final String OP_DOES_NOT_EXIST = "DoesNotExist";
    private static final String OP_EQUALS = "=";

    private static final int MAX_NAME_LENGTH = 63;
    private static final int MAX_PREFIX_LENGTH = 253;
    private static final Pattern NAME = Pattern.compile("([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]");
    private static final Pattern DNS_SUBDOMAIN =
            Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");

    private NodeSelectors() {
    }

    /**
     * Parses a selector. An empty selector selects everything, a {@code null} one selects nothing.
     *
     * @throws InvalidSelectorException if a key, value or operator is not valid
     */
    public static LabelPredicate parse(LabelSelector selector) {
        if (selector == null) {
            return LabelPredicate.nothing();
        }
        List<Requirement> requirements = requirements(selector);
        if (requirements.isEmpty()) {
            return LabelPredicate.everything();
        }
        for (Requirement requirement : requirements) {
            requirement.validate();
        }
        List<Requirement> parsed = List.copyOf(requirements);
        return labels -> {
            Map<String, String> safe = labels == null ? Map.of() : labels;
            return parsed.stream().allMatch(r -> r.matches(safe));
        };
    }

    /**
     * Renders a selector in the {@code kubectl} form, e.g. {@code host-name=node-1,zone in (a,b)}.
     * Works on selectors that do not parse as well.
     */
    public static String describe(LabelSelector selector) {
        if (selector == null) {
            return "<none>";
        }
        List<Requirement> requirements = requirements(selector);
        if (requirements.isEmpty()) {
            return "<none>";
        }
        return requirements.stream()
                .sorted(Comparator.comparing(Requirement::key, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(Requirement::render)
                .collect(Collectors.joining(","));
    }

    private static List<Requirement> requirements(LabelSelector selector) {
        List<Requirement> requirements = new ArrayList<>();
        if (selector.getMatchLabels() != null) {
            selector.getMatchLabels().forEach((key, value) ->
                    requirements.add(new Requirement(key, OP_EQUALS, value == null ? List.of() : List.of(value))));
        }
        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement expression : selector.getMatchExpressions()) {
                if (expression == null) {
                    requirements.add(new Requirement(null, null, List.of()));
                    continue;
                }
                // Values may hold nulls decoded from JSON; validate() rejects them.
                List<String> values = expression.getValues() == null
                        ? List.of()
                        : Collections.unmodifiableList(new ArrayList<>(expression.getValues()));
                requirements.add(new Requirement(expression.getKey(), expression.getOperator(), values));
            }
        }
        return requirements;
    }

    static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidSelectorException("label key must not be empty");
        }
        String[] parts = key.split("/", -1);
        String name;
        if (parts.length == 1) {
            name = parts[0];
        } else if (parts.length == 2) {
            String prefix = parts[0];
            if (prefix.isEmpty() || prefix.length() > MAX_PREFIX_LENGTH || !DNS_SUBDOMAIN.matcher(prefix).matches()) {
                throw new InvalidSelectorException("invalid label key \"" + key + "\": prefix must be a DNS-1123 subdomain");
            }
            name = parts[1];
        } else {
            throw new InvalidSelectorException("invalid label key \"" + key + "\": at most one '/' is allowed");
        }
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH || !NAME.matcher(name).matches()) {
            throw new InvalidSelectorException("invalid label key \"" + key + "\": name part must be at most "
                    + MAX_NAME_LENGTH + " alphanumeric characters, '-', '_' or '.'");
        }
    }

    static void validateValue(String value) {
        if (value.isEmpty()) {
            return;
        }
        if (value.length() > MAX_NAME_LENGTH || !NAME.matcher(value).matches()) {
            throw new InvalidSelectorException("invalid label value \"" + value + "\": must be at most "
                    + MAX_NAME_LENGTH + " alphanumeric characters, '-', '_' or '.'");
        }
    }

    private record Requirement(String key, String operator, List<String> values) {

        void validate() {
            if (key == null && operator == null) {
                throw new InvalidSelectorException("match expression must not be null");
            }
            validateKey(key);
            if (operator == null) {
                throw new InvalidSelectorException("operator for key \"" + key + "\" must not be empty");
            }
            switch (operator) {
                case OP_EQUALS -> {
                    if (values.size() != 1) {
                        throw new InvalidSelectorException("exactly one value required for key \"" + key + "\"");
                    }
                }
                case OP_IN, OP_NOT_IN -> {
                    if (values.isEmpty()) {
                        throw new InvalidSelectorException("values must be specified for operator " + operator
                                + " on key \"" + key + "\"");
                    }
                }
                case OP_EXISTS, OP_DOES_NOT_EXIST -> {
                    if (!values.isEmpty()) {
                        throw new InvalidSelectorException("values must be empty for operator " + operator
                                + " on key \"" + key + "\"");
                    }
                }
                default -> throw new InvalidSelectorException("\"" + operator + "\" is not a valid label selector operator");
            }
            for (String value : values) {
                if (value == null) {
                    throw new InvalidSelectorException("null value for key \"" + key + "\"");
                }
                validateValue(value);
            }
        }

        boolean matches(Map<String, String> labels) {
            return switch (operator) {
                case OP_EQUALS, OP_IN -> labels.containsKey(key) && values.contains(labels.get(key));
                case OP_NOT_IN -> !labels.containsKey(key) || !values.contains(labels.get(key));
                case OP_EXISTS -> labels.containsKey(key);
                case OP_DOES_NOT_EXIST -> !labels.containsKey(key);
                default -> false;
            };
        }

        String render() {
            String sortedValues = values.stream()
                    .map(String::valueOf)
                    .sorted()
                    .collect(Collectors.joining(","));
            if (key == null && operator == null) {
                return "<nil>";
            }
            if (operator == null) {
                return key + " (" + sortedValues + ")";
            }
            return switch (operator) {
                case OP_EQUALS -> key + "=" + sortedValues;
                case OP_IN -> key + " in (" + sortedValues + ")";
                case OP_NOT_IN -> key + " notin (" + sortedValues + ")";
                case OP_EXISTS -> String.valueOf(key);
                case OP_DOES_NOT_EXIST -> "!" + key;
                default -> key + " " + operator + " (" + sortedValues + ")";
            };
        }
    }
}
