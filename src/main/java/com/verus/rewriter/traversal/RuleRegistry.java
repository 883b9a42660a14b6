package com.verus.rewriter.traversal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import com.verus.rewriter.model.NodeKind;

/**
 * Immutable mapping from node kind to rule, with an explicit default rule for
 * every kind that has no registration.
 *
 * Registries compose by layering: {@link #toBuilder()} starts from this
 * registry's mappings and any later {@link Builder#rule} for the same kind
 * shadows the inherited one.
 *
 * @param <A> accumulator type threaded through the traversal
 */
public final class RuleRegistry<A extends Accumulator> {

    private final Map<NodeKind, Rule<A>> rules;
    private final Rule<A> defaultRule;

    private RuleRegistry(Map<NodeKind, Rule<A>> rules, Rule<A> defaultRule) {
        this.rules = rules;
        this.defaultRule = defaultRule;
    }

    public static <A extends Accumulator> Builder<A> builder() {
        return new Builder<>();
    }

    /**
     * Rule registered for {@code kind}, or the default rule on a miss.
     */
    public Rule<A> resolve(NodeKind kind) {
        Rule<A> rule = rules.get(kind);
        return rule != null ? rule : defaultRule;
    }

    public boolean hasRule(NodeKind kind) {
        return rules.containsKey(kind);
    }

    public Rule<A> getDefaultRule() {
        return defaultRule;
    }

    public Map<NodeKind, Rule<A>> getRules() {
        return rules;
    }

    public Builder<A> toBuilder() {
        Builder<A> builder = new Builder<>();
        builder.rules.putAll(rules);
        builder.defaultRule = defaultRule;
        return builder;
    }

    public static final class Builder<A extends Accumulator> {
        private final Map<NodeKind, Rule<A>> rules = new EnumMap<>(NodeKind.class);
        private Rule<A> defaultRule = Traversal::defaultVisit;

        private Builder() {
        }

        public Builder<A> rule(NodeKind kind, Rule<A> rule) {
            rules.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder<A> defaultRule(Rule<A> rule) {
            this.defaultRule = Objects.requireNonNull(rule, "rule");
            return this;
        }

        public RuleRegistry<A> build() {
            Map<NodeKind, Rule<A>> copy = new EnumMap<>(NodeKind.class);
            copy.putAll(rules);
            return new RuleRegistry<>(Collections.unmodifiableMap(copy), defaultRule);
        }
    }
}
