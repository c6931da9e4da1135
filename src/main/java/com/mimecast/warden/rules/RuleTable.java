package com.mimecast.warden.rules;

import com.mimecast.warden.query.Expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable list of rules.
 */
public final class RuleTable implements Iterable<Rule> {

    private final List<Rule> rules;

    public RuleTable(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    @Override
    public Iterator<Rule> iterator() {
        return rules.iterator();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects rules in the order they will run.
     */
    public static class Builder {
        private final List<Rule> rules = new ArrayList<>();

        public Builder rule(String name, Expression filter, HandlerStep... steps) {
            return rule(new Rule(name, filter, Arrays.asList(steps)));
        }

        public Builder rule(Rule rule) {
            rules.add(rule);
            return this;
        }

        public RuleTable build() {
            return new RuleTable(rules);
        }
    }
}
