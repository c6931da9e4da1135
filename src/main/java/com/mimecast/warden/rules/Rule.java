package com.mimecast.warden.rules;

import com.mimecast.warden.query.Expression;

import java.util.List;

/**
 * Filter expression with the pipeline run against its matches.
 * <p>The query is compiled once on construction.
 */
public final class Rule {

    private final String name;
    private final Expression filter;
    private final String query;
    private final List<HandlerStep> steps;

    /**
     * Constructs a new Rule instance.
     *
     * @param name   Name used in logs.
     * @param filter Filter expression.
     * @param steps  Pipeline steps in execution order.
     */
    public Rule(String name, Expression filter, List<HandlerStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Rule " + name + " has no steps");
        }
        this.name = name;
        this.filter = filter;
        this.query = filter.compile();
        this.steps = List.copyOf(steps);
    }

    public String getName() {
        return name;
    }

    public Expression getFilter() {
        return filter;
    }

    /**
     * Gets the compiled search query.
     *
     * @return Query string.
     */
    public String getQuery() {
        return query;
    }

    public List<HandlerStep> getSteps() {
        return steps;
    }

    @Override
    public String toString() {
        return name + " " + query + " -> " + steps;
    }
}
