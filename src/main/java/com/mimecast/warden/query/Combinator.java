package com.mimecast.warden.query;

import java.util.List;
import java.util.Objects;

/**
 * Base for expressions combining a non-empty ordered list of children.
 */
abstract class Combinator implements Expression {

    protected final List<Expression> children;

    /**
     * Constructs a new Combinator instance.
     *
     * @param children Child expressions, at least one.
     * @throws IllegalArgumentException If children is empty.
     */
    Combinator(List<Expression> children) {
        Objects.requireNonNull(children, "children");
        if (children.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " requires at least one child");
        }
        this.children = List.copyOf(children);
    }

    public List<Expression> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return children.equals(((Combinator) o).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), children);
    }

    @Override
    public String toString() {
        return compile();
    }
}
