package com.mimecast.warden.query;

import java.util.List;

/**
 * Disjunction of children.
 *
 * <p>Left-folds into nested binary ORs: {@code [A, B, C]} compiles to {@code (OR (OR A B) C)}.
 * <br>The nesting is kept as is for wire compatibility with existing servers.
 * <br>A single child compiles to itself.
 */
public final class Or extends Combinator {

    public Or(List<Expression> children) {
        super(children);
    }

    @Override
    public String compile() {
        String result = children.get(0).compile();
        for (int i = 1; i < children.size(); i++) {
            result = "(OR " + result + " " + children.get(i).compile() + ")";
        }
        return result;
    }
}
