package com.mimecast.warden.query;

import java.util.List;

/**
 * Conjunction of children using implicit juxtaposition.
 *
 * <p>Left-folds: {@code [A, B, C]} compiles to {@code ((A B) C)}.
 * <br>A single child compiles to itself.
 */
public final class And extends Combinator {

    public And(List<Expression> children) {
        super(children);
    }

    @Override
    public String compile() {
        String result = children.get(0).compile();
        for (int i = 1; i < children.size(); i++) {
            result = "(" + result + " " + children.get(i).compile() + ")";
        }
        return result;
    }
}
