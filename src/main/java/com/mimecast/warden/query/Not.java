package com.mimecast.warden.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Negation wrapping its space joined children: {@code (NOT A B)}.
 */
public final class Not extends Combinator {

    public Not(List<Expression> children) {
        super(children);
    }

    @Override
    public String compile() {
        return "(NOT " + children.stream()
                .map(Expression::compile)
                .collect(Collectors.joining(" ")) + ")";
    }
}
