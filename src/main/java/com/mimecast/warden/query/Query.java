package com.mimecast.warden.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builder DSL for filter expressions.
 *
 * <p>Field builders take several values and return one {@link FieldMatch} per value.
 * <br>Combinator builders flatten all their arguments into a single node.
 * <p>Example:
 * <pre>
 * String query = Query.match(
 *         Query.allOf(Query.froms("@example.com"),
 *                 Query.anyOf(Query.tos("@example.com"), Query.not(Query.anyOf(Query.tos("@"), Query.ccs("@"))))));
 * </pre>
 */
public final class Query {

    private Query() {
        throw new IllegalStateException("Static class");
    }

    public static List<Expression> froms(String... values) {
        return fields(Field.FROM, values);
    }

    public static List<Expression> tos(String... values) {
        return fields(Field.TO, values);
    }

    public static List<Expression> ccs(String... values) {
        return fields(Field.CC, values);
    }

    public static List<Expression> subjects(String... values) {
        return fields(Field.SUBJECT, values);
    }

    /**
     * Builds one match per value for the given field.
     *
     * @param field  Field.
     * @param values Values.
     * @return Immutable list of matches.
     */
    public static List<Expression> fields(Field field, String... values) {
        List<Expression> list = new ArrayList<>(values.length);
        for (String value : values) {
            list.add(new FieldMatch(field, value));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Any of the given matchers must match.
     *
     * @param groups Matcher lists to flatten.
     * @return Single element list holding an {@link Or}.
     */
    @SafeVarargs
    public static List<Expression> anyOf(List<Expression>... groups) {
        return List.of(new Or(flatten(groups)));
    }

    /**
     * All of the given matchers must match.
     *
     * @param groups Matcher lists to flatten.
     * @return Single element list holding an {@link And}.
     */
    @SafeVarargs
    public static List<Expression> allOf(List<Expression>... groups) {
        return List.of(new And(flatten(groups)));
    }

    /**
     * Negates the given matchers.
     *
     * @param groups Matcher lists to flatten.
     * @return Single element list holding a {@link Not}.
     */
    @SafeVarargs
    public static List<Expression> not(List<Expression>... groups) {
        return List.of(new Not(flatten(groups)));
    }

    /**
     * Top-level evaluation of an expression list.
     * <p>A single element is compiled as is, several are OR-combined.
     *
     * @param expressions Expression list.
     * @return IMAP SEARCH string.
     * @throws IllegalArgumentException If the list is empty.
     */
    public static String match(List<Expression> expressions) {
        return root(expressions).compile();
    }

    /**
     * Reduces an expression list to its top-level node without compiling it.
     *
     * @param expressions Expression list.
     * @return Root expression.
     */
    public static Expression root(List<Expression> expressions) {
        if (expressions == null || expressions.isEmpty()) {
            throw new IllegalArgumentException("Empty filter expression");
        }
        return expressions.size() == 1 ? expressions.get(0) : new Or(expressions);
    }

    @SafeVarargs
    private static List<Expression> flatten(List<Expression>... groups) {
        List<Expression> flat = new ArrayList<>();
        Arrays.stream(groups).forEach(flat::addAll);
        return flat;
    }
}
