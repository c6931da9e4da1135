package com.mimecast.warden.query;

/**
 * Immutable filter expression node.
 *
 * <p>Compiling is pure: the same tree always yields the same IMAP SEARCH string.
 *
 * @see FieldMatch
 * @see Or
 * @see And
 * @see Not
 */
public interface Expression {

    /**
     * Compiles this node to IMAP SEARCH syntax.
     *
     * @return Search string with balanced parentheses.
     */
    String compile();
}
