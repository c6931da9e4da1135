/**
 * Composable filter expression algebra compiled to IMAP SEARCH syntax.
 *
 * <p>Node kinds are {@link com.mimecast.warden.query.FieldMatch}, {@link com.mimecast.warden.query.Or},
 * <br>{@link com.mimecast.warden.query.And} and {@link com.mimecast.warden.query.Not}.
 * <br>Output only ever uses the FROM, TO, CC, SUBJECT, OR and NOT keywords.
 */
package com.mimecast.warden.query;
