/**
 * Cross wake-up message deduplication.
 *
 * <p>A content handler marks an identifier seen as soon as it starts processing the item,
 * <br>whether or not the outgoing send later succeeds. At-most-once applies to triggering side effects.
 */
package com.mimecast.warden.dedup;
