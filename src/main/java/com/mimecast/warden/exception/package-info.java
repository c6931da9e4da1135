/**
 * Error taxonomy.
 *
 * <ul>
 *     <li>{@link com.mimecast.warden.exception.TransportException} - retried with backoff.</li>
 *     <li>{@link com.mimecast.warden.exception.SearchFailedException} - aborts a wake-up, treated as transport.</li>
 *     <li>{@link com.mimecast.warden.exception.DeliveryException} - recovered per outgoing send.</li>
 *     <li>{@link com.mimecast.warden.exception.ContentFetchException} - recovered per proxied URL.</li>
 *     <li>{@link com.mimecast.warden.exception.UnsupportedCapabilityException} - fatal, never retried.</li>
 * </ul>
 *
 * <p>Mailbox operations returning NO or BAD are not exceptions: they surface as a FAIL step result
 * <br>and stop only the remaining steps of the current rule.
 */
package com.mimecast.warden.exception;
