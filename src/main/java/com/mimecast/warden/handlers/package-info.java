/**
 * Content handlers run as pipeline steps.
 * <p>Each handler fetches the matched messages, skips those already in the dedup scope and
 * <br>produces outgoing mail. Delivery failures are logged per message and never stop a batch.
 *
 * @see com.mimecast.warden.handlers.AbstractContentHandler
 */
package com.mimecast.warden.handlers;
