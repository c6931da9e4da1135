/**
 * Outgoing SMTP delivery.
 */
package com.mimecast.warden.smtp;
