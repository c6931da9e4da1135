/**
 * Message parsing and construction over Jakarta Mail.
 */
package com.mimecast.warden.mime;
