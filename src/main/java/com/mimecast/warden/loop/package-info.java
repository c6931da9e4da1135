/**
 * Event loop and connection supervision.
 */
package com.mimecast.warden.loop;
