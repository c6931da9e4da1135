/**
 * Process wiring: core entry point and credential lookup.
 */
package com.mimecast.warden.main;
