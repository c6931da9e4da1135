/**
 * HTTP download for the fetch proxy.
 */
package com.mimecast.warden.http;
