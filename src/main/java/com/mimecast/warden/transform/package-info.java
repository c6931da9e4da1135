/**
 * Content transformation for proxied pages.
 * <p>Site specific fix-ups are a closed set of {@link com.mimecast.warden.transform.SiteTransform} values
 * <br>selected by domain suffix from configuration.
 */
package com.mimecast.warden.transform;
