package com.mimecast.warden.http;

import com.mimecast.warden.exception.ContentFetchException;

import java.time.Duration;

/**
 * HTTP fetch collaborator.
 */
@FunctionalInterface
public interface HttpFetcher {

    /**
     * Downloads a resource.
     *
     * @param url     URL.
     * @param timeout Whole call timeout.
     * @param maxSize Largest body accepted, in bytes.
     * @return FetchedContent instance.
     * @throws ContentFetchException Transport failure, error status or size limit exceeded.
     */
    FetchedContent fetch(String url, Duration timeout, long maxSize) throws ContentFetchException;
}
