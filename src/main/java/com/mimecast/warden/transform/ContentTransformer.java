package com.mimecast.warden.transform;

import com.mimecast.warden.exception.ContentFetchException;
import com.mimecast.warden.http.FetchedContent;

/**
 * Content transformation collaborator used by the fetch proxy.
 */
@FunctionalInterface
public interface ContentTransformer {

    /**
     * Transforms fetched content.
     *
     * @param content Fetched content.
     * @param options Requested transformations.
     * @return TransformedContent instance.
     * @throws ContentFetchException Content could not be transformed.
     */
    TransformedContent transform(FetchedContent content, TransformOptions options) throws ContentFetchException;
}
