package com.example.batchinference.service.source;

import com.example.batchinference.exception.SourceException;

/**
 * Retrieves the raw bytes behind one kind of image reference. Implementations
 * are selected by {@link ImageSourceResolver} based on the reference scheme and
 * must not retry on their own.
 */
public interface ImageFetcher {

    /**
     * @param scheme lower-case URI scheme of the source, or {@code null} for a bare filesystem path
     * @return whether this fetcher handles sources with that scheme
     */
    boolean supports(String scheme);

    /**
     * @param source the original source string
     * @return encoded image bytes
     * @throws SourceException when the bytes cannot be retrieved
     */
    byte[] fetch(String source);
}
