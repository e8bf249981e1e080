package com.example.batchinference.model;

import java.util.List;
import java.util.Objects;

/**
 * An accepted inference job. Source order is significant: the resulting
 * {@link BatchResult} carries exactly one outcome per source at the same index.
 */
public record InferenceRequest(String requestId, List<String> sources, String callbackUrl, InferenceParams params) {

    public InferenceRequest {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(params, "params must not be null");
        sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
    }

    public boolean isAsynchronous() {
        return callbackUrl != null && !callbackUrl.isBlank();
    }
}
