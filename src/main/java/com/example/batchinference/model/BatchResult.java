package com.example.batchinference.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"request_id", "results"})
public record BatchResult(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("results") List<InferenceOutcome> results) {

    public BatchResult {
        Objects.requireNonNull(requestId, "requestId must not be null");
        results = List.copyOf(results);
    }

    @JsonIgnore
    public long successCount() {
        return results.stream().filter(InferenceOutcome::isSuccess).count();
    }
}
