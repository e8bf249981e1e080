package com.example.batchinference.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("max_inflight") int maxInflight,
        @JsonProperty("available_permits") int availablePermits) {
}
