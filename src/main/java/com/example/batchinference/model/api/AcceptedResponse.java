package com.example.batchinference.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AcceptedResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("status") String status) {

    public static AcceptedResponse accepted(String requestId) {
        return new AcceptedResponse(requestId, "accepted");
    }
}
