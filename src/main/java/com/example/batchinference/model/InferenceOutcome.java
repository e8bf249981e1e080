package com.example.batchinference.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Result for a single source within a batch: either a task result or the
 * reason the source could not be processed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
        @JsonSubTypes.Type(InferenceOutcome.Success.class),
        @JsonSubTypes.Type(InferenceOutcome.Failure.class)
})
public sealed interface InferenceOutcome permits InferenceOutcome.Success, InferenceOutcome.Failure {

    String source();

    boolean isSuccess();

    @JsonPropertyOrder({"source", "result"})
    record Success(
            @JsonProperty("source") String source,
            @JsonProperty("result") TaskResult result) implements InferenceOutcome {

        public Success {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        @JsonIgnore
        public boolean isSuccess() {
            return true;
        }
    }

    @JsonPropertyOrder({"source", "error", "reason"})
    record Failure(
            @JsonProperty("source") String source,
            @JsonProperty("error") String error,
            @JsonProperty("reason") String reason) implements InferenceOutcome {

        @Override
        @JsonIgnore
        public boolean isSuccess() {
            return false;
        }
    }
}
