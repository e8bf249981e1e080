package com.example.batchinference.model;

import com.example.batchinference.util.FloatRounder;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-stage wall clock timings of one model invocation, in milliseconds.
 */
public record StageTimings(
        @JsonProperty("preprocess") double preprocess,
        @JsonProperty("inference") double inference,
        @JsonProperty("postprocess") double postprocess) {

    public StageTimings {
        preprocess = Math.max(0.0, preprocess);
        inference = Math.max(0.0, inference);
        postprocess = Math.max(0.0, postprocess);
    }

    public static StageTimings fromNanos(long preprocessNanos, long inferenceNanos, long postprocessNanos) {
        return new StageTimings(preprocessNanos / 1_000_000.0, inferenceNanos / 1_000_000.0,
                postprocessNanos / 1_000_000.0);
    }

    public StageTimings rounded(FloatRounder rounder) {
        return new StageTimings(rounder.round(preprocess), rounder.round(inference), rounder.round(postprocess));
    }
}
