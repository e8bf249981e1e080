package com.example.batchinference.model;

import com.example.batchinference.config.InferenceProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Effective per-request model parameters after request overrides have been
 * applied on top of the engine-wide defaults.
 */
public record InferenceParams(
        @JsonProperty("imgsz") int imageSize,
        @JsonProperty("conf") double confidence,
        @JsonProperty("iou") double iou) {

    public InferenceParams {
        if (imageSize <= 0) {
            throw new IllegalArgumentException("Image size must be positive");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence threshold must be within [0, 1]");
        }
        if (iou < 0.0 || iou > 1.0) {
            throw new IllegalArgumentException("IoU threshold must be within [0, 1]");
        }
    }

    public static InferenceParams defaults(InferenceProperties properties) {
        return new InferenceParams(properties.getImgsz(), properties.getConf(), properties.getIou());
    }

    public InferenceParams withOverrides(Integer imageSize, Double confidence, Double iou) {
        return new InferenceParams(
                imageSize != null ? imageSize : this.imageSize,
                confidence != null ? confidence : this.confidence,
                iou != null ? iou : this.iou);
    }
}
