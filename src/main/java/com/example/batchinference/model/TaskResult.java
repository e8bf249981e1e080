package com.example.batchinference.model;

import com.example.batchinference.util.FloatRounder;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Task-tagged, JSON ready result of one successful inference. Serialized with a
 * {@code task} discriminant of either {@code classification} or {@code detection}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "task")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TaskResult.Classification.class, name = TaskResult.CLASSIFICATION),
        @JsonSubTypes.Type(value = TaskResult.Detection.class, name = TaskResult.DETECTION)
})
public sealed interface TaskResult permits TaskResult.Classification, TaskResult.Detection {

    String CLASSIFICATION = "classification";
    String DETECTION = "detection";

    String task();

    StageTimings speedMs();

    TaskResult rounded(FloatRounder rounder);

    @JsonPropertyOrder({"task", "speed_ms", "top_k_confidences", "predictions"})
    @JsonIgnoreProperties(value = "task", allowGetters = true)
    record Classification(
            @JsonProperty("speed_ms") StageTimings speedMs,
            @JsonProperty("top_k_confidences") List<Double> topKConfidences,
            @JsonProperty("predictions") List<Prediction> predictions) implements TaskResult {

        public Classification {
            topKConfidences = List.copyOf(topKConfidences);
            predictions = List.copyOf(predictions);
        }

        @Override
        @JsonProperty("task")
        public String task() {
            return CLASSIFICATION;
        }

        @Override
        public Classification rounded(FloatRounder rounder) {
            return new Classification(
                    speedMs == null ? null : speedMs.rounded(rounder),
                    rounder.round(topKConfidences),
                    predictions.stream().map(prediction -> prediction.rounded(rounder)).toList());
        }
    }

    @JsonPropertyOrder({"task", "speed_ms", "detections"})
    @JsonIgnoreProperties(value = "task", allowGetters = true)
    record Detection(
            @JsonProperty("speed_ms") StageTimings speedMs,
            @JsonProperty("detections") List<DetectedBox> detections) implements TaskResult {

        public Detection {
            detections = List.copyOf(detections);
        }

        @Override
        @JsonProperty("task")
        public String task() {
            return DETECTION;
        }

        @Override
        public Detection rounded(FloatRounder rounder) {
            return new Detection(
                    speedMs == null ? null : speedMs.rounded(rounder),
                    detections.stream().map(box -> box.rounded(rounder)).toList());
        }
    }

    @JsonPropertyOrder({"class_id", "label", "score"})
    record Prediction(
            @JsonProperty("class_id") int classId,
            @JsonProperty("label") String label,
            @JsonProperty("score") double score) {

        Prediction rounded(FloatRounder rounder) {
            return new Prediction(classId, label, rounder.round(score));
        }
    }

    @JsonPropertyOrder({"bbox_xyxy", "score", "class_id", "label"})
    record DetectedBox(
            @JsonProperty("bbox_xyxy") List<Double> bboxXyxy,
            @JsonProperty("score") Double score,
            @JsonProperty("class_id") Integer classId,
            @JsonProperty("label") String label) {

        public DetectedBox {
            if (bboxXyxy == null || bboxXyxy.size() != 4) {
                throw new IllegalArgumentException("Bounding box must have exactly four coordinates");
            }
            bboxXyxy = List.copyOf(bboxXyxy);
        }

        DetectedBox rounded(FloatRounder rounder) {
            return new DetectedBox(rounder.round(bboxXyxy), rounder.round(score), classId, label);
        }
    }
}
