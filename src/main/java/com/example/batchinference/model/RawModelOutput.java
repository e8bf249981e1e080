package com.example.batchinference.model;

import java.util.List;

/**
 * Output of one model call, before normalization. The variant tells the
 * normalizer which task-shaped payload to build.
 */
public sealed interface RawModelOutput permits RawModelOutput.ClassScores, RawModelOutput.Boxes {

    StageTimings timings();

    /**
     * Per-class probabilities, indexed by class id.
     */
    record ClassScores(double[] probabilities, StageTimings timings) implements RawModelOutput {

        public ClassScores {
            probabilities = probabilities.clone();
        }
    }

    /**
     * Detected boxes in model-native order. Coordinates are in source image pixels.
     */
    record Boxes(List<RawBox> boxes, StageTimings timings) implements RawModelOutput {

        public Boxes {
            boxes = List.copyOf(boxes);
        }
    }

    record RawBox(double x1, double y1, double x2, double y2, double score, int classId) {
    }
}
