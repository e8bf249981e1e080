package com.example.batchinference.service.inference;

import com.example.batchinference.model.RawModelOutput.RawBox;
import com.example.batchinference.util.LetterboxPreprocessor.Letterbox;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decodes the output tensors of exported YOLO models.
 * <p>
 * Detection exports produce {@code [1, 4 + C, N]} (or the transposed
 * {@code [1, N, 4 + C]}) where each of the N candidates holds
 * {@code cx, cy, w, h} in letterbox pixels followed by C class scores.
 * Classification exports produce {@code [1, C]}.
 */
final class YoloOutputDecoder {

    static final int MAX_DETECTIONS = 300;

    private YoloOutputDecoder() {
    }

    static List<RawBox> decodeDetections(float[] data, long[] shape, Letterbox letterbox,
                                         int imageWidth, int imageHeight,
                                         double confThreshold, double iouThreshold) {
        if (shape.length != 3) {
            throw new IllegalArgumentException("Unexpected detection output rank " + shape.length);
        }
        boolean channelFirst = shape[1] < shape[2];
        int numFeatures = (int) (channelFirst ? shape[1] : shape[2]);
        int numBoxes = (int) (channelFirst ? shape[2] : shape[1]);
        int numClasses = numFeatures - 4;
        if (numClasses < 1) {
            throw new IllegalArgumentException("Detection output has no class scores");
        }

        List<RawBox> candidates = new ArrayList<>();
        for (int i = 0; i < numBoxes; i++) {
            int bestClass = 0;
            float bestScore = value(data, i, 4, numBoxes, numFeatures, channelFirst);
            for (int c = 1; c < numClasses; c++) {
                float score = value(data, i, 4 + c, numBoxes, numFeatures, channelFirst);
                if (score > bestScore) {
                    bestScore = score;
                    bestClass = c;
                }
            }
            if (bestScore < confThreshold) {
                continue;
            }
            float cx = value(data, i, 0, numBoxes, numFeatures, channelFirst);
            float cy = value(data, i, 1, numBoxes, numFeatures, channelFirst);
            float w = value(data, i, 2, numBoxes, numFeatures, channelFirst);
            float h = value(data, i, 3, numBoxes, numFeatures, channelFirst);
            double x1 = clamp(letterbox.toSourceX(cx - w / 2.0), imageWidth);
            double y1 = clamp(letterbox.toSourceY(cy - h / 2.0), imageHeight);
            double x2 = clamp(letterbox.toSourceX(cx + w / 2.0), imageWidth);
            double y2 = clamp(letterbox.toSourceY(cy + h / 2.0), imageHeight);
            if (x2 <= x1 || y2 <= y1) {
                continue;
            }
            candidates.add(new RawBox(x1, y1, x2, y2, bestScore, bestClass));
        }
        return nonMaxSuppression(candidates, iouThreshold);
    }

    static double[] decodeClassification(float[] data) {
        double[] scores = new double[data.length];
        double sum = 0.0;
        boolean distribution = true;
        for (int i = 0; i < data.length; i++) {
            scores[i] = data[i];
            sum += data[i];
            if (data[i] < 0.0f || data[i] > 1.0f) {
                distribution = false;
            }
        }
        if (distribution && Math.abs(sum - 1.0) < 1e-3) {
            return scores;
        }
        return softmax(scores);
    }

    /**
     * Greedy per-class suppression. Survivors are returned by descending score.
     */
    static List<RawBox> nonMaxSuppression(List<RawBox> boxes, double threshold) {
        List<RawBox> sorted = new ArrayList<>(boxes);
        sorted.sort(Comparator.comparingDouble(RawBox::score).reversed());
        List<RawBox> selected = new ArrayList<>();
        for (RawBox candidate : sorted) {
            boolean keep = true;
            for (RawBox kept : selected) {
                if (kept.classId() == candidate.classId() && iou(candidate, kept) > threshold) {
                    keep = false;
                    break;
                }
            }
            if (keep) {
                selected.add(candidate);
                if (selected.size() == MAX_DETECTIONS) {
                    break;
                }
            }
        }
        return selected;
    }

    static double iou(RawBox a, RawBox b) {
        double interX1 = Math.max(a.x1(), b.x1());
        double interY1 = Math.max(a.y1(), b.y1());
        double interX2 = Math.min(a.x2(), b.x2());
        double interY2 = Math.min(a.y2(), b.y2());
        double interArea = Math.max(0, interX2 - interX1) * Math.max(0, interY2 - interY1);
        double areaA = (a.x2() - a.x1()) * (a.y2() - a.y1());
        double areaB = (b.x2() - b.x1()) * (b.y2() - b.y1());
        return interArea / (areaA + areaB - interArea + 1e-6);
    }

    private static double[] softmax(double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double logit : logits) {
            max = Math.max(max, logit);
        }
        double sum = 0.0;
        double[] out = new double[logits.length];
        for (int i = 0; i < logits.length; i++) {
            out[i] = Math.exp(logits[i] - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }

    private static float value(float[] data, int box, int feature, int numBoxes, int numFeatures, boolean channelFirst) {
        if (channelFirst) {
            return data[feature * numBoxes + box];
        }
        return data[box * numFeatures + feature];
    }

    private static double clamp(double value, int limit) {
        return Math.max(0.0, Math.min(limit, value));
    }
}
