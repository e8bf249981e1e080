package com.example.batchinference.service.inference;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.RawModelOutput;
import com.example.batchinference.model.RawModelOutput.RawBox;
import com.example.batchinference.model.TaskResult;
import com.example.batchinference.model.TaskResult.DetectedBox;
import com.example.batchinference.model.TaskResult.Prediction;
import com.example.batchinference.util.FloatRounder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Turns raw model output into the uniform, rounded result schema.
 * Classification keeps the top-K classes by descending score; detection keeps
 * the model's box order and drops boxes under the confidence threshold.
 */
@Component
public class ResultNormalizer {

    private final FloatRounder rounder;
    private final int topK;

    public ResultNormalizer(InferenceProperties properties) {
        this.rounder = new FloatRounder(properties.getRoundPrecision());
        this.topK = properties.getTopK();
    }

    public TaskResult normalize(RawModelOutput raw, ClassNames names, InferenceParams params) {
        TaskResult result;
        if (raw instanceof RawModelOutput.ClassScores scores) {
            result = classification(scores, names);
        } else if (raw instanceof RawModelOutput.Boxes boxes) {
            result = detection(boxes, names, params);
        } else {
            throw new IllegalArgumentException("Unsupported model output " + raw);
        }
        return result.rounded(rounder);
    }

    private TaskResult.Classification classification(RawModelOutput.ClassScores scores, ClassNames names) {
        double[] probabilities = scores.probabilities();
        List<Integer> ranked = IntStream.range(0, probabilities.length)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> probabilities[i]).reversed())
                .limit(topK)
                .toList();
        List<Double> confidences = new ArrayList<>(ranked.size());
        List<Prediction> predictions = new ArrayList<>(ranked.size());
        for (int classId : ranked) {
            confidences.add(probabilities[classId]);
            predictions.add(new Prediction(classId, names.label(classId), probabilities[classId]));
        }
        return new TaskResult.Classification(scores.timings(), confidences, predictions);
    }

    private TaskResult.Detection detection(RawModelOutput.Boxes boxes, ClassNames names, InferenceParams params) {
        List<DetectedBox> detections = new ArrayList<>(boxes.boxes().size());
        for (RawBox box : boxes.boxes()) {
            if (box.score() < params.confidence()) {
                continue;
            }
            detections.add(new DetectedBox(
                    List.of(box.x1(), box.y1(), box.x2(), box.y2()),
                    box.score(),
                    box.classId(),
                    names.label(box.classId())));
        }
        return new TaskResult.Detection(boxes.timings(), detections);
    }
}
