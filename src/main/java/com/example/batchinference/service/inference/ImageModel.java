package com.example.batchinference.service.inference;

import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.RawModelOutput;

import java.awt.image.BufferedImage;

/**
 * A loaded classification or detection model. Implementations may be called
 * from several threads at once; concurrency is bounded by
 * {@link InferenceExecutor}, not by the model.
 */
public interface ImageModel {

    /**
     * Runs the model on one decoded image.
     *
     * @param image RGB input image
     * @param params effective thresholds and input size for this call
     * @return raw output including per-stage timings
     */
    RawModelOutput predict(BufferedImage image, InferenceParams params);

    /**
     * @return the class-index-to-name mapping bundled with the model
     */
    ClassNames classNames();
}
