package com.example.batchinference.service.inference;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.example.batchinference.exception.InvalidConfigurationException;
import com.example.batchinference.exception.ModelException;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.RawModelOutput;
import com.example.batchinference.model.RawModelOutput.RawBox;
import com.example.batchinference.model.StageTimings;
import com.example.batchinference.util.LetterboxPreprocessor;
import com.example.batchinference.util.LetterboxPreprocessor.Letterbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.FloatBuffer;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ImageModel} backed by an ONNX Runtime session holding an exported YOLO
 * classification or detection network. The task is inferred once from the
 * rank of the first output.
 */
public class OnnxYoloModel implements ImageModel {

    private static final Logger log = LoggerFactory.getLogger(OnnxYoloModel.class);

    private enum Task { CLASSIFICATION, DETECTION }

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final ClassNames classNames;
    private final String inputName;
    private final int fixedInputSize;
    private final Task task;

    public OnnxYoloModel(OrtEnvironment environment, OrtSession session, ClassNames classNames) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.classNames = Objects.requireNonNull(classNames, "classNames must not be null");
        try {
            Map.Entry<String, NodeInfo> input = session.getInputInfo().entrySet().iterator().next();
            this.inputName = input.getKey();
            this.fixedInputSize = fixedSpatialSize(input.getValue());
            NodeInfo output = session.getOutputInfo().values().iterator().next();
            if (!(output.getInfo() instanceof TensorInfo tensorInfo)) {
                throw new InvalidConfigurationException("Model output " + output.getName() + " is not a tensor");
            }
            int rank = tensorInfo.getShape().length;
            if (rank == 2) {
                this.task = Task.CLASSIFICATION;
            } else if (rank == 3) {
                this.task = Task.DETECTION;
            } else {
                throw new InvalidConfigurationException("Unsupported model output rank " + rank
                        + "; expected a classification [1, C] or detection [1, 4+C, N] output");
            }
        } catch (OrtException ex) {
            throw new InvalidConfigurationException("Unable to inspect model inputs/outputs", ex);
        }
        log.info("Model ready: task={}, input={}, fixed input size={}, classes={}",
                task, inputName, fixedInputSize > 0 ? fixedInputSize : "dynamic", classNames.size());
    }

    @Override
    public ClassNames classNames() {
        return classNames;
    }

    @Override
    public RawModelOutput predict(BufferedImage image, InferenceParams params) {
        int size = fixedInputSize > 0 ? fixedInputSize : params.imageSize();
        long start = System.nanoTime();
        Letterbox letterbox = null;
        float[] chw;
        if (task == Task.DETECTION) {
            letterbox = LetterboxPreprocessor.letterbox(image, size);
            chw = letterbox.chw();
        } else {
            chw = LetterboxPreprocessor.resize(image, size);
        }
        long[] inputShape = {1, 3, size, size};

        try (OnnxTensor input = OnnxTensor.createTensor(environment, FloatBuffer.wrap(chw), inputShape)) {
            long preprocessEnd = System.nanoTime();
            try (OrtSession.Result result = session.run(Map.of(inputName, input))) {
                long inferenceEnd = System.nanoTime();
                OnnxTensor output = (OnnxTensor) result.get(0);
                long[] shape = output.getInfo().getShape();
                FloatBuffer buffer = output.getFloatBuffer();
                float[] data = new float[buffer.remaining()];
                buffer.get(data);

                RawModelOutput raw;
                if (task == Task.DETECTION) {
                    List<RawBox> boxes = YoloOutputDecoder.decodeDetections(data, shape, letterbox,
                            image.getWidth(), image.getHeight(), params.confidence(), params.iou());
                    long postEnd = System.nanoTime();
                    raw = new RawModelOutput.Boxes(boxes,
                            StageTimings.fromNanos(preprocessEnd - start, inferenceEnd - preprocessEnd, postEnd - inferenceEnd));
                } else {
                    double[] probabilities = YoloOutputDecoder.decodeClassification(data);
                    long postEnd = System.nanoTime();
                    raw = new RawModelOutput.ClassScores(probabilities,
                            StageTimings.fromNanos(preprocessEnd - start, inferenceEnd - preprocessEnd, postEnd - inferenceEnd));
                }
                return raw;
            }
        } catch (OrtException ex) {
            throw new ModelException("ONNX Runtime inference failed: " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ModelException("Unable to decode model output: " + ex.getMessage(), ex);
        }
    }

    private static int fixedSpatialSize(NodeInfo input) {
        if (input.getInfo() instanceof TensorInfo tensorInfo) {
            long[] shape = tensorInfo.getShape();
            if (shape.length == 4 && shape[2] > 0 && shape[2] == shape[3]) {
                return (int) shape[2];
            }
        }
        return -1;
    }
}
