package com.example.batchinference.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.example.batchinference.exception.InvalidConfigurationException;
import com.example.batchinference.service.inference.ClassNames;
import com.example.batchinference.service.inference.ImageModel;
import com.example.batchinference.service.inference.OnnxYoloModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads the model once at startup. A missing artifact or an unusable model
 * aborts context startup. The session is closed by the container on shutdown.
 */
@Configuration
public class ModelConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ModelConfiguration.class);

    @Bean
    public OrtEnvironment ortEnvironment() {
        return OrtEnvironment.getEnvironment();
    }

    @Bean
    public OrtSession ortSession(OrtEnvironment environment, InferenceProperties properties) {
        Path modelPath = Path.of(properties.getModelPath()).toAbsolutePath();
        if (!Files.isRegularFile(modelPath) || !Files.isReadable(modelPath)) {
            throw new InvalidConfigurationException("Model artifact not found or unreadable: " + modelPath);
        }
        log.info("Loading ONNX model from {} on device {}", modelPath, properties.getDevice());
        try {
            OrtSession.SessionOptions options = new OrtSession.SessionOptions();
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            selectDevice(options, properties.getDevice());
            return environment.createSession(modelPath.toString(), options);
        } catch (OrtException ex) {
            throw new InvalidConfigurationException("Unable to load model " + modelPath, ex);
        }
    }

    @Bean
    public ClassNames classNames(OrtSession session, InferenceProperties properties) {
        if (StringUtils.hasText(properties.getLabelsPath())) {
            Path labelsPath = Path.of(properties.getLabelsPath());
            try {
                return ClassNames.fromLines(Files.readAllLines(labelsPath, StandardCharsets.UTF_8));
            } catch (IOException ex) {
                throw new InvalidConfigurationException("Unable to read labels file " + labelsPath, ex);
            }
        }
        try {
            String names = session.getMetadata().getCustomMetadata().get("names");
            if (names == null) {
                log.warn("Model metadata has no class names; labels will fall back to class ids");
            }
            return ClassNames.fromMetadata(names);
        } catch (OrtException ex) {
            throw new InvalidConfigurationException("Unable to read model metadata", ex);
        }
    }

    @Bean
    public ImageModel imageModel(OrtEnvironment environment, OrtSession session, ClassNames classNames) {
        return new OnnxYoloModel(environment, session, classNames);
    }

    private void selectDevice(OrtSession.SessionOptions options, String device) {
        String normalized = device.trim().toLowerCase(Locale.ROOT);
        if (!normalized.startsWith("cuda")) {
            return;
        }
        int deviceId = 0;
        int separator = normalized.indexOf(':');
        if (separator > 0) {
            try {
                deviceId = Integer.parseInt(normalized.substring(separator + 1));
            } catch (NumberFormatException ex) {
                throw new InvalidConfigurationException("Invalid device selector: " + device, ex);
            }
        }
        try {
            options.addCUDA(deviceId);
        } catch (OrtException ex) {
            log.warn("CUDA device {} is not available ({}); falling back to CPU", deviceId, ex.getMessage());
        }
    }
}
