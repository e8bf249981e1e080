package com.example.batchinference;

import com.example.batchinference.config.InferenceProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Batch Inference API",
                version = "1.0",
                description = "Runs batches of image references through a classification/detection model and "
                        + "returns results inline or through a signed HTTP callback."))
@SpringBootApplication
@EnableConfigurationProperties(InferenceProperties.class)
public class BatchInferenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchInferenceApplication.class, args);
    }
}
