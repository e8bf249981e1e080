package com.example.batchinference.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchResultJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void writesWireFormat() throws Exception {
        TaskResult detection = new TaskResult.Detection(new StageTimings(1.0, 2.0, 3.0), List.of(
                new TaskResult.DetectedBox(List.of(1.0, 2.0, 3.0, 4.0), 0.9, 0, "person")));
        BatchResult result = new BatchResult("r-1", List.of(
                new InferenceOutcome.Success("s3://b/k.jpg", detection),
                new InferenceOutcome.Failure("http://bad", "boom", "source_transport")));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsBytes(result));

        assertThat(fieldNames(json)).containsExactly("request_id", "results");
        JsonNode success = json.get("results").get(0);
        assertThat(fieldNames(success)).containsExactly("source", "result");
        assertThat(fieldNames(success.get("result"))).containsExactly("task", "speed_ms", "detections");
        assertThat(success.get("result").get("task").asText()).isEqualTo("detection");
        assertThat(fieldNames(success.get("result").get("speed_ms")))
                .containsExactly("preprocess", "inference", "postprocess");
        assertThat(fieldNames(success.get("result").get("detections").get(0)))
                .containsExactly("bbox_xyxy", "score", "class_id", "label");
        JsonNode failure = json.get("results").get(1);
        assertThat(fieldNames(failure)).containsExactly("source", "error", "reason");
    }

    @Test
    void readsBackBothOutcomeShapes() throws Exception {
        String json = """
                {"request_id": "r-2", "results": [
                  {"source": "file:///a.jpg", "result": {"task": "classification",
                    "speed_ms": {"preprocess": 1.0, "inference": 5.0, "postprocess": 0.1},
                    "top_k_confidences": [0.9], "predictions": [{"class_id": 3, "label": "fish", "score": 0.9}]}},
                  {"source": "http://bad", "error": "timeout", "reason": "source_transport"}
                ]}
                """;

        BatchResult result = objectMapper.readValue(json, BatchResult.class);

        assertThat(result.requestId()).isEqualTo("r-2");
        assertThat(result.results().get(0)).isInstanceOfSatisfying(InferenceOutcome.Success.class,
                success -> assertThat(success.result()).isInstanceOf(TaskResult.Classification.class));
        assertThat(result.results().get(1)).isEqualTo(
                new InferenceOutcome.Failure("http://bad", "timeout", "source_transport"));
        assertThat(result.successCount()).isEqualTo(1);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
