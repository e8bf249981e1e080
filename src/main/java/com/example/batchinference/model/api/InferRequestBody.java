package com.example.batchinference.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record InferRequestBody(
        @Schema(description = "Caller supplied job identifier; generated when absent", example = "job-42")
        @JsonProperty("request_id")
        String requestId,
        @Schema(description = "Image references: http(s)://, s3://bucket/key, file:// or a local path",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("urls")
        @NotEmpty
        List<@NotBlank String> urls,
        @Schema(description = "Endpoint receiving the signed result; required for /infer, ignored by /infer_sync")
        @JsonProperty("callback_url")
        String callbackUrl,
        @Schema(description = "Confidence threshold override", example = "0.25")
        @JsonProperty("conf")
        @DecimalMin("0.0") @DecimalMax("1.0")
        Double conf,
        @Schema(description = "IoU threshold override", example = "0.45")
        @JsonProperty("iou")
        @DecimalMin("0.0") @DecimalMax("1.0")
        Double iou,
        @Schema(description = "Model input size override", example = "640")
        @JsonProperty("imgsz")
        @Min(32) @Max(4096)
        Integer imgsz,
        @Schema(description = "Nested parameter overrides; take precedence over the top-level fields")
        @JsonProperty("params")
        @Valid
        ParamsBody params) {

    public record ParamsBody(
            @JsonProperty("conf") @DecimalMin("0.0") @DecimalMax("1.0") Double conf,
            @JsonProperty("iou") @DecimalMin("0.0") @DecimalMax("1.0") Double iou,
            @JsonProperty("imgsz") @Min(32) @Max(4096) Integer imgsz) {
    }
}
