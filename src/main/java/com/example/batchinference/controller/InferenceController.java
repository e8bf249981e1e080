package com.example.batchinference.controller;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.model.BatchResult;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.InferenceRequest;
import com.example.batchinference.model.api.AcceptedResponse;
import com.example.batchinference.model.api.HealthResponse;
import com.example.batchinference.model.api.InferRequestBody;
import com.example.batchinference.service.InferenceJobService;
import com.example.batchinference.service.inference.InferenceExecutor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.Locale;
import java.util.UUID;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@Tag(name = "Inference", description = "Batch image classification and detection")
public class InferenceController {

    private final InferenceJobService jobService;
    private final InferenceExecutor inferenceExecutor;
    private final InferenceProperties properties;

    public InferenceController(InferenceJobService jobService,
                               InferenceExecutor inferenceExecutor,
                               InferenceProperties properties) {
        this.jobService = jobService;
        this.inferenceExecutor = inferenceExecutor;
        this.properties = properties;
    }

    @PostMapping(value = "/infer", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Accept a batch for asynchronous inference",
            description = "Returns immediately; the result is POSTed to callback_url when every source has been processed.")
    public ResponseEntity<AcceptedResponse> infer(@Valid @RequestBody InferRequestBody body) {
        String callbackUrl = requireCallbackUrl(body.callbackUrl());
        InferenceRequest request = toRequest(body, callbackUrl);
        jobService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(AcceptedResponse.accepted(request.requestId()));
    }

    @PostMapping(value = "/infer_sync", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run a batch and wait for the result", description = "Local/test mode only.")
    public BatchResult inferSync(@Valid @RequestBody InferRequestBody body) {
        if (!properties.getLocalMode().isEnabled()) {
            throw new ResponseStatusException(NOT_FOUND, "Synchronous inference is only available in local mode");
        }
        return jobService.runSync(toRequest(body, null));
    }

    @GetMapping("/healthz")
    @Operation(summary = "Liveness check")
    public HealthResponse health() {
        return new HealthResponse(true, inferenceExecutor.maxInflight(), inferenceExecutor.availablePermits());
    }

    private InferenceRequest toRequest(InferRequestBody body, String callbackUrl) {
        String requestId = StringUtils.hasText(body.requestId()) ? body.requestId() : UUID.randomUUID().toString();
        InferenceParams params = InferenceParams.defaults(properties)
                .withOverrides(body.imgsz(), body.conf(), body.iou());
        if (body.params() != null) {
            params = params.withOverrides(body.params().imgsz(), body.params().conf(), body.params().iou());
        }
        return new InferenceRequest(requestId, body.urls(), callbackUrl, params);
    }

    private String requireCallbackUrl(String callbackUrl) {
        if (!StringUtils.hasText(callbackUrl)) {
            throw new ResponseStatusException(BAD_REQUEST, "callback_url is required");
        }
        try {
            URI uri = URI.create(callbackUrl.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
                throw new ResponseStatusException(BAD_REQUEST, "callback_url must be an absolute http(s) URL");
            }
            return uri.toString();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "callback_url is not a valid URL", ex);
        }
    }
}
