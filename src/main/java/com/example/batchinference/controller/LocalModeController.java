package com.example.batchinference.controller;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.model.BatchResult;
import com.example.batchinference.service.callback.PayloadSigner;
import com.example.batchinference.service.tracker.RequestTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

/**
 * Endpoints that let the service act as its own callback target during local
 * testing: results posted to {@code /callback} can be read back through
 * {@code /last/{request_id}}.
 */
@RestController
@Tag(name = "Local mode", description = "Self-callback loop for testing")
public class LocalModeController {

    private static final Logger log = LoggerFactory.getLogger(LocalModeController.class);

    private final RequestTracker tracker;
    private final PayloadSigner signer;
    private final ObjectMapper objectMapper;
    private final InferenceProperties properties;

    public LocalModeController(RequestTracker tracker,
                               PayloadSigner signer,
                               ObjectMapper objectMapper,
                               InferenceProperties properties) {
        this.tracker = tracker;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostMapping(value = "/callback", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Receive a result callback and remember it")
    public Map<String, Boolean> receive(
            @RequestHeader(value = PayloadSigner.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody byte[] body) {
        ensureLocalMode();
        if (signer.isEnabled() && signature != null && !signer.verify(body, signature)) {
            throw new ResponseStatusException(BAD_REQUEST, "Bad signature");
        }
        BatchResult result;
        try {
            result = objectMapper.readValue(body, BatchResult.class);
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Malformed callback payload", ex);
        }
        tracker.put(result.requestId(), result);
        log.debug("Stored callback for request {} ({} results)", result.requestId(), result.results().size());
        return Map.of("ok", true);
    }

    @GetMapping("/last/{requestId}")
    @Operation(summary = "Return the last tracked result for a request id")
    public BatchResult last(@PathVariable String requestId) {
        ensureLocalMode();
        return tracker.get(requestId)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "not found"));
    }

    private void ensureLocalMode() {
        if (!properties.getLocalMode().isEnabled()) {
            throw new ResponseStatusException(NOT_FOUND, "Local mode is disabled");
        }
    }
}
