package com.example.batchinference.service.callback;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.exception.CallbackDeliveryException;
import com.example.batchinference.model.BatchResult;
import com.example.batchinference.model.DeliveryOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.time.Duration;

/**
 * Posts finished batches to caller-supplied endpoints. The body is serialized
 * once and the signature is computed over exactly those bytes. Failed attempts
 * are retried only as configured; the default is a single attempt.
 */
@Service
public class CallbackDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CallbackDispatcher.class);

    private final RestClient restClient;
    private final PayloadSigner signer;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final Duration retryBackoff;

    public CallbackDispatcher(@Qualifier("callbackRestClient") RestClient restClient,
                              PayloadSigner signer,
                              ObjectMapper objectMapper,
                              InferenceProperties properties) {
        this.restClient = restClient;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.maxRetries = properties.getCallback().getMaxRetries();
        this.retryBackoff = properties.getCallback().getRetryBackoff();
    }

    public DeliveryOutcome deliver(BatchResult result, String callbackUrl) {
        byte[] payload = serialize(result);
        String signature = signer.signatureHeader(payload).orElse(null);
        int attempts = maxRetries + 1;
        int attempted = 0;
        CallbackDeliveryException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            attempted = attempt;
            try {
                int status = post(callbackUrl, payload, signature);
                log.info("Delivered request {} to {} (HTTP {}, attempt {}/{})",
                        result.requestId(), callbackUrl, status, attempt, attempts);
                return DeliveryOutcome.delivered(attempt, status);
            } catch (CallbackDeliveryException ex) {
                last = ex;
                log.warn("Callback attempt {}/{} for request {} failed: {}",
                        attempt, attempts, result.requestId(), ex.getMessage());
            }
            if (attempt < attempts && !pause(retryBackoff.multipliedBy(attempt))) {
                log.warn("Interrupted while backing off; abandoning delivery of request {}", result.requestId());
                break;
            }
        }
        log.error("Giving up delivering request {} to {} after {} attempt(s)", result.requestId(), callbackUrl, attempted);
        return DeliveryOutcome.failed(attempted, last != null ? last.getStatusCode() : null,
                last != null ? last.getMessage() : "Delivery interrupted");
    }

    byte[] serialize(BatchResult result) {
        try {
            return objectMapper.writeValueAsBytes(result);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize result for request " + result.requestId(), ex);
        }
    }

    private int post(String callbackUrl, byte[] payload, String signature) {
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(URI.create(callbackUrl))
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (signature != null) {
                            headers.set(PayloadSigner.SIGNATURE_HEADER, signature);
                        }
                    })
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            int status = response.getStatusCode().value();
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new CallbackDeliveryException("Callback endpoint answered HTTP " + status, status, null);
            }
            return status;
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            throw new CallbackDeliveryException("Callback endpoint answered HTTP " + status, status, ex);
        } catch (RestClientException | IllegalArgumentException ex) {
            throw new CallbackDeliveryException("Callback POST failed: " + ex.getMessage(), null, ex);
        }
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
