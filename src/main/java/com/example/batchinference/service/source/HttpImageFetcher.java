package com.example.batchinference.service.source;

import com.example.batchinference.exception.SourceException;
import com.example.batchinference.exception.SourceException.Reason;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;

/**
 * Downloads images over HTTP(S). The timeout is configured on the injected
 * client; see {@code HttpClientConfiguration}.
 */
@Component
@Order(1)
public class HttpImageFetcher implements ImageFetcher {

    private final RestClient restClient;

    public HttpImageFetcher(@Qualifier("imageRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public boolean supports(String scheme) {
        return "http".equals(scheme) || "https".equals(scheme);
    }

    @Override
    public byte[] fetch(String source) {
        byte[] body;
        try {
            body = restClient.get()
                    .uri(URI.create(source))
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientResponseException ex) {
            HttpStatusCode status = ex.getStatusCode();
            Reason reason = status.value() == 404 ? Reason.NOT_FOUND : Reason.TRANSPORT;
            throw new SourceException(source, reason, "HTTP " + status.value() + " fetching " + source, ex);
        } catch (RestClientException | IllegalArgumentException ex) {
            throw new SourceException(source, Reason.TRANSPORT, "Unable to fetch " + source + ": " + ex.getMessage(), ex);
        }
        if (body == null || body.length == 0) {
            throw new SourceException(source, Reason.DECODE, "Empty response body from " + source);
        }
        return body;
    }
}
