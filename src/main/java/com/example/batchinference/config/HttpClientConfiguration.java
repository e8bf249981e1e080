package com.example.batchinference.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Outbound HTTP clients. Image downloads and callback posts use separate
 * clients so each can carry its own timeout.
 */
@Configuration
public class HttpClientConfiguration {

    @Bean
    public RestClient imageRestClient(RestClient.Builder builder, InferenceProperties properties) {
        return builder.clone()
                .requestFactory(requestFactory(properties.getFetchTimeout()))
                .build();
    }

    @Bean
    public RestClient callbackRestClient(RestClient.Builder builder, InferenceProperties properties) {
        return builder.clone()
                .requestFactory(requestFactory(properties.getPostTimeout()))
                .build();
    }

    private JdkClientHttpRequestFactory requestFactory(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
