package com.example.batchinference.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
@ConditionalOnProperty(prefix = "inference.s3", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean(destroyMethod = "close")
    public S3Client s3Client(InferenceProperties properties) {
        log.info("Configuring S3 client for region {}", properties.getS3().getRegion());
        return S3Client.builder()
                .region(Region.of(properties.getS3().getRegion()))
                .overrideConfiguration(configuration -> configuration.apiCallTimeout(properties.getFetchTimeout()))
                .build();
    }
}
