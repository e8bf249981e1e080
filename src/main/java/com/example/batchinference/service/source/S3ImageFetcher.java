package com.example.batchinference.service.source;

import com.example.batchinference.exception.SourceException;
import com.example.batchinference.exception.SourceException.Reason;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Reads objects addressed as {@code s3://bucket/key}. Credentials come from the
 * default AWS provider chain of the configured client.
 */
@Component
@Order(2)
public class S3ImageFetcher implements ImageFetcher {

    private static final String PREFIX = "s3://";

    private final ObjectProvider<S3Client> s3Client;

    public S3ImageFetcher(ObjectProvider<S3Client> s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public boolean supports(String scheme) {
        return "s3".equals(scheme);
    }

    @Override
    public byte[] fetch(String source) {
        S3Client client = s3Client.getIfAvailable();
        if (client == null) {
            throw new SourceException(source, Reason.STORAGE_UNAVAILABLE,
                    "Object store client is not configured. Set inference.s3.enabled=true.");
        }
        ObjectLocation location = parse(source);
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build();
        try {
            return client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException | NoSuchBucketException ex) {
            throw new SourceException(source, Reason.NOT_FOUND, "No such object: " + source, ex);
        } catch (SdkException ex) {
            throw new SourceException(source, Reason.TRANSPORT, "Unable to read " + source + ": " + ex.getMessage(), ex);
        }
    }

    static ObjectLocation parse(String source) {
        String bucketKey = source.substring(PREFIX.length());
        int slash = bucketKey.indexOf('/');
        if (slash <= 0 || slash == bucketKey.length() - 1) {
            throw new SourceException(source, Reason.MALFORMED_SOURCE, "Expected s3://bucket/key but got " + source);
        }
        return new ObjectLocation(bucketKey.substring(0, slash), bucketKey.substring(slash + 1));
    }

    record ObjectLocation(String bucket, String key) {
    }
}
