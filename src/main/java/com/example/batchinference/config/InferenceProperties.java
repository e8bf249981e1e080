package com.example.batchinference.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Validated
@ConfigurationProperties(prefix = "inference")
public class InferenceProperties {

    @NotBlank
    private String modelPath = "best.onnx";
    private String labelsPath;
    @NotBlank
    private String device = "cpu";
    @Min(32)
    @Max(4096)
    private int imgsz = 640;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double conf = 0.25;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double iou = 0.45;
    @Min(1)
    private int maxInflight = 2;
    @Min(1)
    private int fetchConcurrency = 8;
    @Min(1)
    private int jobConcurrency = 2;
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration fetchTimeout = Duration.ofSeconds(30);
    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration postTimeout = Duration.ofSeconds(60);
    private String inboundToken;
    private String sharedSecret;
    @Min(0)
    @Max(12)
    private int roundPrecision = 5;
    @Min(1)
    private int topK = 5;
    @Valid
    private Callback callback = new Callback();
    @Valid
    private LocalMode localMode = new LocalMode();
    private S3 s3 = new S3();

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public String getLabelsPath() {
        return labelsPath;
    }

    public void setLabelsPath(String labelsPath) {
        this.labelsPath = labelsPath;
    }

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public int getImgsz() {
        return imgsz;
    }

    public void setImgsz(int imgsz) {
        this.imgsz = imgsz;
    }

    public double getConf() {
        return conf;
    }

    public void setConf(double conf) {
        this.conf = conf;
    }

    public double getIou() {
        return iou;
    }

    public void setIou(double iou) {
        this.iou = iou;
    }

    public int getMaxInflight() {
        return maxInflight;
    }

    public void setMaxInflight(int maxInflight) {
        this.maxInflight = maxInflight;
    }

    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = fetchConcurrency;
    }

    public int getJobConcurrency() {
        return jobConcurrency;
    }

    public void setJobConcurrency(int jobConcurrency) {
        this.jobConcurrency = jobConcurrency;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public Duration getPostTimeout() {
        return postTimeout;
    }

    public void setPostTimeout(Duration postTimeout) {
        this.postTimeout = postTimeout;
    }

    public String getInboundToken() {
        return inboundToken;
    }

    public void setInboundToken(String inboundToken) {
        this.inboundToken = inboundToken;
    }

    public String getSharedSecret() {
        return sharedSecret;
    }

    public void setSharedSecret(String sharedSecret) {
        this.sharedSecret = sharedSecret;
    }

    public int getRoundPrecision() {
        return roundPrecision;
    }

    public void setRoundPrecision(int roundPrecision) {
        this.roundPrecision = roundPrecision;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public Callback getCallback() {
        return callback;
    }

    public void setCallback(Callback callback) {
        this.callback = callback;
    }

    public LocalMode getLocalMode() {
        return localMode;
    }

    public void setLocalMode(LocalMode localMode) {
        this.localMode = localMode;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3;
    }

    /**
     * Delivery policy for asynchronous results. Zero retries means a single attempt.
     */
    public static class Callback {

        @Min(0)
        @Max(10)
        private int maxRetries = 0;
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(1500);
        @Min(1)
        private int concurrency = 4;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class LocalMode {

        private boolean enabled = true;
        @Min(1)
        private int trackerCapacity = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTrackerCapacity() {
            return trackerCapacity;
        }

        public void setTrackerCapacity(int trackerCapacity) {
            this.trackerCapacity = trackerCapacity;
        }
    }

    public static class S3 {

        private boolean enabled = true;
        private String region = "ap-northeast-2";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }
    }
}
