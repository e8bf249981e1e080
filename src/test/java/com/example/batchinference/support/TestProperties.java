package com.example.batchinference.support;

import com.example.batchinference.config.InferenceProperties;

public final class TestProperties {

    private TestProperties() {
    }

    public static InferenceProperties defaults() {
        return new InferenceProperties();
    }

    public static InferenceProperties withMaxInflight(int maxInflight) {
        InferenceProperties properties = new InferenceProperties();
        properties.setMaxInflight(maxInflight);
        return properties;
    }
}
