package com.example.batchinference.model;

import java.awt.image.BufferedImage;

public record ResolvedImage(String source, BufferedImage image) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
