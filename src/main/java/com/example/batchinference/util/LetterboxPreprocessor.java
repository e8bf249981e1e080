package com.example.batchinference.util;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Converts decoded images into the planar float tensors expected by exported
 * YOLO models. Everything is done with Java2D so no native image library is
 * required.
 */
public final class LetterboxPreprocessor {

    private static final Color PAD_COLOR = new Color(114, 114, 114);

    private LetterboxPreprocessor() {
    }

    /**
     * Scales the image to fit a square of {@code size} pixels keeping the aspect
     * ratio and pads the remainder with grey.
     */
    public static Letterbox letterbox(BufferedImage input, int size) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        double scale = Math.min(size / (double) input.getWidth(), size / (double) input.getHeight());
        int newWidth = Math.max(1, (int) Math.round(input.getWidth() * scale));
        int newHeight = Math.max(1, (int) Math.round(input.getHeight() * scale));
        int padX = (size - newWidth) / 2;
        int padY = (size - newHeight) / 2;

        BufferedImage canvas = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(PAD_COLOR);
            g.fillRect(0, 0, size, size);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(input, padX, padY, newWidth, newHeight, null);
        } finally {
            g.dispose();
        }
        return new Letterbox(toChw(canvas), size, scale, padX, padY);
    }

    /**
     * Stretches the image to {@code size x size}; used for classification models.
     */
    public static float[] resize(BufferedImage input, int size) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        BufferedImage canvas = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(input, 0, 0, size, size, null);
        } finally {
            g.dispose();
        }
        return toChw(canvas);
    }

    private static float[] toChw(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int plane = width * height;
        float[] chw = new float[3 * plane];
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < plane; i++) {
            int rgb = pixels[i];
            chw[i] = ((rgb >> 16) & 0xFF) / 255f;
            chw[plane + i] = ((rgb >> 8) & 0xFF) / 255f;
            chw[2 * plane + i] = (rgb & 0xFF) / 255f;
        }
        return chw;
    }

    /**
     * Planar RGB tensor plus the transform needed to map coordinates back onto
     * the original image.
     */
    public record Letterbox(float[] chw, int size, double scale, int padX, int padY) {

        public double toSourceX(double x) {
            return (x - padX) / scale;
        }

        public double toSourceY(double y) {
            return (y - padY) / scale;
        }
    }
}
