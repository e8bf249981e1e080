package com.example.batchinference.service.source;

import com.example.batchinference.exception.SourceException;
import com.example.batchinference.exception.SourceException.Reason;
import com.example.batchinference.model.ResolvedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an image reference into decoded RGB pixels. Transport problems and
 * decode problems are reported with different {@link Reason}s so callers can
 * apply different retry policies.
 */
@Component
public class ImageSourceResolver {

    private static final Logger log = LoggerFactory.getLogger(ImageSourceResolver.class);

    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://");

    private final List<ImageFetcher> fetchers;

    public ImageSourceResolver(List<ImageFetcher> fetchers) {
        this.fetchers = List.copyOf(fetchers);
    }

    public ResolvedImage resolve(String source) {
        if (source == null || source.isBlank()) {
            throw new SourceException(source, Reason.MALFORMED_SOURCE, "Image source must not be blank");
        }
        String scheme = schemeOf(source);
        ImageFetcher fetcher = fetchers.stream()
                .filter(candidate -> candidate.supports(scheme))
                .findFirst()
                .orElseThrow(() -> new SourceException(source, Reason.UNSUPPORTED_SCHEME,
                        "Unsupported source scheme: " + scheme));
        long start = System.nanoTime();
        byte[] data = fetcher.fetch(source);
        BufferedImage image = decode(source, data);
        log.debug("Resolved {} ({} bytes, {}x{}) in {} ms", source, data.length, image.getWidth(), image.getHeight(),
                (System.nanoTime() - start) / 1_000_000.0);
        return new ResolvedImage(source, image);
    }

    static String schemeOf(String source) {
        Matcher matcher = SCHEME.matcher(source);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    private BufferedImage decode(String source, byte[] data) {
        BufferedImage decoded;
        try (ByteArrayInputStream inputStream = new ByteArrayInputStream(data)) {
            decoded = ImageIO.read(inputStream);
        } catch (IOException | RuntimeException ex) {
            throw new SourceException(source, Reason.DECODE, "Unable to decode image data from " + source, ex);
        }
        if (decoded == null) {
            throw new SourceException(source, Reason.DECODE, "Unsupported or corrupt image data from " + source);
        }
        return toRgb(decoded);
    }

    private BufferedImage toRgb(BufferedImage input) {
        if (input.getType() == BufferedImage.TYPE_INT_RGB) {
            return input;
        }
        BufferedImage rgb = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.drawImage(input, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
