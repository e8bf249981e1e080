package com.example.batchinference.service.source;

import com.example.batchinference.exception.SourceException;
import com.example.batchinference.exception.SourceException.Reason;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads images from the local filesystem, either as {@code file://} URIs or as
 * plain paths.
 */
@Component
@Order(3)
public class LocalFileImageFetcher implements ImageFetcher {

    private static final String FILE_PREFIX = "file://";

    @Override
    public boolean supports(String scheme) {
        return scheme == null || "file".equals(scheme);
    }

    @Override
    public byte[] fetch(String source) {
        Path path = toPath(source);
        if (!Files.isRegularFile(path)) {
            throw new SourceException(source, Reason.NOT_FOUND, "File not found: " + path);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new SourceException(source, Reason.TRANSPORT, "Unable to read file " + path, ex);
        }
    }

    Path toPath(String source) {
        String location = source.regionMatches(true, 0, FILE_PREFIX, 0, FILE_PREFIX.length())
                ? source.substring(FILE_PREFIX.length())
                : source;
        try {
            return Paths.get(location);
        } catch (InvalidPathException ex) {
            throw new SourceException(source, Reason.MALFORMED_SOURCE, "Invalid file path: " + source, ex);
        }
    }
}
