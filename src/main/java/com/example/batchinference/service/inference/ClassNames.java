package com.example.batchinference.service.inference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Class-index-to-label mapping. Unknown indices resolve to their decimal
 * string, a missing index resolves to {@code null}.
 */
public final class ClassNames {

    // {0: 'person', 1: "traffic light"} as written into exported model metadata
    private static final Pattern ENTRY = Pattern.compile("(\\d+)\\s*:\\s*(?:'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\")");

    private static final ClassNames EMPTY = new ClassNames(Map.of());

    private final Map<Integer, String> names;

    private ClassNames(Map<Integer, String> names) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    public static ClassNames empty() {
        return EMPTY;
    }

    public static ClassNames of(Map<Integer, String> names) {
        return new ClassNames(names);
    }

    public static ClassNames fromLines(List<String> lines) {
        Map<Integer, String> names = new LinkedHashMap<>();
        int index = 0;
        for (String line : lines) {
            String label = line.strip();
            if (label.isEmpty() || label.startsWith("#")) {
                continue;
            }
            names.put(index++, label);
        }
        return new ClassNames(names);
    }

    public static ClassNames fromMetadata(String metadata) {
        if (metadata == null || metadata.isBlank()) {
            return EMPTY;
        }
        Map<Integer, String> names = new LinkedHashMap<>();
        Matcher matcher = ENTRY.matcher(metadata);
        while (matcher.find()) {
            String label = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            names.put(Integer.parseInt(matcher.group(1)), label.replace("\\'", "'").replace("\\\"", "\""));
        }
        return new ClassNames(names);
    }

    public String label(Integer classId) {
        if (classId == null) {
            return null;
        }
        return names.getOrDefault(classId, String.valueOf(classId));
    }

    public int size() {
        return names.size();
    }
}
