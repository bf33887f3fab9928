package com.quicklook.server.frame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a frame's header keywords. Values are kept as they were
 * read (numbers or strings); typed access parses on demand.
 */
public class FrameMetadata {

    private final Map<String, Object> keywords;

    public FrameMetadata(Map<String, Object> keywords) {
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public boolean contains(String key) {
        return keywords.containsKey(key);
    }

    public Object get(String key) {
        return keywords.get(key);
    }

    /**
     * Integer value of a keyword, or empty if it is absent or not an integer.
     */
    public Optional<Integer> getInt(String key) {
        Object v = keywords.get(key);
        if (v instanceof Number) {
            return Optional.of(((Number) v).intValue());
        }
        if (v instanceof String) {
            try {
                return Optional.of(Integer.parseInt(((String) v).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Double> getDouble(String key) {
        Object v = keywords.get(key);
        if (v instanceof Number) {
            return Optional.of(((Number) v).doubleValue());
        }
        if (v instanceof String) {
            try {
                return Optional.of(Double.parseDouble(((String) v).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public int getDetectorId() {
        return getInt("DET-ID").orElse(Frame.UNKNOWN_DETECTOR);
    }

    public Map<String, Object> asMap() {
        return keywords;
    }
}
