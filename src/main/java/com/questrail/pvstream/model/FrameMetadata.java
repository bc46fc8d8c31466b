package com.questrail.pvstream.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable string-keyed metadata handed to post-processing hooks alongside a
 * frame. Processors return annotated copies through {@link #with(String, Object)}.
 */
public final class FrameMetadata {

    public static final String UID = "uid";
    public static final String TIMESTAMP = "timestamp";

    private static final FrameMetadata EMPTY = new FrameMetadata(Map.of());

    private final Map<String, Object> entries;

    private FrameMetadata(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static FrameMetadata empty() {
        return EMPTY;
    }

    /** Metadata describing a frame: its unique id and capture timestamp (if any). */
    public static FrameMetadata of(DecodedFrame frame) {
        Objects.requireNonNull(frame, "frame");
        FrameMetadata m = EMPTY.with(UID, frame.uniqueId());
        Instant ts = frame.captureTimestamp();
        return ts == null ? m : m.with(TIMESTAMP, ts);
    }

    public FrameMetadata with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new FrameMetadata(Collections.unmodifiableMap(copy));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Map<String, Object> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FrameMetadata other && other.entries.equals(entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "FrameMetadata" + entries;
    }
}
