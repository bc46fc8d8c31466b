package com.questrail.pvstream.ntnd.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Named attribute attached to a frame, e.g. {@code ColorMode}.
 *
 * <p>The value is whatever scalar the producer put there (a boxed number or a
 * string). {@link #asInt()} gives the lenient integer view the decoder uses.</p>
 */
public record NdAttribute(String name, Object value, String descriptor) {

    public NdAttribute {
        Objects.requireNonNull(name, "name");
        descriptor = descriptor == null ? "" : descriptor;
    }

    public static NdAttribute of(String name, Object value) {
        return new NdAttribute(name, value, "");
    }

    /**
     * Integer view of the value: numbers are truncated, numeric strings are
     * parsed, anything else is empty.
     */
    public Optional<Integer> asInt() {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) {
                return Optional.empty();
            }
            return Optional.of(n.intValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of((int) Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
