package com.questrail.pvstream.ntnd.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RawFrame
 * =============================================================================
 * Self-describing multidimensional array as delivered by the feed
 * (NTNDArray-like).
 *
 * <p>A RawFrame is not trusted: the payload may be absent, the dimension list
 * may not match it and the attributes may be garbage. Validation is the
 * decoder's job, so this record only enforces structural non-nullness.</p>
 *
 * @param uniqueId   producer frame counter, increasing but not gap-free
 * @param dimensions axis descriptors in wire order
 * @param value      payload union, or {@code null} when the producer sent none
 * @param attributes named attributes
 * @param timeStamp  producer timestamp, may be {@code null}
 * @param descriptor free-form producer description
 */
public record RawFrame(
        long uniqueId,
        List<NdDimension> dimensions,
        NdValue value,
        List<NdAttribute> attributes,
        Instant timeStamp,
        String descriptor
) {
    public RawFrame {
        dimensions = List.copyOf(Objects.requireNonNull(dimensions, "dimensions"));
        attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
        descriptor = descriptor == null ? "" : descriptor;
    }

    /** Payload if present. */
    public Optional<NdValue> payload() {
        return Optional.ofNullable(value);
    }

    /** First attribute with the given name. */
    public Optional<NdAttribute> attribute(String name) {
        for (NdAttribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    /** Product of the dimension sizes, as a long so it cannot overflow for 3 axes. */
    public long declaredElementCount() {
        long product = 1;
        for (NdDimension d : dimensions) {
            product *= d.size();
        }
        return product;
    }
}
