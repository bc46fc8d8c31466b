package com.questrail.pvstream.ntnd.codec;

import java.util.Objects;

/**
 * Indicates that a raw frame could not be turned into a displayable image.
 *
 * <p>The {@link Reason} separates the expected "no image this tick" cases,
 * which callers drop silently, from genuine layout defects that are worth
 * logging.</p>
 */
public final class FrameDecodeException extends RuntimeException
{
    public enum Reason
    {
        /** The payload union was absent or had zero elements. */
        EMPTY_PAYLOAD(true),
        /** The frame declared no dimensions. */
        NO_DIMENSIONS(true),
        /** Dimension count or colour layout the decoder cannot interpret. */
        UNSUPPORTED_LAYOUT(false),
        /** Product of the declared dimension sizes differs from the payload length. */
        SIZE_MISMATCH(false);

        private final boolean expected;

        Reason(boolean expected)
        {
            this.expected = expected;
        }

        /** True for reasons that are a normal part of a live stream. */
        public boolean isExpected()
        {
            return expected;
        }
    }

    private final Reason reason;

    public FrameDecodeException(Reason reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason()
    {
        return reason;
    }

    public boolean isExpected()
    {
        return reason.isExpected();
    }
}
