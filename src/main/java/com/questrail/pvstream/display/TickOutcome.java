package com.questrail.pvstream.display;

/**
 * What a single {@link DisplayPump#tick()} did.
 */
public enum TickOutcome {
    /** Pump is paused; queue not touched. */
    PAUSED,
    /** Too soon after the last render for the target FPS; queue not touched. */
    RATE_LIMITED,
    /** Nothing new in the queue. */
    NO_FRAME,
    /** A frame was taken, processed and handed to the renderer. */
    RENDERED
}
