package com.questrail.pvstream.sim;

import com.questrail.pvstream.ntnd.model.RawFrame;

/**
 * Destination for generated frames, e.g. a channel on the frame server.
 */
@FunctionalInterface
public interface FramePublisher {

    void publish(RawFrame frame);
}
