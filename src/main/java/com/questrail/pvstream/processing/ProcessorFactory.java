package com.questrail.pvstream.processing;

/**
 * Builds a processor instance from its spec.
 */
@FunctionalInterface
public interface ProcessorFactory {

    FrameProcessor create(ProcessorSpec spec);
}
