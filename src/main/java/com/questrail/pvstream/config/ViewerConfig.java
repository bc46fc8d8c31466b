package com.questrail.pvstream.config;

import com.questrail.pvstream.processing.ProcessorSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for the viewer runtime.
 *
 * @param tickInterval display loop period; the pump polls the queue this often
 * @param processors   post-processing hooks, in application order
 */
public record ViewerConfig(
    FeedConfig feed,
    DisplaySettings display,
    Duration tickInterval,
    List<ProcessorSpec> processors
) {
    public ViewerConfig {
        Objects.requireNonNull(feed, "feed");
        Objects.requireNonNull(display, "display");
        Objects.requireNonNull(tickInterval, "tickInterval");
        processors = List.copyOf(Objects.requireNonNull(processors, "processors"));
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FeedConfig feed;
        private DisplaySettings display = DisplaySettings.defaults();
        private Duration tickInterval = Duration.ofMillis(5);
        private final List<ProcessorSpec> processors = new ArrayList<>();

        public Builder withFeed(FeedConfig feed) {
            this.feed = feed;
            return this;
        }

        public Builder withDisplay(DisplaySettings display) {
            this.display = display;
            return this;
        }

        public Builder withTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder addProcessor(ProcessorSpec processor) {
            this.processors.add(Objects.requireNonNull(processor, "processor"));
            return this;
        }

        public ViewerConfig build() {
            return new ViewerConfig(feed, display, tickInterval, processors);
        }
    }
}
