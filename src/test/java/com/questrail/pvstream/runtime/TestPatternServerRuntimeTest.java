package com.questrail.pvstream.runtime;

import com.questrail.pvstream.api.RecordingRenderer;
import com.questrail.pvstream.config.DisplaySettings;
import com.questrail.pvstream.config.FeedConfig;
import com.questrail.pvstream.config.ViewerConfig;
import com.questrail.pvstream.sim.TestPattern;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TestPatternServerRuntimeTest
 * -----------------------------------------------------------------------------
 * Synthetic detector and viewer talking over loopback TCP.
 */
class TestPatternServerRuntimeTest {

    @Test
    void viewerRendersFramesFromTheSyntheticDetector() throws Exception {
        TestPatternServerRuntime detector = TestPatternServerRuntime.builder()
            .withChannelName("SIM:Image")
            .withPattern(TestPattern.CHECKERBOARD)
            .withSize(64, 48)
            .withFps(50)
            .build();
        RecordingRenderer renderer = new RecordingRenderer();

        detector.start();
        ViewerRuntime viewer = null;
        try {
            viewer = ViewerRuntime.builder()
                .withConfig(ViewerConfig.builder()
                    .withFeed(FeedConfig.builder()
                        .withChannelName("SIM:Image")
                        .withServerAddress(detector.boundAddress())
                        .withConnectTimeout(Duration.ofSeconds(2))
                        .build())
                    .withDisplay(DisplaySettings.defaults())
                    .build())
                .withRenderer(renderer)
                .build();
            viewer.start();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (renderer.count() < 3 && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            assertTrue(renderer.count() >= 3, "viewer rendered " + renderer.count() + " frames");
            assertEquals(64, renderer.last().frame().width());
            assertEquals(48, renderer.last().frame().height());
            assertEquals(1, detector.subscriberCount());
            assertTrue(detector.framesGenerated() >= 3);
        } finally {
            if (viewer != null) {
                viewer.stop();
            }
            detector.stop();
        }
    }

    @Test
    void channelNameIsRequired() {
        assertThrows(NullPointerException.class, () -> TestPatternServerRuntime.builder().build());
    }
}
