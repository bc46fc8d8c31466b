package com.questrail.pvstream.processing;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.internal.time.WallClock;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;
import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.observability.StreamObservabilitySink;
import com.questrail.pvstream.processing.builtin.FrameAccumulator;
import com.questrail.pvstream.processing.builtin.InvertProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ProcessorRegistry
 * =============================================================================
 * Typed registry of processor factories, keyed by type name.
 *
 * <h2>Admission</h2>
 * A processor is admitted only after a trial run on a small synthetic frame
 * (4x4, 16-bit unsigned, MONO). The trial run must return a non-null result with a
 * non-null frame without throwing. Anything else is a
 * {@link ProcessorValidationException}, raised when the chain is built rather
 * than on the first live frame.
 *
 * <p>The trial run uses a separate instance from the same factory, so a
 * stateful processor never carries the synthetic frame into the live
 * stream. Factories are therefore called twice per spec.</p>
 *
 * <h2>Built-ins</h2>
 * <ul>
 *   <li>{@code invert}: {@link InvertProcessor}</li>
 *   <li>{@code sum}: {@link FrameAccumulator}; params {@code running}
 *       (default false) and {@code preview} (default true)</li>
 * </ul>
 */
public final class ProcessorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    public static final String INVERT = "invert";
    public static final String SUM = "sum";

    private final Map<String, ProcessorFactory> factories = new LinkedHashMap<>();

    public static ProcessorRegistry withBuiltins() {
        ProcessorRegistry registry = new ProcessorRegistry();
        registry.register(INVERT, spec -> new InvertProcessor());
        registry.register(SUM, spec -> {
            FrameAccumulator accumulator = new FrameAccumulator(spec.booleanParam("preview", true));
            if (spec.booleanParam("running", false)) {
                accumulator.start();
            }
            return accumulator;
        });
        return registry;
    }

    public synchronized void register(String type, ProcessorFactory factory) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        if (factories.putIfAbsent(type, factory) != null) {
            throw new IllegalArgumentException("processor type already registered: " + type);
        }
    }

    public synchronized Set<String> types() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Instantiate and validate the processor described by {@code spec}.
     *
     * @throws ProcessorValidationException if the type is unknown, the factory
     *         fails or the trial run fails
     */
    public FrameProcessor create(ProcessorSpec spec) {
        Objects.requireNonNull(spec, "spec");
        final ProcessorFactory factory;
        synchronized (this) {
            factory = factories.get(spec.type());
        }
        if (factory == null) {
            throw new ProcessorValidationException(
                "unknown processor type '" + spec.type() + "' for '" + spec.name() + "'");
        }

        // Trial run on a separate instance so the returned one starts clean
        validate(spec.name(), instantiate(factory, spec));
        return instantiate(factory, spec);
    }

    private static FrameProcessor instantiate(ProcessorFactory factory, ProcessorSpec spec) {
        final FrameProcessor processor;
        try {
            processor = factory.create(spec);
        } catch (RuntimeException e) {
            throw new ProcessorValidationException("factory for '" + spec.name() + "' failed", e);
        }
        if (processor == null) {
            throw new ProcessorValidationException("factory for '" + spec.name() + "' returned null");
        }
        return processor;
    }

    /**
     * Build a chain from the enabled specs, in order.
     */
    public ProcessorChain buildChain(List<ProcessorSpec> specs, StreamObservabilitySink sink, WallClock wallClock) {
        Objects.requireNonNull(specs, "specs");
        List<ProcessorChain.Stage> stages = new ArrayList<>();
        for (ProcessorSpec spec : specs) {
            if (!spec.enabled()) {
                log.debug("Processor '{}' disabled; skipped", spec.name());
                continue;
            }
            stages.add(new ProcessorChain.Stage(spec.name(), create(spec)));
            log.info("Processor '{}' ({}) loaded", spec.name(), spec.type());
        }
        return new ProcessorChain(stages, sink, wallClock);
    }

    /**
     * Trial-run {@code processor} with a synthetic frame.
     *
     * @throws ProcessorValidationException if the trial run fails
     */
    public static void validate(String name, FrameProcessor processor) {
        Objects.requireNonNull(processor, "processor");
        final ProcessedFrame out;
        try {
            DecodedFrame trial = trialFrame();
            out = processor.process(trial, FrameMetadata.of(trial));
        } catch (RuntimeException e) {
            throw new ProcessorValidationException("processor '" + name + "' failed its trial run", e);
        }
        if (out == null) {
            throw new ProcessorValidationException("processor '" + name + "' returned null on its trial run");
        }
    }

    private static DecodedFrame trialFrame() {
        short[] pixels = new short[16];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (short) (i * 1000);
        }
        return new DecodedFrame(4, 4, 1, ColorMode.MONO, new NdValue.UInt16Values(pixels), 0L, null);
    }
}
