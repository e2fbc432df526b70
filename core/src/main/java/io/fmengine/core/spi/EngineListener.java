package io.fmengine.core.spi;

import io.fmengine.core.error.FeatureModelException;

/**
 * Observability hooks for {@link io.fmengine.core.engine.FeatureModelEngine}.
 *
 * <p>Implementations bridge to whatever metrics or tracing system the caller uses; the engine itself
 * has no telemetry dependency. Events are immutable. Implementations must be thread-safe, since
 * parallel enumeration may complete on any thread. Exceptions thrown by a listener are caught and
 * logged by the engine and never affect the operation that triggered the event.
 */
public interface EngineListener {

    /**
     * Called when a model passed the whole load pipeline.
     *
     * @param event contains namespace, depth bound, instance and constraint counts, duration
     */
    void onModelLoaded(ModelLoadedEvent event);

    /**
     * Called when a model was rejected by one of the pipeline stages.
     *
     * @param event contains the failing stage and the error detail
     */
    void onModelRejected(ModelRejectedEvent event);

    /**
     * Called when an enumeration or count finished, including cancelled ones.
     *
     * @param event contains namespace, number of configurations, cancellation flag, duration
     */
    void onEnumerationCompleted(EnumerationCompletedEvent event);

    // --- Event records ---

    /** Event emitted when a model is loaded. */
    record ModelLoadedEvent(String namespace, int maxDepth, int instanceCount, int constraintCount, long durationMs) {}

    /** Event emitted when a model is rejected at load time. */
    record ModelRejectedEvent(FeatureModelException.Stage stage, String errorDetail) {}

    /** Event emitted when an enumeration or count completes. */
    record EnumerationCompletedEvent(String namespace, long configurationCount, boolean cancelled, long durationMs) {}
}
