package io.fmengine.core.engine;

/**
 * Engine settings.
 *
 * @param maxDepth     recursion bound used when expanding without an explicit depth
 * @param parallelism  number of enumeration workers; {@code 1} searches on the calling thread
 * @param defaultLimit cap on configurations returned by {@link FeatureModelEngine#enumerate};
 *                     {@code 0} means unlimited
 */
public record EngineConfig(int maxDepth, int parallelism, long defaultLimit) {

    public static final int DEFAULT_MAX_DEPTH = 2;

    /** Depth 2, sequential, unlimited. */
    public static final EngineConfig DEFAULT = new EngineConfig(DEFAULT_MAX_DEPTH, 1, 0);

    public EngineConfig {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got: " + maxDepth);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got: " + parallelism);
        }
        if (defaultLimit < 0) {
            throw new IllegalArgumentException("defaultLimit must not be negative, got: " + defaultLimit);
        }
    }

    public EngineConfig withMaxDepth(int maxDepth) {
        return new EngineConfig(maxDepth, parallelism, defaultLimit);
    }

    public EngineConfig withParallelism(int parallelism) {
        return new EngineConfig(maxDepth, parallelism, defaultLimit);
    }

    public EngineConfig withDefaultLimit(long defaultLimit) {
        return new EngineConfig(maxDepth, parallelism, defaultLimit);
    }
}
