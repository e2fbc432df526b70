package io.fmengine.core.engine;

import io.fmengine.core.error.FeatureModelException;
import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.Configuration;
import io.fmengine.core.model.ConstraintLine;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.FeatureTree;
import io.fmengine.core.model.ModelDocument;
import io.fmengine.core.model.ValidationResult;
import io.fmengine.core.spec.ModelParser;
import io.fmengine.core.spi.EngineListener;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine: runs the load pipeline (parse, build, expand, compile) and exposes
 * validation, enumeration and counting over its results.
 *
 * <p>Each pipeline stage fails fast with its own {@link FeatureModelException} subclass. The
 * single-stage methods are plain delegations; {@link #load(String)} runs the whole pipeline,
 * logs a summary and notifies registered {@link EngineListener}s of the outcome.
 *
 * <p>Thread-safe: the engine holds no per-call state, and listeners may be registered at any time.
 */
public final class FeatureModelEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureModelEngine.class);

    /** Classpath location of the shipped logic-formula model. */
    public static final String BUNDLED_MODEL = "/models/LogicFormula.uvl";

    private final EngineConfig config;
    private final ModelParser parser = new ModelParser();
    private final FeatureTreeBuilder builder = new FeatureTreeBuilder();
    private final RecursionExpander expander = new RecursionExpander();
    private final ConstraintCompiler compiler = new ConstraintCompiler();
    private final ConfigurationValidator validator = new ConfigurationValidator();
    private final ConfigurationEnumerator enumerator = new ConfigurationEnumerator();
    private final List<EngineListener> listeners = new CopyOnWriteArrayList<>();

    /** Creates an engine with {@link EngineConfig#DEFAULT}. */
    public FeatureModelEngine() {
        this(EngineConfig.DEFAULT);
    }

    public FeatureModelEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public EngineConfig config() {
        return config;
    }

    public void addListener(EngineListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(EngineListener listener) {
        listeners.remove(listener);
    }

    // --- Pipeline stages ---

    /** @throws io.fmengine.core.error.ModelSyntaxException on malformed model text */
    public ModelDocument parse(String text) {
        return parser.parse(text);
    }

    /** @throws io.fmengine.core.error.ModelSemanticException on an invalid feature structure */
    public FeatureTree build(ModelDocument document) {
        return builder.build(document);
    }

    /** Expands with the configured depth bound. */
    public ExpandedTree expand(FeatureTree tree) {
        return expand(tree, config.maxDepth());
    }

    /** @throws io.fmengine.core.error.ExpansionException on a dangling reference or negative depth */
    public ExpandedTree expand(FeatureTree tree, int maxDepth) {
        return expander.expand(tree, maxDepth);
    }

    /** Compiles the constraint lines carried by the model. */
    public CompiledConstraints compile(ExpandedTree expanded) {
        return compiler.compile(expanded);
    }

    /** @throws io.fmengine.core.error.ConstraintCompileException on a malformed or unresolved constraint */
    public CompiledConstraints compile(ExpandedTree expanded, List<ConstraintLine> lines) {
        return compiler.compile(expanded, lines);
    }

    // --- Whole pipeline ---

    /** Loads model text with the configured depth bound. */
    public LoadedModel load(String text) {
        return load(text, config.maxDepth());
    }

    /**
     * Parses, builds, expands and compiles model text.
     *
     * @throws FeatureModelException from the first stage that fails
     */
    public LoadedModel load(String text, int maxDepth) {
        Objects.requireNonNull(text, "text must not be null");
        long start = System.nanoTime();
        try {
            FeatureTree tree = build(parse(text));
            ExpandedTree expanded = expand(tree, maxDepth);
            CompiledConstraints constraints = compile(expanded);
            LoadedModel model = new LoadedModel(tree, expanded, constraints);
            long durationMs = elapsedMs(start);
            LOG.info(
                    "Loaded model '{}' (maxDepth={}): {} features, {} instances, {} compiled constraints in {} ms",
                    tree.namespace(),
                    maxDepth,
                    tree.size(),
                    expanded.size(),
                    constraints.size(),
                    durationMs);
            notifyModelLoaded(model, durationMs);
            return model;
        } catch (FeatureModelException e) {
            LOG.warn("Rejected model at {} stage: {}", e.stage(), e.detail());
            notifyModelRejected(e);
            throw e;
        }
    }

    /** Loads the shipped {@code LogicFormula} model with the configured depth bound. */
    public LoadedModel loadBundledModel() {
        return loadBundledModel(config.maxDepth());
    }

    public LoadedModel loadBundledModel(int maxDepth) {
        return load(readBundledModel(), maxDepth);
    }

    /** Text of the shipped {@code LogicFormula} model. */
    public static String readBundledModel() {
        try (InputStream in = FeatureModelEngine.class.getResourceAsStream(BUNDLED_MODEL)) {
            if (in == null) {
                throw new IllegalStateException("Bundled model not found on classpath: " + BUNDLED_MODEL);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled model " + BUNDLED_MODEL, e);
        }
    }

    // --- Validation ---

    public ValidationResult validate(ExpandedTree tree, CompiledConstraints constraints, Configuration configuration) {
        return validator.validate(tree, constraints, configuration);
    }

    public ValidationResult validate(LoadedModel model, Configuration configuration) {
        return validate(model.expanded(), model.constraints(), configuration);
    }

    // --- Enumeration ---

    /** All valid configurations, lazily, on the calling thread. */
    public Stream<Configuration> enumerate(ExpandedTree tree, CompiledConstraints constraints) {
        return enumerator.enumerate(tree, constraints);
    }

    /** At most {@code limit} valid configurations, lazily, on the calling thread. */
    public Stream<Configuration> enumerate(ExpandedTree tree, CompiledConstraints constraints, long limit) {
        return enumerator.enumerate(tree, constraints, limit);
    }

    public long count(ExpandedTree tree, CompiledConstraints constraints) {
        return enumerator.count(tree, constraints);
    }

    /** Collects the configurations of {@code model} as configured; see {@link #enumerate(LoadedModel, CancellationToken)}. */
    public EnumerationResult enumerate(LoadedModel model) throws InterruptedException {
        return enumerate(model, new CancellationToken());
    }

    /**
     * Collects the configurations of {@code model} using the configured parallelism. The search
     * stops once the configured default limit is reached, in parallel runs as well.
     *
     * @throws InterruptedException if interrupted while waiting for parallel workers
     */
    public EnumerationResult enumerate(LoadedModel model, CancellationToken token) throws InterruptedException {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(token, "token must not be null");
        long start = System.nanoTime();
        long limit = config.defaultLimit() == 0 ? Long.MAX_VALUE : config.defaultLimit();
        EnumerationResult result;
        if (config.parallelism() == 1) {
            List<Configuration> configurations = enumerator
                    .enumerate(model.expanded(), model.constraints(), limit, token)
                    .toList();
            result = EnumerationResult.collected(configurations, token.isCancelled());
        } else {
            result = withExecutor(executor ->
                    enumerator.enumerateParallel(model.expanded(), model.constraints(), executor, limit, token));
        }
        completed(model, result, start);
        return result;
    }

    /** Counts the configurations of {@code model}; see {@link #count(LoadedModel, CancellationToken)}. */
    public EnumerationResult count(LoadedModel model) throws InterruptedException {
        return count(model, new CancellationToken());
    }

    /**
     * Counts the configurations of {@code model} using the configured parallelism. The default
     * limit does not apply to counts.
     *
     * @throws InterruptedException if interrupted while waiting for parallel workers
     */
    public EnumerationResult count(LoadedModel model, CancellationToken token) throws InterruptedException {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(token, "token must not be null");
        long start = System.nanoTime();
        EnumerationResult result;
        if (config.parallelism() == 1) {
            long count = enumerator
                    .enumerate(model.expanded(), model.constraints(), Long.MAX_VALUE, token)
                    .count();
            result = EnumerationResult.counted(count, token.isCancelled());
        } else {
            result = withExecutor(
                    executor -> enumerator.countParallel(model.expanded(), model.constraints(), executor, token));
        }
        completed(model, result, start);
        return result;
    }

    @FunctionalInterface
    private interface ParallelSearch {
        EnumerationResult run(ExecutorService executor) throws InterruptedException;
    }

    private EnumerationResult withExecutor(ParallelSearch search) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(config.parallelism());
        try {
            return search.run(executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private void completed(LoadedModel model, EnumerationResult result, long start) {
        long durationMs = elapsedMs(start);
        if (result.count() == 0 && !result.cancelled()) {
            LOG.warn(
                    "Model '{}' at maxDepth={} has no valid configuration",
                    model.namespace(),
                    model.expanded().maxDepth());
        }
        LOG.info(
                "Enumerated model '{}' (maxDepth={}, parallelism={}): {} configurations{} in {} ms",
                model.namespace(),
                model.expanded().maxDepth(),
                config.parallelism(),
                result.count(),
                result.cancelled() ? " (cancelled)" : "",
                durationMs);
        notifyEnumerationCompleted(model, result, durationMs);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Listener notification ---
    // Listener exceptions are caught and logged; they never affect the engine.

    private void notifyModelLoaded(LoadedModel model, long durationMs) {
        EngineListener.ModelLoadedEvent event = new EngineListener.ModelLoadedEvent(
                model.namespace(),
                model.expanded().maxDepth(),
                model.expanded().size(),
                model.constraints().size(),
                durationMs);
        for (EngineListener listener : listeners) {
            try {
                listener.onModelLoaded(event);
            } catch (Exception e) {
                LOG.warn("EngineListener.onModelLoaded failed", e);
            }
        }
    }

    private void notifyModelRejected(FeatureModelException cause) {
        EngineListener.ModelRejectedEvent event = new EngineListener.ModelRejectedEvent(cause.stage(), cause.detail());
        for (EngineListener listener : listeners) {
            try {
                listener.onModelRejected(event);
            } catch (Exception e) {
                LOG.warn("EngineListener.onModelRejected failed", e);
            }
        }
    }

    private void notifyEnumerationCompleted(LoadedModel model, EnumerationResult result, long durationMs) {
        EngineListener.EnumerationCompletedEvent event = new EngineListener.EnumerationCompletedEvent(
                model.namespace(), result.count(), result.cancelled(), durationMs);
        for (EngineListener listener : listeners) {
            try {
                listener.onEnumerationCompleted(event);
            } catch (Exception e) {
                LOG.warn("EngineListener.onEnumerationCompleted failed", e);
            }
        }
    }
}
