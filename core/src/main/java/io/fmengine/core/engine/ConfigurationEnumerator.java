package io.fmengine.core.engine;

import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.Configuration;
import io.fmengine.core.model.ExpandedTree;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates and counts the valid configurations of an {@link ExpandedTree}.
 *
 * <p>Every call opens a fresh depth-first search over the instances in pre-order. The sequential
 * variants are lazy: configurations are produced as the returned stream is consumed, and a
 * limit stops the search early. The parallel variants split the search at its first real choice
 * and explore each branch on an executor with its own copy of the partial assignment; a limit
 * is a budget shared by all branches, so workers stop once it is spent. Results are concatenated
 * in branch order, but callers must not rely on any particular order.
 *
 * <p>Every configuration produced passes {@link ConfigurationValidator} with no violations.
 *
 * <p>Thread-safe and stateless; the tree and constraints are only read.
 */
public final class ConfigurationEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationEnumerator.class);

    /** All valid configurations, lazily. */
    public Stream<Configuration> enumerate(ExpandedTree tree, CompiledConstraints constraints) {
        return enumerate(tree, constraints, Long.MAX_VALUE, new CancellationToken());
    }

    /** At most {@code limit} valid configurations, lazily. */
    public Stream<Configuration> enumerate(ExpandedTree tree, CompiledConstraints constraints, long limit) {
        return enumerate(tree, constraints, limit, new CancellationToken());
    }

    /**
     * At most {@code limit} valid configurations, lazily. The stream ends early once
     * {@code token} is cancelled.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public Stream<Configuration> enumerate(
            ExpandedTree tree, CompiledConstraints constraints, long limit, CancellationToken token) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got: " + limit);
        }
        Iterator<Configuration> iterator = new ConfigurationIterator(tree, SearchCursor.open(tree, constraints, token));
        Stream<Configuration> stream = StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(
                        iterator, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
                false);
        return limit == Long.MAX_VALUE ? stream : stream.limit(limit);
    }

    /** Number of valid configurations, without materialising them. */
    public long count(ExpandedTree tree, CompiledConstraints constraints) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");
        return drainCount(SearchCursor.open(tree, constraints, new CancellationToken()));
    }

    /**
     * Collects all valid configurations, exploring independent branches on {@code executor}.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers;
     *     outstanding branches are cancelled through {@code token}
     */
    public EnumerationResult enumerateParallel(
            ExpandedTree tree, CompiledConstraints constraints, ExecutorService executor, CancellationToken token)
            throws InterruptedException {
        return enumerateParallel(tree, constraints, executor, Long.MAX_VALUE, token);
    }

    /**
     * Collects at most {@code limit} valid configurations, exploring independent branches on
     * {@code executor}. Workers share one budget and stop as soon as it is used up, so which
     * configurations make up a limited result depends on scheduling.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers;
     *     outstanding branches are cancelled through {@code token}
     */
    public EnumerationResult enumerateParallel(
            ExpandedTree tree,
            CompiledConstraints constraints,
            ExecutorService executor,
            long limit,
            CancellationToken token)
            throws InterruptedException {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got: " + limit);
        }
        List<SearchCursor> branches = split(tree, constraints, executor, token);
        AtomicLong budget = new AtomicLong(limit);
        List<Future<List<Configuration>>> futures = new ArrayList<>(branches.size());
        for (SearchCursor branch : branches) {
            futures.add(executor.submit(() -> drain(tree, branch, budget)));
        }
        List<Configuration> configurations = new ArrayList<>();
        for (Future<List<Configuration>> future : futures) {
            configurations.addAll(await(future, token));
        }
        boolean cancelled = branches.stream().anyMatch(SearchCursor::isCancelled);
        LOG.debug(
                "Parallel enumeration over {} branches found {} configurations (limit={}, cancelled={})",
                branches.size(),
                configurations.size(),
                limit,
                cancelled);
        return EnumerationResult.collected(configurations, cancelled);
    }

    /**
     * Counts valid configurations, exploring independent branches on {@code executor}.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers
     */
    public EnumerationResult countParallel(
            ExpandedTree tree, CompiledConstraints constraints, ExecutorService executor, CancellationToken token)
            throws InterruptedException {
        List<SearchCursor> branches = split(tree, constraints, executor, token);
        List<Future<Long>> futures = new ArrayList<>(branches.size());
        for (SearchCursor branch : branches) {
            futures.add(executor.submit(() -> drainCount(branch)));
        }
        long total = 0;
        for (Future<Long> future : futures) {
            total += await(future, token);
        }
        boolean cancelled = branches.stream().anyMatch(SearchCursor::isCancelled);
        LOG.debug("Parallel count over {} branches: {} (cancelled={})", branches.size(), total, cancelled);
        return EnumerationResult.counted(total, cancelled);
    }

    private static List<SearchCursor> split(
            ExpandedTree tree, CompiledConstraints constraints, ExecutorService executor, CancellationToken token) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(token, "token must not be null");
        List<SearchCursor> branches = SearchCursor.branches(tree, constraints, token);
        LOG.debug("Split search over '{}' into {} branches", tree.namespace(), branches.size());
        return branches;
    }

    private static <T> T await(Future<T> future, CancellationToken token) throws InterruptedException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            token.cancel();
            throw e;
        } catch (ExecutionException e) {
            token.cancel();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Enumeration worker failed", cause);
        }
    }

    /** Drains {@code cursor}, taking one unit of the shared {@code budget} per configuration. */
    private static List<Configuration> drain(ExpandedTree tree, SearchCursor cursor, AtomicLong budget) {
        List<Configuration> configurations = new ArrayList<>();
        while (budget.get() > 0) {
            Boolean[] values = cursor.next();
            if (values == null || budget.getAndDecrement() <= 0) {
                break;
            }
            configurations.add(Configuration.fromAssignment(tree, values));
        }
        return configurations;
    }

    private static long drainCount(SearchCursor cursor) {
        long count = 0;
        while (cursor.next() != null) {
            count++;
        }
        return count;
    }

    /** Pulls one assignment ahead so {@link #hasNext()} can answer without losing it. */
    private static final class ConfigurationIterator implements Iterator<Configuration> {

        private final ExpandedTree tree;
        private final SearchCursor cursor;
        private Boolean[] lookahead;
        private boolean done;

        ConfigurationIterator(ExpandedTree tree, SearchCursor cursor) {
            this.tree = tree;
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            if (lookahead == null && !done) {
                lookahead = cursor.next();
                done = lookahead == null;
            }
            return lookahead != null;
        }

        @Override
        public Configuration next() {
            if (!hasNext()) {
                throw new NoSuchElementException("search space exhausted");
            }
            Configuration configuration = Configuration.fromAssignment(tree, lookahead);
            lookahead = null;
            return configuration;
        }
    }
}
