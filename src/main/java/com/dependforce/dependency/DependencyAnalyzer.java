package com.dependforce.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Resolves the ordered dependency list of one or more root objects.
 *
 * Each root runs the pipeline discover, flatten, enrich, resolve. Root-level
 * failures stop that root only; a multi-root batch reports per root.
 */
public class DependencyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final DiscoveryRequester requester;
    private final TreeFlattener flattener;
    private final NodeEnricher enricher;
    private final PrecedenceResolver precedenceResolver;
    private final CatalogResolver catalogResolver;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Future<DependencyResult>> inFlight = new CopyOnWriteArrayList<>();
    private int parallelism = 1;
    private Consumer<String> logCallback;

    public DependencyAnalyzer(DiscoveryService discoveryService, CatalogResolver catalogResolver) {
        this.requester = new DiscoveryRequester(discoveryService);
        this.flattener = new TreeFlattener();
        this.enricher = new NodeEnricher();
        this.precedenceResolver = new PrecedenceResolver();
        this.catalogResolver = catalogResolver;
    }

    public void setLogCallback(Consumer<String> callback) {
        this.logCallback = callback;
    }

    /**
     * Number of roots analyzed concurrently. Only use values above 1 when the
     * discovery service and catalog resolver are safe for concurrent use.
     */
    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Stops the analysis. Roots not yet completed are reported as CANCELLED.
     */
    public void cancel() {
        cancelled.set(true);
        for (Future<DependencyResult> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private void log(String message) {
        logger.info(message);
        if (logCallback != null) {
            logCallback.accept(message);
        }
    }

    /**
     * Analyzes every root, returning one result per root in input order.
     *
     * @throws DependencyException INVALID_INPUT if the batch is empty
     */
    public List<DependencyResult> analyzeAll(List<? extends ObjectIdentity> roots, DependencyOptions options)
            throws DependencyException {
        if (roots == null || roots.isEmpty()) {
            throw new DependencyException(DependencyException.Kind.INVALID_INPUT, null,
                "No root objects supplied");
        }

        log("Analyzing " + options.getDirection().name().toLowerCase() + " of " + roots.size() + " object(s)...");
        logger.debug("Analyzing with parallelism {}", getParallelism());

        List<DependencyResult> results;
        if (parallelism > 1 && roots.size() > 1) {
            results = analyzeConcurrently(roots, options);
        } else {
            results = new ArrayList<>(roots.size());
            for (ObjectIdentity root : roots) {
                results.add(analyze(root, options));
            }
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log("Dependency analysis complete: " + (results.size() - failed) + " succeeded, " + failed + " failed");
        return results;
    }

    private List<DependencyResult> analyzeConcurrently(List<? extends ObjectIdentity> roots, DependencyOptions options) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, roots.size()));
        List<Future<DependencyResult>> futures = new ArrayList<>(roots.size());
        try {
            for (ObjectIdentity root : roots) {
                Future<DependencyResult> future = pool.submit(() -> analyze(root, options));
                futures.add(future);
                inFlight.add(future);
            }
            if (cancelled.get()) {
                futures.forEach(f -> f.cancel(true));
            }

            List<DependencyResult> results = new ArrayList<>(roots.size());
            for (int i = 0; i < futures.size(); i++) {
                ObjectIdentity root = roots.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (CancellationException e) {
                    results.add(cancelledResult(root));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    results.add(cancelledResult(root));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    }
                    throw new IllegalStateException("Analysis of " + root.getUrn() + " failed", cause);
                }
            }
            return results;
        } finally {
            inFlight.removeAll(futures);
            pool.shutdown();
        }
    }

    /**
     * Runs the full pipeline for one root object.
     */
    public DependencyResult analyze(ObjectIdentity root, DependencyOptions options) {
        if (cancelled.get()) {
            return cancelledResult(root);
        }
        if (root == null) {
            return DependencyResult.failed(null, new DependencyException(
                DependencyException.Kind.INVALID_INPUT, null, "Root object is null"));
        }

        String name = root.getUrn();
        try {
            RawTreeNode tree = requester.discover(Collections.singleton(root),
                options.isAllowSystemObjects(), options.getDirection());

            List<FlatNode> nodes = flattener.flatten(tree, options.getDirection(), options.isIncludeSelf());
            if (nodes.isEmpty()) {
                log(name + ": No dependencies found");
                return DependencyResult.empty(root);
            }
            logger.debug("{}: flattened {} node(s)", name, nodes.size());

            if (cancelled.get()) {
                return cancelledResult(root);
            }

            NodeEnricher.Enrichment enrichment = enricher.enrichAll(nodes, catalogResolver,
                options.isIncludeScript(), root);
            if (enrichment.hasFailures()) {
                log(name + ": " + enrichment.getFailures().size() + " object(s) could not be resolved");
            }

            List<DependencyRecord> ordered = precedenceResolver.resolve(enrichment.getRecords());
            log(name + ": " + ordered.size() + " dependencies in precedence order");
            return DependencyResult.completed(root, ordered, enrichment.getFailures());

        } catch (DependencyException e) {
            logger.warn("{}: {} failed - {}", name, e.getKind(), e.getMessage());
            if (logCallback != null) {
                logCallback.accept(name + ": " + e.getMessage());
            }
            return DependencyResult.failed(root, e);
        } catch (RuntimeException e) {
            logger.error("{}: unexpected failure", name, e);
            if (logCallback != null) {
                logCallback.accept(name + ": " + e);
            }
            return DependencyResult.failed(root, new DependencyException(DependencyException.Kind.DISCOVERY,
                root, "Unexpected failure analyzing " + name + ": " + e, e));
        }
    }

    private static DependencyResult cancelledResult(ObjectIdentity root) {
        return DependencyResult.failed(root, new DependencyException(
            DependencyException.Kind.CANCELLED, root, "Dependency analysis cancelled"));
    }
}
