package com.product.resolution.api;

import com.product.resolution.alias.ManufacturerAliasResolver;
import com.product.resolution.blocking.Blocker;
import com.product.resolution.blocking.BlockingResult;
import com.product.resolution.blocking.Bucket;
import com.product.resolution.cache.AliasCaches;
import com.product.resolution.cluster.Clusterer;
import com.product.resolution.cluster.ClusteringResult;
import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.features.FeatureExtractor;
import com.product.resolution.features.RecordFeatures;
import com.product.resolution.logging.LogContext;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.metrics.NoOpMetricsService;
import com.product.resolution.rules.PartNumberNormalizer;
import com.product.resolution.rules.VariantGenerator;
import com.product.resolution.scoring.PairScorer;
import com.product.resolution.store.InMemoryResolutionStore;
import com.product.resolution.store.RecordSource;
import com.product.resolution.store.ResolutionSink;
import com.product.resolution.store.StoreException;
import com.product.resolution.tracing.NoOpTracingService;
import com.product.resolution.tracing.Span;
import com.product.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Main entry point of the product resolution library: runs the batch pipeline and
 * exposes the query service over its published output.
 *
 * <p>A run loads every record from the {@link RecordSource}, derives features, blocks them
 * into candidate pairs, scores the buckets in parallel, clusters the scored pairs into
 * golden records and publishes the result. Publication is all-or-nothing: every sink is
 * framed by {@code begin}/{@code commit}, external sinks commit before the in-memory store,
 * and any failure aborts every sink that has not committed yet.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ProductResolutionEngine engine = ProductResolutionEngine.builder()
 *     .recordSource(new CsvRecordSource(Path.of("products.csv")))
 *     .options(ResolutionOptions.builder()
 *         .aliasTable(new CsvAliasTableLoader().load(Path.of("aliases.csv")))
 *         .build())
 *     .addSink(new CsvResolutionSink(Path.of("out")))
 *     .build();
 *
 * RunSummary summary = engine.run();
 * ComparisonResult view = engine.queryService().compareDetailed("A-1", "B-7");
 * </pre>
 */
public class ProductResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ProductResolutionEngine.class);

    private final RecordSource recordSource;
    private final ResolutionOptions options;
    private final InMemoryResolutionStore store;
    private final List<ResolutionSink> sinks;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final FeatureExtractor featureExtractor;
    private final Blocker blocker;
    private final PairScorer pairScorer;
    private final ResolutionQueryService queryService;

    // Last scored generation, kept for recluster()
    private volatile ScoredRun lastScoredRun;

    private ProductResolutionEngine(Builder builder) {
        this.recordSource = Objects.requireNonNull(builder.recordSource, "recordSource is required");
        this.options = builder.options;
        this.store = builder.store != null ? builder.store : new InMemoryResolutionStore();
        this.sinks = List.copyOf(builder.sinks);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        ManufacturerAliasResolver aliasResolver = new ManufacturerAliasResolver(
                options.getAliasTable(), options.getAliasFuzzyThreshold(),
                AliasCaches.create(options.getAliasCacheConfig()), metricsService);
        this.featureExtractor = new FeatureExtractor(new PartNumberNormalizer(),
                new VariantGenerator(options.getMaxVariants()), aliasResolver);
        this.blocker = new Blocker(options.getBlockingKeyStrategy(), options.getOverflowCap(),
                options.getOverflowPolicy(), metricsService);
        this.pairScorer = new PairScorer(options.getScoringConfig());
        this.queryService = new ResolutionQueryService(recordSource, store, featureExtractor, pairScorer);

        log.info("engine.initialized sinks={} parallelism={} threshold={} aliases={}",
                sinks.size(), options.getScoringParallelism(), options.getClusteringThreshold(),
                options.getAliasTable().stats().aliasCount());
    }

    // ========== Runs ==========

    /**
     * Runs the full pipeline and publishes the result.
     *
     * @throws StoreException      if reading the source or writing a sink fails
     * @throws ResolutionException if scoring fails or the run is interrupted
     */
    public synchronized RunSummary run() {
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracingService.startRun(runId)) {
            try {
                log.info("run.started runId={}", runId);

                List<ProductRecord> records = phase(runId, "load", this::load);
                Map<String, RecordFeatures> features = phase(runId, "features", () -> extract(records));
                BlockingResult blocking = phase(runId, "block", () -> blocker.block(features.values()));
                List<PairScore> scores = phase(runId, "score", () -> score(runId, features, blocking));
                ClusteringResult clustering = phase(runId, "cluster",
                        () -> clusterer(options.getClusteringThreshold()).cluster(features.values(), scores));
                runPhase(runId, "publish", () -> publish(runId, scores, clustering));

                lastScoredRun = new ScoredRun(features, scores, blocking);
                RunSummary summary = summarize(runId, blocking, scores.size(), clustering, start);
                span.setAttribute("records", records.size());
                span.setAttribute("goldenRecords", clustering.goldenRecords().size());
                span.setStatus(Span.SpanStatus.OK);
                log.info("run.completed runId={} records={} pairs={} goldenRecords={} degraded={} durationMs={}",
                        runId, summary.recordCount(), summary.pairsScored(), summary.goldenRecordCount(),
                        summary.isDegraded(), summary.duration().toMillis());
                return summary;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("run.failed runId={} error={}", runId, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Re-clusters the pair scores of the last run at a new threshold and publishes the
     * result as a new generation, without reloading or re-scoring any record.
     *
     * @throws IllegalStateException if no run has completed yet
     */
    public synchronized RunSummary recluster(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        ScoredRun scored = lastScoredRun;
        if (scored == null) {
            throw new IllegalStateException("No completed run to re-cluster; call run() first");
        }
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId).with("operation", "recluster");
             Span span = tracingService.startRun(runId)) {
            try {
                ClusteringResult clustering = phase(runId, "cluster",
                        () -> clusterer(threshold).cluster(scored.features().values(), scored.scores()));
                runPhase(runId, "publish", () -> publish(runId, scored.scores(), clustering));
                RunSummary summary = summarize(runId, scored.blocking(), scored.scores().size(), clustering, start);
                span.setStatus(Span.SpanStatus.OK);
                log.info("recluster.completed runId={} threshold={} goldenRecords={}",
                        runId, threshold, summary.goldenRecordCount());
                return summary;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("recluster.failed runId={} error={}", runId, e.getMessage());
                throw e;
            }
        }
    }

    // ========== Accessors ==========

    public ResolutionQueryService queryService() {
        return queryService;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public InMemoryResolutionStore getStore() {
        return store;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    // ========== Phases ==========

    private <T> T phase(String runId, String name, Supplier<T> body) {
        long start = System.nanoTime();
        try (Span span = tracingService.startPhase(runId, name)) {
            try {
                T result = body.get();
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            } finally {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                metricsService.recordPhaseDuration(name, elapsed);
                log.debug("phase.completed runId={} phase={} durationMs={}", runId, name, elapsed.toMillis());
            }
        }
    }

    private void runPhase(String runId, String name, Runnable body) {
        phase(runId, name, () -> {
            body.run();
            return null;
        });
    }

    private List<ProductRecord> load() {
        try (Stream<ProductRecord> stream = recordSource.streamAll()) {
            List<ProductRecord> records = stream.toList();
            log.info("phase.load records={}", records.size());
            return records;
        } catch (UncheckedIOException e) {
            throw new StoreException("Cannot read records from source", e.getCause());
        }
    }

    private Map<String, RecordFeatures> extract(List<ProductRecord> records) {
        Map<String, RecordFeatures> features = new LinkedHashMap<>(records.size() * 2);
        for (ProductRecord record : records) {
            if (features.putIfAbsent(record.id(), featureExtractor.extract(record)) != null) {
                log.warn("record.duplicate id={} sourceKey={}", record.id(), record.sourceKey());
            }
        }
        return features;
    }

    /**
     * Scores every bucket on a fixed pool. Waits for all buckets before returning; the first
     * failure cancels the remaining buckets and fails the run.
     */
    private List<PairScore> score(String runId, Map<String, RecordFeatures> features, BlockingResult blocking) {
        List<Bucket> work = blocking.buckets().stream().filter(b -> !b.pairs().isEmpty()).toList();
        Queue<PairScore> results = new ConcurrentLinkedQueue<>();
        if (work.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(options.getScoringParallelism(), work.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, new ScoringThreadFactory(runId));
        CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
        List<Future<Integer>> futures = new ArrayList<>(work.size());
        try {
            for (Bucket bucket : work) {
                futures.add(completion.submit(() -> scoreBucket(runId, bucket, features, results)));
            }
            for (int i = 0; i < futures.size(); i++) {
                completion.take().get();
            }
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ResolutionException(runId, "Scoring failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new ResolutionException(runId, "Scoring interrupted", e);
        } finally {
            shutdown(executor);
        }

        List<PairScore> scores = new ArrayList<>(results);
        scores.sort(Comparator.comparing(PairScore::pair));
        metricsService.incrementPairsScored(scores.size());
        log.info("phase.score buckets={} pairs={} threads={}", work.size(), scores.size(), threads);
        return scores;
    }

    private int scoreBucket(String runId, Bucket bucket, Map<String, RecordFeatures> features,
                            Queue<PairScore> results) {
        try (LogContext ctx = LogContext.forBucket(runId, bucket.key())) {
            for (CandidatePair pair : bucket.pairs()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IllegalStateException("Scoring of bucket " + bucket.key() + " was cancelled");
                }
                PairScore score = pairScorer.score(features.get(pair.idA()), features.get(pair.idB()));
                metricsService.recordPairScore(score.overallScore());
                results.add(score);
            }
            log.debug("bucket.scored key={} members={} pairs={}", bucket.key(), bucket.size(), bucket.pairs().size());
            return bucket.pairs().size();
        }
    }

    private Clusterer clusterer(double threshold) {
        return new Clusterer(threshold, options.getLargeClusterWarningSize(), metricsService);
    }

    /**
     * Writes the run to every external sink and then to the in-memory store. A failure
     * before the last commit aborts every sink that has not committed yet.
     */
    private void publish(String runId, List<PairScore> scores, ClusteringResult clustering) {
        List<ResolutionSink> ordered = new ArrayList<>(sinks);
        ordered.add(store);
        List<ResolutionSink> open = new ArrayList<>();
        int committed = 0;
        try {
            for (ResolutionSink sink : ordered) {
                sink.begin(runId);
                open.add(sink);
            }
            int chunk = options.getSinkChunkSize();
            for (ResolutionSink sink : ordered) {
                for (int from = 0; from < scores.size(); from += chunk) {
                    sink.writePairScores(scores.subList(from, Math.min(from + chunk, scores.size())));
                }
                sink.writeGoldenRecords(clustering.goldenRecords());
            }
            for (ResolutionSink sink : ordered) {
                sink.commit(runId);
                open.remove(sink);
                committed++;
            }
        } catch (RuntimeException e) {
            for (ResolutionSink sink : open) {
                try {
                    sink.abort(runId);
                } catch (RuntimeException abortFailure) {
                    e.addSuppressed(abortFailure);
                }
            }
            if (committed > 0) {
                log.error("publish.partial runId={} committedSinks={} abortedSinks={}", runId, committed, open.size());
            }
            if (e instanceof StoreException) {
                throw e;
            }
            throw new StoreException("Publishing run " + runId + " failed: " + e.getMessage(), e);
        }
        log.info("phase.publish runId={} sinks={} pairScores={} goldenRecords={}",
                runId, ordered.size(), scores.size(), clustering.goldenRecords().size());
    }

    private RunSummary summarize(String runId, BlockingResult blocking, long pairsScored,
                                 ClusteringResult clustering, long startNanos) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsService.recordRunDuration(duration);
        return new RunSummary(runId, blocking.recordCount(), blocking.buckets().size(), pairsScored,
                clustering.goldenRecords().size(), clustering.singletonCount(), clustering.largestClusterSize(),
                clustering.threshold(), blocking.coverage(), duration);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record ScoredRun(Map<String, RecordFeatures> features, List<PairScore> scores, BlockingResult blocking) {
    }

    private static final class ScoringThreadFactory implements ThreadFactory {
        private final String runId;
        private final AtomicInteger counter = new AtomicInteger();

        ScoringThreadFactory(String runId) {
            this.runId = runId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "product-scoring-" + runId.substring(0, 8) + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordSource recordSource;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private InMemoryResolutionStore store;
        private final List<ResolutionSink> sinks = new ArrayList<>();
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Sets the record source. Required.
         */
        public Builder recordSource(RecordSource recordSource) {
            this.recordSource = recordSource;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets the in-memory store backing the query service. A new one is created by default.
         */
        public Builder store(InMemoryResolutionStore store) {
            this.store = store;
            return this;
        }

        /**
         * Adds an external sink. External sinks commit in the order added, before the store.
         */
        public Builder addSink(ResolutionSink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink is required"));
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public ProductResolutionEngine build() {
            if (recordSource == null) {
                throw new IllegalStateException("recordSource is required");
            }
            return new ProductResolutionEngine(this);
        }
    }
}
