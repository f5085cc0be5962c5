package com.dorkscan.scanner.service;

import com.dorkscan.scanner.config.ScanProperties;
import com.dorkscan.scanner.model.DorkCatalog;
import com.dorkscan.scanner.model.DorkCategory;
import com.dorkscan.scanner.model.DorkQuery;
import com.dorkscan.scanner.model.Finding;
import com.dorkscan.scanner.model.ScanSummary;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one scan: expands the catalog into queries, paces and bounds their dispatch, and
 * pushes every new result URL through snapshotting, detection and persistence.
 *
 * <p>Queries start in catalog order, one {@code scan.delay} apart. At most
 * {@code scan.concurrency} queries are between their search call and their last append at
 * any time. Findings of one query are appended in the order the search engine returned them.
 */
@Service
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final SearchBackendChain backends;
    private final SnapshotFetcher snapshots;
    private final SensitiveContentDetector detector;
    private final FindingSink sink;
    private final ScanProperties props;
    private final AtomicReference<RunState> current = new AtomicReference<>();

    public ScanOrchestrator(SearchBackendChain backends,
                            SnapshotFetcher snapshots,
                            SensitiveContentDetector detector,
                            FindingSink sink,
                            ScanProperties props) {
        this.backends = backends;
        this.snapshots = snapshots;
        this.detector = detector;
        this.sink = sink;
        this.props = props;
    }

    public ScanSummary run(DorkCatalog catalog) {
        return scan(catalog).block();
    }

    public Mono<ScanSummary> scan(DorkCatalog catalog) {
        return Mono.defer(() -> {
            RunState state = new RunState();
            if (!current.compareAndSet(null, state)) {
                return Mono.error(new IllegalStateException("a scan is already running"));
            }
            sink.initialize();
            List<DorkQuery> queries = plan(catalog, state);
            log.info("Dispatching {} queries via {} (concurrency {}, delay {} ms)",
                    queries.size(), backends.describe(), props.concurrency(), props.delay().toMillis());

            return Flux.fromIterable(queries)
                    .concatMap(query -> Mono.just(query).delayElement(props.delay()))
                    .flatMap(query -> execute(query, state), props.concurrency())
                    .takeUntilOther(state.stop.asMono())
                    .then(Mono.fromCallable(() -> {
                        release(state);
                        return state.summary();
                    }))
                    .doFinally(signal -> release(state));
        });
    }

    /**
     * Stops dispatching new queries and cancels in-flight requests. Findings already appended
     * stay on disk. Waits up to {@code scan.shutdown-grace} for the run to wind down.
     */
    @PreDestroy
    public void cancel() {
        RunState state = current.get();
        if (state == null) return;
        log.warn("Interrupted; stopping scan");
        state.cancelled = true;
        state.stop.tryEmitValue(Boolean.TRUE);
        try {
            if (!state.finished.await(props.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scan did not stop within {} ms", props.shutdownGrace().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void release(RunState state) {
        current.compareAndSet(state, null);
        state.finished.countDown();
    }

    public boolean isRunning() {
        return current.get() != null;
    }

    List<DorkQuery> plan(DorkCatalog catalog, RunState state) {
        List<String> selected = props.hasCategory() ? List.of(props.category()) : catalog.names();
        List<DorkQuery> queries = new ArrayList<>();
        for (String name : selected) {
            Optional<DorkCategory> found = catalog.find(name);
            if (found.isEmpty()) {
                log.warn("Category '{}' not found, skipping", name);
                state.skippedCategories.incrementAndGet();
                continue;
            }
            DorkCategory category = found.get();
            if (category.isSensitive() && !props.allowSensitive()) {
                log.warn("Sensitive category '{}' (risk {}) skipped; set scan.allow-sensitive=true to enable",
                        name, category.risk().jsonValue());
                state.skippedCategories.incrementAndGet();
                continue;
            }
            if (category.patterns().isEmpty()) {
                log.warn("Category '{}' has an empty dork list, skipping", name);
                state.skippedCategories.incrementAndGet();
                continue;
            }
            log.info("Running category '{}' ({} dorks)", name, category.patterns().size());
            for (String pattern : category.patterns()) {
                queries.add(DorkQuery.build(name, pattern, props.target()));
            }
        }
        return queries;
    }

    private Mono<Long> execute(DorkQuery query, RunState state) {
        return Mono.defer(() -> {
                    log.info("[dork] {} -> {}", query.pattern(), query.query());
                    state.queriesRun.incrementAndGet();
                    return backends.search(query.query(), props.num());
                })
                .flatMapMany(hits -> select(query, hits, state))
                .concatMap(url -> record(query, url, state))
                .count()
                .delayUntil(n -> props.cooldown().isZero() ? Mono.empty() : Mono.delay(props.cooldown()));
    }

    private Flux<String> select(DorkQuery query, List<String> hits, RunState state) {
        if (hits.isEmpty()) {
            state.emptyQueries.incrementAndGet();
            log.warn("No results found from any search engine for: {}", query.query());
            return Flux.empty();
        }
        List<String> fresh = state.deduplicator.filterNew(hits);
        List<String> batch = fresh.subList(0, Math.min(props.num(), fresh.size()));
        log.info("Found {} links ({} new) for '{}'; processing {}", hits.size(), fresh.size(), query.query(), batch.size());
        if (batch.isEmpty()) {
            log.warn("No new results for: {}", query.query());
        }
        return Flux.fromIterable(batch);
    }

    private Mono<Finding> record(DorkQuery query, String url, RunState state) {
        Finding base = Finding.of(query, url, System.currentTimeMillis());
        Mono<Finding> finding = props.snapshot()
                ? snapshots.fetch(url).map(snap -> base.withSnapshot(snap, detector.containsSensitive(snap.contentSnippet())))
                : Mono.just(base);
        return finding.flatMap(f -> Mono.fromCallable(() -> {
                    sink.append(f);
                    state.findings.add(f);
                    if (f.sensitiveHint()) {
                        log.warn("Sensitive content hint: {}", f.url());
                    }
                    log.info("Recorded {}", f.url());
                    return f;
                })
                .subscribeOn(Schedulers.boundedElastic()));
    }

    /** Mutable state of one run; discarded when the run ends. */
    static final class RunState {
        final UrlDeduplicator deduplicator = new UrlDeduplicator();
        final List<Finding> findings = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger queriesRun = new AtomicInteger();
        final AtomicInteger emptyQueries = new AtomicInteger();
        final AtomicInteger skippedCategories = new AtomicInteger();
        final Sinks.One<Boolean> stop = Sinks.one();
        final CountDownLatch finished = new CountDownLatch(1);
        final long startNanos = System.nanoTime();
        volatile boolean cancelled;

        ScanSummary summary() {
            List<Finding> snapshot;
            synchronized (findings) {
                snapshot = new ArrayList<>(findings);
            }
            return new ScanSummary(queriesRun.get(), emptyQueries.get(), skippedCategories.get(), snapshot,
                    Duration.ofNanos(System.nanoTime() - startNanos), cancelled);
        }
    }
}
