package com.fbo.reconciliation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code fbo.sync.duration} (Timer, tag: outcome)</li>
 *   <li>{@code fbo.sync.remote.failure} (Counter)</li>
 *   <li>{@code fbo.push.success}, {@code fbo.push.failure} (Counters)</li>
 *   <li>{@code fbo.records.merged}, {@code fbo.records.added} (Counters)</li>
 *   <li>{@code fbo.import.skipped} (Counter)</li>
 *   <li>{@code fbo.cache.hit}, {@code fbo.cache.miss} (Counters)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter remoteFailureCounter;
    private final Counter pushSuccessCounter;
    private final Counter pushFailureCounter;
    private final Counter mergedCounter;
    private final Counter addedCounter;
    private final Counter importSkippedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.remoteFailureCounter = Counter.builder("fbo.sync.remote.failure")
                .description("Remote fetches that failed and fell back to local data")
                .register(registry);
        this.pushSuccessCounter = Counter.builder("fbo.push.success")
                .description("Local records acknowledged by the remote store")
                .register(registry);
        this.pushFailureCounter = Counter.builder("fbo.push.failure")
                .description("Pushes left queued for a later sync")
                .register(registry);
        this.mergedCounter = Counter.builder("fbo.records.merged")
                .description("Incoming records merged into an existing entry")
                .register(registry);
        this.addedCounter = Counter.builder("fbo.records.added")
                .description("Incoming records with no local counterpart")
                .register(registry);
        this.importSkippedCounter = Counter.builder("fbo.import.skipped")
                .description("Malformed or incomplete dataset rows skipped during import")
                .register(registry);
        this.cacheHitCounter = Counter.builder("fbo.cache.hit")
                .description("Remote fetch cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("fbo.cache.miss")
                .description("Remote fetch cache misses")
                .register(registry);
    }

    @Override
    public void recordSyncDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("fbo.sync.duration")
                        .description("Duration of location sync operations")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRemoteFetchFailure() {
        remoteFailureCounter.increment();
    }

    @Override
    public void incrementPushSuccess() {
        pushSuccessCounter.increment();
    }

    @Override
    public void incrementPushFailure() {
        pushFailureCounter.increment();
    }

    @Override
    public void recordRecordsMerged(int merged, int added) {
        mergedCounter.increment(merged);
        addedCounter.increment(added);
    }

    @Override
    public void recordImportSkipped(long skippedRows) {
        importSkippedCounter.increment(skippedRows);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
