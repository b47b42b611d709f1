package com.fbo.reconciliation.sync;

import com.fbo.reconciliation.cache.RemoteFetchCache;
import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.lock.LocationLock;
import com.fbo.reconciliation.logging.LogContext;
import com.fbo.reconciliation.merge.ReconciliationSummary;
import com.fbo.reconciliation.merge.Reconciler;
import com.fbo.reconciliation.metrics.MetricsService;
import com.fbo.reconciliation.remote.RemoteRecordStore;
import com.fbo.reconciliation.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Brings one location's local collection up to date with the remote store.
 *
 * <p>Sync process, with the location lock held for steps 1 to 4:</p>
 * <ol>
 *   <li>read the stored collection (empty if none)</li>
 *   <li>fetch remote records; any failure degrades to an empty incoming set, and names with
 *       an unconfirmed local delete are dropped</li>
 *   <li>reconcile local against incoming</li>
 *   <li>replace the stored collection, always, and return it</li>
 *   <li>after releasing the lock, hand pending local records to the {@link PushOutbox} and
 *       re-send any unconfirmed remote deletes</li>
 * </ol>
 *
 * <p>{@link #syncLocation} never throws because of the remote side. The only exceptions it
 * lets through are local ones: a lock timeout or a failed store write.</p>
 */
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final LocalStore store;
    private final RemoteRecordStore remoteStore;
    private final Reconciler reconciler;
    private final LocationLock locationLock;
    private final RemoteFetchCache fetchCache;
    private final PushOutbox outbox;
    private final MetricsService metricsService;
    private final Clock clock;

    private final AtomicReference<Instant> lastRemoteSuccess = new AtomicReference<>();
    private final AtomicReference<Instant> lastRemoteFailure = new AtomicReference<>();
    private volatile boolean lastFetchFailed;

    public SyncOrchestrator(LocalStore store, RemoteRecordStore remoteStore, Reconciler reconciler,
                            LocationLock locationLock, RemoteFetchCache fetchCache, PushOutbox outbox,
                            MetricsService metricsService, Clock clock) {
        this.store = store;
        this.remoteStore = remoteStore;
        this.reconciler = reconciler;
        this.locationLock = locationLock;
        this.fetchCache = fetchCache;
        this.outbox = outbox;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Syncs a location and returns the collection now stored for it.
     */
    public List<FacilityRecord> syncLocation(String locationCode) {
        String code = locationCode.trim().toUpperCase(Locale.ROOT);
        long start = System.nanoTime();
        String outcome;
        List<FacilityRecord> result;

        try (LogContext ctx = LogContext.forSync(LogContext.generateCorrelationId(), code)) {
            locationLock.tryLock(code);
            try {
                List<FacilityRecord> local = store.get(code);
                Optional<List<FacilityRecord>> incoming = fetchIncoming(code).map(records -> withoutDeleted(code, records));

                ReconciliationSummary summary = reconciler.reconcileWithSummary(local, incoming.orElse(List.of()));
                result = summary.records();
                store.replace(code, result);

                outcome = incoming.isPresent() ? "remote" : "local-fallback";
                if (incoming.isPresent()) {
                    metricsService.recordRecordsMerged(summary.merged(), summary.added());
                }
                log.info("sync.completed locationCode={} outcome={} local={} incoming={} merged={} added={} records={}",
                        code, outcome, local.size(), incoming.map(List::size).orElse(0),
                        summary.merged(), summary.added(), result.size());
            } finally {
                locationLock.unlock(code);
            }
        }

        metricsService.recordSyncDuration(outcome, Duration.ofNanos(System.nanoTime() - start));
        outbox.enqueuePending(code, result);
        outbox.retryDeletes(code);
        return result;
    }

    public Optional<Instant> getLastRemoteSuccess() {
        return Optional.ofNullable(lastRemoteSuccess.get());
    }

    public Optional<Instant> getLastRemoteFailure() {
        return Optional.ofNullable(lastRemoteFailure.get());
    }

    /**
     * True when the most recent remote fetch failed.
     */
    public boolean isRemoteDegraded() {
        return lastFetchFailed;
    }

    // Names deleted here stay deleted until the remote copies are confirmed gone
    private List<FacilityRecord> withoutDeleted(String code, List<FacilityRecord> incoming) {
        List<FacilityRecord> kept = incoming.stream()
                .filter(r -> !outbox.isDeleted(code, r.getName()))
                .toList();
        if (kept.size() < incoming.size()) {
            log.debug("sync.dropped-deleted locationCode={} count={}", code, incoming.size() - kept.size());
        }
        return kept;
    }

    private Optional<List<FacilityRecord>> fetchIncoming(String code) {
        Optional<List<FacilityRecord>> cached = fetchCache.get(code);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("sync.cache-hit locationCode={} records={}", code, cached.get().size());
            return cached;
        }
        metricsService.recordCacheMiss();

        try {
            List<FacilityRecord> fetched = remoteStore.query(code);
            // Pending upload is this device's outbox state, never something a backend hands us
            List<FacilityRecord> incoming = fetched == null ? List.of() : fetched.stream()
                    .map(r -> r.isPendingUpload() ? FacilityRecord.builder(r).pendingUpload(false).build() : r)
                    .toList();
            fetchCache.put(code, incoming);
            lastRemoteSuccess.set(clock.instant());
            lastFetchFailed = false;
            return Optional.of(incoming);
        } catch (RuntimeException e) {
            lastRemoteFailure.set(clock.instant());
            lastFetchFailed = true;
            metricsService.incrementRemoteFetchFailure();
            log.warn("sync.remote-unavailable locationCode={} error={} (using local data)", code, e.getMessage());
            return Optional.empty();
        }
    }
}
