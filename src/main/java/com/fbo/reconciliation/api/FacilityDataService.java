package com.fbo.reconciliation.api;

import com.fbo.reconciliation.bulk.BaselineImporter;
import com.fbo.reconciliation.bulk.BaselineLoader;
import com.fbo.reconciliation.bulk.CsvBaselineImporter;
import com.fbo.reconciliation.bulk.ImportResult;
import com.fbo.reconciliation.cache.CacheConfig;
import com.fbo.reconciliation.cache.CaffeineRemoteFetchCache;
import com.fbo.reconciliation.cache.RemoteFetchCache;
import com.fbo.reconciliation.core.model.Amenity;
import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.health.HealthCheckRegistry;
import com.fbo.reconciliation.health.HealthStatus;
import com.fbo.reconciliation.health.StoreHealthCheck;
import com.fbo.reconciliation.health.SyncHealthCheck;
import com.fbo.reconciliation.lock.LocalLocationLock;
import com.fbo.reconciliation.lock.LocationLock;
import com.fbo.reconciliation.logging.LogContext;
import com.fbo.reconciliation.merge.Deduplicator;
import com.fbo.reconciliation.merge.FieldMergePolicy;
import com.fbo.reconciliation.merge.Reconciler;
import com.fbo.reconciliation.metrics.MetricsService;
import com.fbo.reconciliation.metrics.NoOpMetricsService;
import com.fbo.reconciliation.remote.RemoteRecordStore;
import com.fbo.reconciliation.rules.FacilityNameRules;
import com.fbo.reconciliation.rules.NormalizationEngine;
import com.fbo.reconciliation.store.InMemoryLocalStore;
import com.fbo.reconciliation.store.LocalStore;
import com.fbo.reconciliation.store.ObservableLocalStore;
import com.fbo.reconciliation.store.StoreChangeListener;
import com.fbo.reconciliation.sync.PushOutbox;
import com.fbo.reconciliation.sync.SyncOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for reading and editing FBO facility data.
 *
 * <p>Reads are served from the local store and never touch the network. Syncs run on a
 * dedicated executor and always complete with local data, even when the remote store is down.
 * Interactive edits are committed locally under the location lock, marked pending, and then
 * handed to the push outbox.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (FacilityDataService service = FacilityDataService.builder()
 *         .remoteStore(remote)
 *         .localStore(new JsonFileLocalStore(path))
 *         .build()) {
 *     service.loadBaselineIfNewer(reader, 7);
 *     List&lt;FacilityRecord&gt; fbos = service.requestSync("KSFO").join();
 * }
 * </pre>
 */
public class FacilityDataService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FacilityDataService.class);

    private final ReconciliationOptions options;
    private final NormalizationEngine normalizer;
    private final Deduplicator deduplicator;
    private final Reconciler reconciler;
    private final ObservableLocalStore store;
    private final LocationLock locationLock;
    private final PushOutbox outbox;
    private final SyncOrchestrator orchestrator;
    private final BaselineLoader baselineLoader;
    private final HealthCheckRegistry healthChecks;
    private final Clock clock;
    private final ExecutorService syncExecutor;

    private FacilityDataService(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.normalizer = builder.normalizationEngine != null
                ? builder.normalizationEngine : FacilityNameRules.createDefaultEngine();
        this.deduplicator = new Deduplicator(normalizer);
        this.reconciler = new Reconciler(normalizer, deduplicator,
                new FieldMergePolicy(options.getContactPrecedence()));
        this.store = new ObservableLocalStore(builder.localStore != null ? builder.localStore : new InMemoryLocalStore());
        this.locationLock = builder.locationLock != null ? builder.locationLock : new LocalLocationLock();

        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        RemoteFetchCache fetchCache = builder.fetchCache != null
                ? builder.fetchCache : CaffeineRemoteFetchCache.create(CacheConfig.defaults());
        BaselineImporter importer = builder.importer != null ? builder.importer : new CsvBaselineImporter(clock);

        this.outbox = new PushOutbox(builder.remoteStore, store, locationLock, normalizer, fetchCache,
                metrics, options.getPushThreads());
        this.orchestrator = new SyncOrchestrator(store, builder.remoteStore, reconciler, locationLock,
                fetchCache, outbox, metrics, clock);
        this.baselineLoader = new BaselineLoader(importer, store, locationLock, reconciler, fetchCache, metrics, clock);

        this.healthChecks = new HealthCheckRegistry();
        healthChecks.register(new SyncHealthCheck(orchestrator, outbox, store));
        healthChecks.register(new StoreHealthCheck(store));

        AtomicInteger counter = new AtomicInteger();
        this.syncExecutor = Executors.newFixedThreadPool(options.getSyncThreads(), runnable -> {
            Thread thread = new Thread(runnable, "fbo-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.info("FacilityDataService initialized with {}", options);
    }

    // ========== Reads ==========

    /**
     * Returns the stored collection for a location, deduplicated and sorted by name.
     * Never touches the network.
     */
    public List<FacilityRecord> getRecords(String locationCode) {
        return deduplicator.deduplicate(store.get(locationCode));
    }

    /**
     * Syncs a location on the sync executor. The future completes with local data when the
     * remote store is unreachable, and only fails on a local problem (lock timeout, store write).
     */
    public CompletableFuture<List<FacilityRecord>> requestSync(String locationCode) {
        Objects.requireNonNull(locationCode, "locationCode is required");
        return CompletableFuture.supplyAsync(() -> orchestrator.syncLocation(locationCode), syncExecutor);
    }

    /**
     * True if an interactive delete of {@code record} would be allowed: the record is not
     * verified and no verified record shares its normalized name.
     */
    public boolean canDelete(FacilityRecord record) {
        if (record.isVerified()) {
            return false;
        }
        String key = normalizer.normalize(record.getName());
        return store.get(record.getLocationCode()).stream()
                .noneMatch(r -> r.isVerified() && normalizer.normalize(r.getName()).equals(key));
    }

    // ========== Edits ==========

    /**
     * Merges a locally edited record into its location and queues it for upload. A record
     * whose name matches nothing stored is added.
     *
     * @return the stored record after the merge
     * @throws IllegalArgumentException if the edit carries the bulk import label
     */
    public FacilityRecord submitEdit(FacilityRecord edit) {
        FacilityRecord stamped = stamp(edit);
        String code = stamped.getLocationCode();

        try (LogContext ctx = LogContext.forEdit(LogContext.generateCorrelationId(), code, stamped.getName())) {
            List<FacilityRecord> result;
            locationLock.tryLock(code);
            try {
                result = commit(stamped);
            } finally {
                locationLock.unlock(code);
            }
            log.info("edit.committed locationCode={} name='{}' updatedBy='{}'",
                    code, stamped.getName(), stamped.getUpdatedBy());
            outbox.enqueuePending(code, result);
            return find(result, stamped.getName()).orElse(stamped);
        }
    }

    /**
     * Adds a new facility created on this device.
     *
     * <p>If the name collides with a verified record, the submission is merged into that
     * record instead. If it collides with an unverified record created by somebody else, it
     * is rejected. A collision with the submitter's own record is an ordinary edit.</p>
     *
     * @throws DuplicateFacilityException on a collision with another submitter's unverified record
     */
    public FacilityRecord createFacility(FacilityRecord facility) {
        FacilityRecord stamped = stamp(facility);
        String code = stamped.getLocationCode();

        try (LogContext ctx = LogContext.forEdit(LogContext.generateCorrelationId(), code, stamped.getName())) {
            List<FacilityRecord> result;
            locationLock.tryLock(code);
            try {
                Optional<FacilityRecord> existing = find(getRecords(code), stamped.getName());
                if (existing.isPresent()) {
                    FacilityRecord match = existing.get();
                    if (match.isVerified()) {
                        log.info("create.redirected locationCode={} name='{}' verified='{}'",
                                code, stamped.getName(), match.getName());
                    } else if (!Objects.equals(match.getUpdatedBy(), stamped.getUpdatedBy())) {
                        throw new DuplicateFacilityException(
                                "A facility named '" + match.getName() + "' already exists at " + code, match);
                    }
                }
                result = commit(stamped);
            } finally {
                locationLock.unlock(code);
            }
            log.info("create.committed locationCode={} name='{}'", code, stamped.getName());
            outbox.enqueuePending(code, result);
            return find(result, stamped.getName()).orElse(stamped);
        }
    }

    /**
     * Records a fuel price report for an existing facility. The report is timestamped now.
     *
     * @param reporter label of whoever reported the price, or null for this device
     */
    public FacilityRecord updateFuelPrice(String locationCode, String name, Double jetAPrice, Double avgasPrice,
                                          String reporter) {
        if (jetAPrice == null && avgasPrice == null) {
            throw new IllegalArgumentException("At least one fuel price is required");
        }
        if ((jetAPrice != null && jetAPrice < 0) || (avgasPrice != null && avgasPrice < 0)) {
            throw new IllegalArgumentException("Fuel prices must not be negative");
        }
        FacilityRecord existing = require(locationCode, name);
        String label = reporter != null ? reporter : options.getDeviceLabel();
        return submitEdit(FacilityRecord.builder(existing)
                .fuelPrice(jetAPrice, avgasPrice, clock.instant(), label)
                .updatedBy(label)
                .build());
    }

    /**
     * Confirms that a facility offers an amenity. Amenities can only be added this way.
     */
    public FacilityRecord confirmAmenity(String locationCode, String name, Amenity amenity) {
        Objects.requireNonNull(amenity, "amenity is required");
        FacilityRecord existing = require(locationCode, name);
        if (existing.hasAmenity(amenity)) {
            return existing;
        }
        return submitEdit(FacilityRecord.builder(existing)
                .amenity(amenity)
                .updatedBy(options.getDeviceLabel())
                .build());
    }

    /**
     * Deletes a facility and, when it was uploaded, its remote copy. The name stays hidden
     * from syncs until the remote copy is confirmed deleted.
     *
     * @return true if a record was removed, false if nothing matched
     * @throws ProtectedRecordException if the record or its duplicate group is verified
     */
    public boolean deleteRecord(String locationCode, String name) {
        String code = locationCode.trim().toUpperCase(Locale.ROOT);
        String key = normalizer.normalize(name);
        List<String> remoteIdentifiers = new ArrayList<>();

        try (LogContext ctx = LogContext.forEdit(LogContext.generateCorrelationId(), code, name)) {
            locationLock.tryLock(code);
            try {
                List<FacilityRecord> current = store.get(code);
                List<FacilityRecord> kept = new ArrayList<>(current.size());
                for (FacilityRecord record : current) {
                    if (!normalizer.normalize(record.getName()).equals(key)) {
                        kept.add(record);
                        continue;
                    }
                    if (record.isVerified()) {
                        throw new ProtectedRecordException(
                                "Facility '" + record.getName() + "' at " + code + " is verified and cannot be deleted");
                    }
                    if (record.getRemoteIdentifier() != null) {
                        remoteIdentifiers.add(record.getRemoteIdentifier());
                    }
                }
                if (kept.size() == current.size()) {
                    log.debug("delete.not-found locationCode={} name='{}'", code, name);
                    return false;
                }
                store.replace(code, kept);
                outbox.recordDeletion(code, name, remoteIdentifiers);
            } finally {
                locationLock.unlock(code);
            }
            log.info("delete.committed locationCode={} name='{}' remoteCopies={}", code, name, remoteIdentifiers.size());
        }
        return true;
    }

    // ========== Baseline ==========

    public Optional<ImportResult> loadBaselineIfNewer(Reader dataset, int datasetVersion) {
        return baselineLoader.loadIfNewer(dataset, datasetVersion);
    }

    public ImportResult forceReloadBaseline(Reader dataset, int datasetVersion) {
        return baselineLoader.forceReload(dataset, datasetVersion);
    }

    // ========== Observability ==========

    public void addListener(StoreChangeListener listener) {
        store.addListener(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeListener(StoreChangeListener listener) {
        store.removeListener(listener);
    }

    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    // ========== Internals ==========

    /**
     * Applies the interactive-edit provenance rules: never the import label, this device's
     * label when none is given, timestamped now, pending upload, never verified by the editor.
     */
    private FacilityRecord stamp(FacilityRecord edit) {
        Objects.requireNonNull(edit, "record is required");
        if (FacilityRecord.BULK_IMPORT_LABEL.equals(edit.getUpdatedBy())) {
            throw new IllegalArgumentException("Interactive edits may not use the label '"
                    + FacilityRecord.BULK_IMPORT_LABEL + "'");
        }
        Instant now = clock.instant();
        return FacilityRecord.builder(edit)
                .updatedBy(edit.getUpdatedBy() != null ? edit.getUpdatedBy() : options.getDeviceLabel())
                .lastUpdated(now)
                .verified(false)
                .pendingUpload(true)
                .build();
    }

    // Caller holds the location lock. The merge keeps the stored pending flag, so the edited
    // record is flagged here; an edit of a deleted name brings it back.
    private List<FacilityRecord> commit(FacilityRecord stamped) {
        String code = stamped.getLocationCode();
        String key = normalizer.normalize(stamped.getName());
        List<FacilityRecord> result = reconciler.reconcile(store.get(code), List.of(stamped)).stream()
                .map(r -> !r.isPendingUpload() && normalizer.normalize(r.getName()).equals(key)
                        ? FacilityRecord.builder(r).pendingUpload(true).build() : r)
                .toList();
        outbox.clearDeletion(code, stamped.getName());
        store.replace(code, result);
        return result;
    }

    private FacilityRecord require(String locationCode, String name) {
        return find(getRecords(locationCode), name).orElseThrow(() -> new IllegalArgumentException(
                "No facility named '" + name + "' at " + locationCode));
    }

    private Optional<FacilityRecord> find(List<FacilityRecord> records, String name) {
        String key = normalizer.normalize(name);
        return records.stream()
                .filter(r -> normalizer.normalize(r.getName()).equals(key))
                .findFirst();
    }

    @Override
    public void close() {
        syncExecutor.shutdown();
        try {
            if (!syncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                syncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            syncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        outbox.close();
        log.info("FacilityDataService closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RemoteRecordStore remoteStore;
        private LocalStore localStore;
        private NormalizationEngine normalizationEngine;
        private BaselineImporter importer;
        private RemoteFetchCache fetchCache;
        private LocationLock locationLock;
        private MetricsService metricsService;
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private Clock clock;

        /**
         * Sets the backend record store. Required.
         */
        public Builder remoteStore(RemoteRecordStore remoteStore) {
            this.remoteStore = remoteStore;
            return this;
        }

        /**
         * Sets the local store. Defaults to {@link InMemoryLocalStore}.
         */
        public Builder localStore(LocalStore localStore) {
            this.localStore = localStore;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Sets the bundled dataset importer. Defaults to {@link CsvBaselineImporter}.
         */
        public Builder importer(BaselineImporter importer) {
            this.importer = importer;
            return this;
        }

        /**
         * Sets the remote fetch cache. Defaults to a Caffeine cache with {@link CacheConfig#defaults()}.
         */
        public Builder fetchCache(RemoteFetchCache fetchCache) {
            this.fetchCache = fetchCache;
            return this;
        }

        public Builder locationLock(LocationLock locationLock) {
            this.locationLock = locationLock;
            return this;
        }

        /**
         * Sets the metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(ReconciliationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FacilityDataService build() {
            if (remoteStore == null) {
                throw new IllegalStateException("RemoteRecordStore is required");
            }
            return new FacilityDataService(this);
        }
    }
}
