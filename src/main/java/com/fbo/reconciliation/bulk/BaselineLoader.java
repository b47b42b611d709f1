package com.fbo.reconciliation.bulk;

import com.fbo.reconciliation.cache.RemoteFetchCache;
import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.lock.LocationLock;
import com.fbo.reconciliation.logging.LogContext;
import com.fbo.reconciliation.merge.Reconciler;
import com.fbo.reconciliation.metrics.MetricsService;
import com.fbo.reconciliation.store.LocalStore;
import com.fbo.reconciliation.store.StoreMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds a versioned bundled dataset into the local store.
 *
 * <p>The dataset is only applied when its version is newer than the one recorded in the store
 * metadata. Each location is reconciled against what is already stored, never overwritten, so
 * user edits made since the previous import are kept. After a successful run the new version
 * is recorded and every cached remote fetch is dropped.</p>
 */
public class BaselineLoader {
    private static final Logger log = LoggerFactory.getLogger(BaselineLoader.class);

    private final BaselineImporter importer;
    private final LocalStore store;
    private final LocationLock locationLock;
    private final Reconciler reconciler;
    private final RemoteFetchCache fetchCache;
    private final MetricsService metricsService;
    private final Clock clock;

    public BaselineLoader(BaselineImporter importer, LocalStore store, LocationLock locationLock,
                          Reconciler reconciler, RemoteFetchCache fetchCache,
                          MetricsService metricsService, Clock clock) {
        this.importer = importer;
        this.store = store;
        this.locationLock = locationLock;
        this.reconciler = reconciler;
        this.fetchCache = fetchCache;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Imports the dataset if {@code datasetVersion} is newer than the stored one.
     *
     * @return the import result, or empty when the store is already up to date
     */
    public Optional<ImportResult> loadIfNewer(Reader dataset, int datasetVersion) {
        int current = store.metadata().importedDatasetVersion();
        if (datasetVersion <= current) {
            log.debug("import.skipped datasetVersion={} storedVersion={}", datasetVersion, current);
            return Optional.empty();
        }
        return Optional.of(load(dataset, datasetVersion));
    }

    /**
     * Imports the dataset regardless of the stored version.
     */
    public ImportResult forceReload(Reader dataset, int datasetVersion) {
        log.info("import.forced datasetVersion={} storedVersion={}",
                datasetVersion, store.metadata().importedDatasetVersion());
        return load(dataset, datasetVersion);
    }

    private ImportResult load(Reader dataset, int datasetVersion) {
        try (LogContext ctx = LogContext.forImport(LogContext.generateCorrelationId(), datasetVersion)) {
            log.info("import.starting datasetVersion={}", datasetVersion);

            List<RawRow> rows = importer.readRows(dataset);
            ImportResult result = importer.importBaseline(rows, datasetVersion);

            Map<String, List<FacilityRecord>> byLocation = new LinkedHashMap<>();
            for (FacilityRecord record : result.records()) {
                byLocation.computeIfAbsent(record.getLocationCode(), k -> new ArrayList<>()).add(record);
            }

            byLocation.forEach(this::foldLocation);

            StoreMetadata metadata = store.metadata().withImportedVersion(datasetVersion, clock.instant());
            store.updateMetadata(metadata);
            fetchCache.invalidateAll();

            if (result.skippedRows() > 0) {
                metricsService.recordImportSkipped(result.skippedRows());
            }
            log.info("import.completed datasetVersion={} locations={} imported={} skipped={}",
                    datasetVersion, byLocation.size(), result.importedCount(), result.skippedRows());
            return result;
        }
    }

    private void foldLocation(String locationCode, List<FacilityRecord> baseline) {
        locationLock.tryLock(locationCode);
        try {
            List<FacilityRecord> local = store.get(locationCode);
            List<FacilityRecord> merged = reconciler.reconcile(local, baseline);
            store.replace(locationCode, merged);
        } finally {
            locationLock.unlock(locationCode);
        }
    }
}
