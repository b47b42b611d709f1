package com.fbo.reconciliation.metrics;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works without any
 * metrics library on the classpath.
 */
public interface MetricsService {

    void recordSyncDuration(String outcome, Duration duration);

    void incrementRemoteFetchFailure();

    void incrementPushSuccess();

    void incrementPushFailure();

    void recordRecordsMerged(int merged, int added);

    void recordImportSkipped(long skippedRows);

    void recordCacheHit();

    void recordCacheMiss();
}
