package com.fbo.reconciliation.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSyncDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementRemoteFetchFailure() {
    }

    @Override
    public void incrementPushSuccess() {
    }

    @Override
    public void incrementPushFailure() {
    }

    @Override
    public void recordRecordsMerged(int merged, int added) {
    }

    @Override
    public void recordImportSkipped(long skippedRows) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
