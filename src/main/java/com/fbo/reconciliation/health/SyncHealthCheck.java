package com.fbo.reconciliation.health;

import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.store.LocalStore;
import com.fbo.reconciliation.sync.PushOutbox;
import com.fbo.reconciliation.sync.SyncOrchestrator;

/**
 * Reports whether the remote side is keeping up.
 *
 * <p>DEGRADED when the last remote fetch failed, or when more than {@code backlogThreshold}
 * locally edited records are still waiting for upload. Never DOWN: the engine keeps serving
 * local data without the remote store.</p>
 */
public class SyncHealthCheck implements HealthCheck {

    public static final int DEFAULT_BACKLOG_THRESHOLD = 50;

    private final SyncOrchestrator orchestrator;
    private final PushOutbox outbox;
    private final LocalStore store;
    private final int backlogThreshold;

    public SyncHealthCheck(SyncOrchestrator orchestrator, PushOutbox outbox, LocalStore store) {
        this(orchestrator, outbox, store, DEFAULT_BACKLOG_THRESHOLD);
    }

    public SyncHealthCheck(SyncOrchestrator orchestrator, PushOutbox outbox, LocalStore store,
                           int backlogThreshold) {
        if (backlogThreshold < 0) {
            throw new IllegalArgumentException("backlogThreshold must not be negative");
        }
        this.orchestrator = orchestrator;
        this.outbox = outbox;
        this.store = store;
        this.backlogThreshold = backlogThreshold;
    }

    @Override
    public String getName() {
        return "sync";
    }

    @Override
    public HealthStatus check() {
        long pending = countPending();

        HealthStatus base;
        if (orchestrator.isRemoteDegraded()) {
            base = HealthStatus.degraded("Last remote fetch failed, serving local data");
        } else if (pending > backlogThreshold) {
            base = HealthStatus.degraded("Upload backlog of " + pending + " records");
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("pendingUploads", pending)
                .withDetail("pushesInFlight", outbox.inFlightCount())
                .withDetail("lastRemoteSuccess", orchestrator.getLastRemoteSuccess().map(Object::toString).orElse("never"))
                .withDetail("lastRemoteFailure", orchestrator.getLastRemoteFailure().map(Object::toString).orElse("never"));
    }

    private long countPending() {
        long pending = 0;
        for (String code : store.locationCodes()) {
            pending += store.get(code).stream().filter(FacilityRecord::isPendingUpload).count();
        }
        return pending;
    }
}
