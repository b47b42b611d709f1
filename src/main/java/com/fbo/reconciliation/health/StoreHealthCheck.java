package com.fbo.reconciliation.health;

import com.fbo.reconciliation.store.LocalStore;
import com.fbo.reconciliation.store.StoreMetadata;

/**
 * Reports the local store's state. DEGRADED until a bundled dataset has been imported, DOWN
 * if the store cannot be read.
 */
public class StoreHealthCheck implements HealthCheck {

    private final LocalStore store;

    public StoreHealthCheck(LocalStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "store";
    }

    @Override
    public HealthStatus check() {
        try {
            StoreMetadata metadata = store.metadata();
            int locations = store.locationCodes().size();
            HealthStatus base = metadata.importedDatasetVersion() == 0
                    ? HealthStatus.degraded("No baseline dataset imported")
                    : HealthStatus.up();
            return base
                    .withDetail("locations", locations)
                    .withDetail("datasetVersion", metadata.importedDatasetVersion());
        } catch (RuntimeException e) {
            return HealthStatus.down("Local store unreadable: " + e.getMessage());
        }
    }
}
