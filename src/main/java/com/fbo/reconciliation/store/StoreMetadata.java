package com.fbo.reconciliation.store;

import java.time.Instant;

/**
 * Bookkeeping kept next to the facility collections.
 *
 * @param importedDatasetVersion version of the bundled dataset last folded into the store (0 = never)
 * @param lastImportAt           when that import finished, or null
 */
public record StoreMetadata(int importedDatasetVersion, Instant lastImportAt) {

    public StoreMetadata {
        if (importedDatasetVersion < 0) {
            throw new IllegalArgumentException("importedDatasetVersion must be >= 0");
        }
    }

    public static StoreMetadata initial() {
        return new StoreMetadata(0, null);
    }

    public StoreMetadata withImportedVersion(int version, Instant at) {
        return new StoreMetadata(version, at);
    }
}
