package com.fbo.reconciliation.merge;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;

/**
 * Outcome of reconciling one location.
 *
 * @param records   the reconciled, deduplicated collection
 * @param merged    incoming records folded into an existing entry
 * @param added     incoming records with no local counterpart
 * @param collapsed entries dropped by the final deduplication pass
 */
public record ReconciliationSummary(
        List<FacilityRecord> records,
        int merged,
        int added,
        int collapsed
) {
    public ReconciliationSummary {
        records = records != null ? List.copyOf(records) : List.of();
    }

    public boolean changedAnything() {
        return merged > 0 || added > 0 || collapsed > 0;
    }
}
