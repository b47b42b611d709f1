package com.fbo.reconciliation.store;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;

/**
 * Listener for location collection replacements. Implementations can react to new data,
 * e.g. by refreshing a view.
 */
@FunctionalInterface
public interface StoreChangeListener {

    /**
     * Called after the collection of a location was replaced.
     *
     * @param locationCode the location that changed
     * @param records      the collection now stored
     */
    void onRecordsChanged(String locationCode, List<FacilityRecord> records);
}
