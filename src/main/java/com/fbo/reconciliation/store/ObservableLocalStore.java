package com.fbo.reconciliation.store;

import com.fbo.reconciliation.core.model.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Decorates a {@link LocalStore} and notifies {@link StoreChangeListener}s after each
 * successful replace. Listener failures are logged and do not affect the write.
 */
public class ObservableLocalStore implements LocalStore {
    private static final Logger log = LoggerFactory.getLogger(ObservableLocalStore.class);

    private final LocalStore delegate;
    private final List<StoreChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ObservableLocalStore(LocalStore delegate) {
        this.delegate = delegate;
    }

    public void addListener(StoreChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StoreChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public List<FacilityRecord> get(String locationCode) {
        return delegate.get(locationCode);
    }

    @Override
    public void replace(String locationCode, List<FacilityRecord> records) {
        delegate.replace(locationCode, records);
        List<FacilityRecord> stored = delegate.get(locationCode);
        for (StoreChangeListener listener : listeners) {
            try {
                listener.onRecordsChanged(locationCode, stored);
            } catch (RuntimeException e) {
                log.warn("Store listener {} failed for {}: {}", listener, locationCode, e.getMessage(), e);
            }
        }
    }

    @Override
    public Set<String> locationCodes() {
        return delegate.locationCodes();
    }

    @Override
    public StoreMetadata metadata() {
        return delegate.metadata();
    }

    @Override
    public void updateMetadata(StoreMetadata metadata) {
        delegate.updateMetadata(metadata);
    }

    @Override
    public void clear() {
        delegate.clear();
    }
}
