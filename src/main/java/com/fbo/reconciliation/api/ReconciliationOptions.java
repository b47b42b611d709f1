package com.fbo.reconciliation.api;

import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.merge.ContactPrecedence;

import java.util.Objects;

/**
 * Options for a {@link FacilityDataService}: the label stamped on this device's edits, the
 * contact precedence used when merging, and the sizes of the sync and push thread pools.
 */
public class ReconciliationOptions {

    private static final String DEFAULT_DEVICE_LABEL = "Local User";
    private static final int DEFAULT_SYNC_THREADS = 4;
    private static final int DEFAULT_PUSH_THREADS = 2;

    private final String deviceLabel;
    private final ContactPrecedence contactPrecedence;
    private final int syncThreads;
    private final int pushThreads;

    private ReconciliationOptions(Builder builder) {
        this.deviceLabel = builder.deviceLabel;
        this.contactPrecedence = builder.contactPrecedence;
        this.syncThreads = builder.syncThreads;
        this.pushThreads = builder.pushThreads;
    }

    public String getDeviceLabel() {
        return deviceLabel;
    }

    public ContactPrecedence getContactPrecedence() {
        return contactPrecedence;
    }

    public int getSyncThreads() {
        return syncThreads;
    }

    public int getPushThreads() {
        return pushThreads;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{deviceLabel='" + deviceLabel + "', contactPrecedence=" + contactPrecedence
                + ", syncThreads=" + syncThreads + ", pushThreads=" + pushThreads + '}';
    }

    public static class Builder {
        private String deviceLabel = DEFAULT_DEVICE_LABEL;
        private ContactPrecedence contactPrecedence = ContactPrecedence.MOST_RECENT;
        private int syncThreads = DEFAULT_SYNC_THREADS;
        private int pushThreads = DEFAULT_PUSH_THREADS;

        public Builder deviceLabel(String deviceLabel) {
            Objects.requireNonNull(deviceLabel, "deviceLabel is required");
            if (deviceLabel.isBlank()) {
                throw new IllegalArgumentException("deviceLabel must not be blank");
            }
            if (FacilityRecord.BULK_IMPORT_LABEL.equals(deviceLabel.trim())) {
                throw new IllegalArgumentException("deviceLabel must not be the bulk import label");
            }
            this.deviceLabel = deviceLabel.trim();
            return this;
        }

        public Builder contactPrecedence(ContactPrecedence contactPrecedence) {
            this.contactPrecedence = Objects.requireNonNull(contactPrecedence, "contactPrecedence is required");
            return this;
        }

        public Builder syncThreads(int syncThreads) {
            if (syncThreads <= 0) {
                throw new IllegalArgumentException("syncThreads must be positive");
            }
            this.syncThreads = syncThreads;
            return this;
        }

        public Builder pushThreads(int pushThreads) {
            if (pushThreads <= 0) {
                throw new IllegalArgumentException("pushThreads must be positive");
            }
            this.pushThreads = pushThreads;
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }
}
