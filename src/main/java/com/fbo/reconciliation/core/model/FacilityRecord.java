package com.fbo.reconciliation.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One ground-service provider (FBO) at one airport.
 * Immutable; changes are made by building a new record through {@link #builder(FacilityRecord)}.
 *
 * <p>The builder enforces the pairing rules between related fields: fuel prices are only kept
 * together with their observation timestamp, and the ramp-fee waiver only exists alongside a
 * ramp fee.</p>
 */
public final class FacilityRecord {

    /**
     * Provenance label reserved for rows loaded from the bundled dataset.
     * Interactive edits must never carry it.
     */
    public static final String BULK_IMPORT_LABEL = "CSV Import";

    static final int MIN_LOCATION_CODE_LENGTH = 3;
    static final int MAX_LOCATION_CODE_LENGTH = 4;

    private final String locationCode;
    private final String name;

    private final String phone;
    private final String radioFrequency;
    private final String website;

    private final Double jetAPrice;
    private final Double avgasPrice;
    private final Instant fuelPriceDate;
    private final String fuelPriceReporter;

    private final Set<Amenity> amenities;

    private final BigDecimal handlingFee;
    private final BigDecimal overnightFee;
    private final BigDecimal rampFee;
    private final boolean rampFeeWaived;

    private final Double averageRating;
    private final Integer ratingCount;

    private final Instant lastUpdated;
    private final String updatedBy;
    private final String remoteIdentifier;
    private final boolean verified;
    private final boolean pendingUpload;

    private FacilityRecord(Builder builder) {
        this.locationCode = builder.locationCode.trim().toUpperCase(Locale.ROOT);
        this.name = builder.name;
        this.phone = builder.phone;
        this.radioFrequency = builder.radioFrequency;
        this.website = builder.website;

        boolean hasPrice = builder.jetAPrice != null || builder.avgasPrice != null;
        if (hasPrice && builder.fuelPriceDate != null) {
            this.jetAPrice = builder.jetAPrice;
            this.avgasPrice = builder.avgasPrice;
            this.fuelPriceDate = builder.fuelPriceDate;
            this.fuelPriceReporter = builder.fuelPriceReporter;
        } else {
            this.jetAPrice = null;
            this.avgasPrice = null;
            this.fuelPriceDate = null;
            this.fuelPriceReporter = null;
        }

        this.amenities = Collections.unmodifiableSet(builder.amenities.isEmpty()
                ? EnumSet.noneOf(Amenity.class) : EnumSet.copyOf(builder.amenities));

        this.handlingFee = builder.handlingFee;
        this.overnightFee = builder.overnightFee;
        this.rampFee = builder.rampFee;
        this.rampFeeWaived = builder.rampFee != null && builder.rampFeeWaived;

        this.averageRating = builder.averageRating;
        this.ratingCount = builder.ratingCount;

        this.lastUpdated = builder.lastUpdated != null ? builder.lastUpdated : Instant.EPOCH;
        this.updatedBy = builder.updatedBy;
        this.remoteIdentifier = builder.remoteIdentifier;
        this.verified = builder.verified;
        this.pendingUpload = builder.pendingUpload;
    }

    public String getLocationCode() {
        return locationCode;
    }

    public String getName() {
        return name;
    }

    public String getPhone() {
        return phone;
    }

    public String getRadioFrequency() {
        return radioFrequency;
    }

    public String getWebsite() {
        return website;
    }

    public Double getJetAPrice() {
        return jetAPrice;
    }

    public Double getAvgasPrice() {
        return avgasPrice;
    }

    public Instant getFuelPriceDate() {
        return fuelPriceDate;
    }

    public String getFuelPriceReporter() {
        return fuelPriceReporter;
    }

    /**
     * True when the record carries at least one fuel price (and therefore a timestamp).
     */
    public boolean hasFuelPrice() {
        return fuelPriceDate != null;
    }

    public Set<Amenity> getAmenities() {
        return amenities;
    }

    public boolean hasAmenity(Amenity amenity) {
        return amenities.contains(amenity);
    }

    public BigDecimal getHandlingFee() {
        return handlingFee;
    }

    public BigDecimal getOvernightFee() {
        return overnightFee;
    }

    public BigDecimal getRampFee() {
        return rampFee;
    }

    public boolean isRampFeeWaived() {
        return rampFeeWaived;
    }

    public Double getAverageRating() {
        return averageRating;
    }

    public Integer getRatingCount() {
        return ratingCount;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public String getRemoteIdentifier() {
        return remoteIdentifier;
    }

    public boolean isVerified() {
        return verified;
    }

    public boolean isPendingUpload() {
        return pendingUpload;
    }

    /**
     * Airport identifiers are 3 (IATA) or 4 (ICAO) characters once trimmed.
     */
    public static boolean isValidLocationCode(String locationCode) {
        if (locationCode == null) {
            return false;
        }
        int length = locationCode.trim().length();
        return length >= MIN_LOCATION_CODE_LENGTH && length <= MAX_LOCATION_CODE_LENGTH;
    }

    /**
     * True when the record was produced by the bundled dataset import.
     */
    public boolean isBulkImported() {
        return BULK_IMPORT_LABEL.equals(updatedBy);
    }

    /**
     * Short human-readable list of confirmed amenities, e.g. "Crew Car • Lounge".
     */
    public String amenitiesSummary() {
        return amenities.stream()
                .map(Amenity::getDisplayName)
                .collect(Collectors.joining(" • "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FacilityRecord that = (FacilityRecord) o;
        return rampFeeWaived == that.rampFeeWaived
                && verified == that.verified
                && pendingUpload == that.pendingUpload
                && locationCode.equals(that.locationCode)
                && Objects.equals(name, that.name)
                && Objects.equals(phone, that.phone)
                && Objects.equals(radioFrequency, that.radioFrequency)
                && Objects.equals(website, that.website)
                && Objects.equals(jetAPrice, that.jetAPrice)
                && Objects.equals(avgasPrice, that.avgasPrice)
                && Objects.equals(fuelPriceDate, that.fuelPriceDate)
                && Objects.equals(fuelPriceReporter, that.fuelPriceReporter)
                && amenities.equals(that.amenities)
                && Objects.equals(handlingFee, that.handlingFee)
                && Objects.equals(overnightFee, that.overnightFee)
                && Objects.equals(rampFee, that.rampFee)
                && Objects.equals(averageRating, that.averageRating)
                && Objects.equals(ratingCount, that.ratingCount)
                && lastUpdated.equals(that.lastUpdated)
                && Objects.equals(updatedBy, that.updatedBy)
                && Objects.equals(remoteIdentifier, that.remoteIdentifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locationCode, name, phone, radioFrequency, website, jetAPrice, avgasPrice,
                fuelPriceDate, fuelPriceReporter, amenities, handlingFee, overnightFee, rampFee,
                rampFeeWaived, averageRating, ratingCount, lastUpdated, updatedBy, remoteIdentifier,
                verified, pendingUpload);
    }

    @Override
    public String toString() {
        return "FacilityRecord{" +
                "locationCode='" + locationCode + '\'' +
                ", name='" + name + '\'' +
                ", verified=" + verified +
                ", updatedBy='" + updatedBy + '\'' +
                ", lastUpdated=" + lastUpdated +
                ", remoteIdentifier='" + remoteIdentifier + '\'' +
                ", pendingUpload=" + pendingUpload +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(FacilityRecord record) {
        return new Builder()
                .locationCode(record.locationCode)
                .name(record.name)
                .phone(record.phone)
                .radioFrequency(record.radioFrequency)
                .website(record.website)
                .jetAPrice(record.jetAPrice)
                .avgasPrice(record.avgasPrice)
                .fuelPriceDate(record.fuelPriceDate)
                .fuelPriceReporter(record.fuelPriceReporter)
                .amenities(record.amenities)
                .handlingFee(record.handlingFee)
                .overnightFee(record.overnightFee)
                .rampFee(record.rampFee)
                .rampFeeWaived(record.rampFeeWaived)
                .averageRating(record.averageRating)
                .ratingCount(record.ratingCount)
                .lastUpdated(record.lastUpdated)
                .updatedBy(record.updatedBy)
                .remoteIdentifier(record.remoteIdentifier)
                .verified(record.verified)
                .pendingUpload(record.pendingUpload);
    }

    public static class Builder {
        private String locationCode;
        private String name;
        private String phone;
        private String radioFrequency;
        private String website;
        private Double jetAPrice;
        private Double avgasPrice;
        private Instant fuelPriceDate;
        private String fuelPriceReporter;
        private final Set<Amenity> amenities = EnumSet.noneOf(Amenity.class);
        private BigDecimal handlingFee;
        private BigDecimal overnightFee;
        private BigDecimal rampFee;
        private boolean rampFeeWaived;
        private Double averageRating;
        private Integer ratingCount;
        private Instant lastUpdated;
        private String updatedBy;
        private String remoteIdentifier;
        private boolean verified;
        private boolean pendingUpload;

        public Builder locationCode(String locationCode) {
            this.locationCode = locationCode;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder radioFrequency(String radioFrequency) {
            this.radioFrequency = radioFrequency;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder jetAPrice(Double jetAPrice) {
            this.jetAPrice = jetAPrice;
            return this;
        }

        public Builder avgasPrice(Double avgasPrice) {
            this.avgasPrice = avgasPrice;
            return this;
        }

        public Builder fuelPriceDate(Instant fuelPriceDate) {
            this.fuelPriceDate = fuelPriceDate;
            return this;
        }

        public Builder fuelPriceReporter(String fuelPriceReporter) {
            this.fuelPriceReporter = fuelPriceReporter;
            return this;
        }

        /**
         * Replaces the fuel price unit (both prices, timestamp and reporter) in one step.
         */
        public Builder fuelPrice(Double jetAPrice, Double avgasPrice, Instant fuelPriceDate, String reporter) {
            this.jetAPrice = jetAPrice;
            this.avgasPrice = avgasPrice;
            this.fuelPriceDate = fuelPriceDate;
            this.fuelPriceReporter = reporter;
            return this;
        }

        public Builder amenities(Collection<Amenity> amenities) {
            this.amenities.clear();
            if (amenities != null) {
                this.amenities.addAll(amenities);
            }
            return this;
        }

        public Builder amenity(Amenity amenity) {
            this.amenities.add(amenity);
            return this;
        }

        public Builder amenity(Amenity amenity, boolean present) {
            if (present) {
                this.amenities.add(amenity);
            } else {
                this.amenities.remove(amenity);
            }
            return this;
        }

        public Builder handlingFee(BigDecimal handlingFee) {
            this.handlingFee = handlingFee;
            return this;
        }

        public Builder overnightFee(BigDecimal overnightFee) {
            this.overnightFee = overnightFee;
            return this;
        }

        public Builder rampFee(BigDecimal rampFee) {
            this.rampFee = rampFee;
            return this;
        }

        public Builder rampFeeWaived(boolean rampFeeWaived) {
            this.rampFeeWaived = rampFeeWaived;
            return this;
        }

        public Builder averageRating(Double averageRating) {
            this.averageRating = averageRating;
            return this;
        }

        public Builder ratingCount(Integer ratingCount) {
            this.ratingCount = ratingCount;
            return this;
        }

        public Builder lastUpdated(Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
            return this;
        }

        public Builder updatedBy(String updatedBy) {
            this.updatedBy = updatedBy;
            return this;
        }

        public Builder remoteIdentifier(String remoteIdentifier) {
            this.remoteIdentifier = remoteIdentifier;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder pendingUpload(boolean pendingUpload) {
            this.pendingUpload = pendingUpload;
            return this;
        }

        public FacilityRecord build() {
            Objects.requireNonNull(locationCode, "locationCode is required");
            Objects.requireNonNull(name, "name is required");
            if (!isValidLocationCode(locationCode)) {
                throw new IllegalArgumentException("locationCode must be 3 or 4 characters: '" + locationCode + "'");
            }
            return new FacilityRecord(this);
        }
    }
}
