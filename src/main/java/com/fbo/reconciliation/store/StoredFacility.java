package com.fbo.reconciliation.store;

import com.fbo.reconciliation.core.model.Amenity;
import com.fbo.reconciliation.core.model.FacilityRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * JSON shape of a {@link FacilityRecord} inside the store file.
 */
record StoredFacility(
        String locationCode,
        String name,
        String phone,
        String radioFrequency,
        String website,
        Double jetAPrice,
        Double avgasPrice,
        Instant fuelPriceDate,
        String fuelPriceReporter,
        Set<Amenity> amenities,
        BigDecimal handlingFee,
        BigDecimal overnightFee,
        BigDecimal rampFee,
        boolean rampFeeWaived,
        Double averageRating,
        Integer ratingCount,
        Instant lastUpdated,
        String updatedBy,
        String remoteIdentifier,
        boolean verified,
        boolean pendingUpload
) {

    static StoredFacility from(FacilityRecord record) {
        return new StoredFacility(
                record.getLocationCode(),
                record.getName(),
                record.getPhone(),
                record.getRadioFrequency(),
                record.getWebsite(),
                record.getJetAPrice(),
                record.getAvgasPrice(),
                record.getFuelPriceDate(),
                record.getFuelPriceReporter(),
                record.getAmenities(),
                record.getHandlingFee(),
                record.getOvernightFee(),
                record.getRampFee(),
                record.isRampFeeWaived(),
                record.getAverageRating(),
                record.getRatingCount(),
                record.getLastUpdated(),
                record.getUpdatedBy(),
                record.getRemoteIdentifier(),
                record.isVerified(),
                record.isPendingUpload());
    }

    FacilityRecord toRecord() {
        return FacilityRecord.builder()
                .locationCode(locationCode)
                .name(name)
                .phone(phone)
                .radioFrequency(radioFrequency)
                .website(website)
                .fuelPrice(jetAPrice, avgasPrice, fuelPriceDate, fuelPriceReporter)
                .amenities(amenities)
                .handlingFee(handlingFee)
                .overnightFee(overnightFee)
                .rampFee(rampFee)
                .rampFeeWaived(rampFeeWaived)
                .averageRating(averageRating)
                .ratingCount(ratingCount)
                .lastUpdated(lastUpdated)
                .updatedBy(updatedBy)
                .remoteIdentifier(remoteIdentifier)
                .verified(verified)
                .pendingUpload(pendingUpload)
                .build();
    }
}
