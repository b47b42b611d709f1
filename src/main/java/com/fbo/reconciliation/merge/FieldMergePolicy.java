package com.fbo.reconciliation.merge;

import com.fbo.reconciliation.core.model.Amenity;
import com.fbo.reconciliation.core.model.FacilityRecord;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Combines two records already known to describe the same facility.
 *
 * <p>Rules, per field group:</p>
 * <ul>
 *   <li>location code and name come from the existing record; the remote identifier is
 *       taken from incoming when present, otherwise kept</li>
 *   <li>contact, fee and rating fields: a user- or backend-labelled incoming record overrides
 *       with its non-null values; an import-labelled or unlabelled one only fills gaps</li>
 *   <li>amenities are unioned</li>
 *   <li>the fuel price unit (prices, timestamp, reporter) is taken whole from the side with
 *       the strictly newer timestamp, and a price always beats no price</li>
 *   <li>verification is OR-ed; {@code lastUpdated} and {@code updatedBy} come from the newer
 *       side, except that an import-labelled incoming record keeps the existing provenance
 *       of a record that is not itself an import</li>
 *   <li>the pending-upload flag is local outbox state and is only ever taken from existing</li>
 * </ul>
 *
 * <p>Pure and thread-safe.</p>
 */
public class FieldMergePolicy {

    private final ContactPrecedence contactPrecedence;

    public FieldMergePolicy() {
        this(ContactPrecedence.MOST_RECENT);
    }

    public FieldMergePolicy(ContactPrecedence contactPrecedence) {
        this.contactPrecedence = contactPrecedence;
    }

    public ContactPrecedence getContactPrecedence() {
        return contactPrecedence;
    }

    public FacilityRecord mergeFields(FacilityRecord existing, FacilityRecord incoming) {
        boolean incomingWins = incomingOverridesCommercialFields(existing, incoming);

        FacilityRecord.Builder merged = FacilityRecord.builder()
                .locationCode(existing.getLocationCode())
                .name(existing.getName())
                .remoteIdentifier(incoming.getRemoteIdentifier() != null
                        ? incoming.getRemoteIdentifier() : existing.getRemoteIdentifier());

        merged.phone(pick(existing.getPhone(), incoming.getPhone(), incomingWins))
                .radioFrequency(pick(existing.getRadioFrequency(), incoming.getRadioFrequency(), incomingWins))
                .website(pick(existing.getWebsite(), incoming.getWebsite(), incomingWins))
                .handlingFee(pick(existing.getHandlingFee(), incoming.getHandlingFee(), incomingWins))
                .overnightFee(pick(existing.getOvernightFee(), incoming.getOvernightFee(), incomingWins))
                .rampFee(pick(existing.getRampFee(), incoming.getRampFee(), incomingWins))
                .averageRating(pick(existing.getAverageRating(), incoming.getAverageRating(), incomingWins))
                .ratingCount(pick(existing.getRatingCount(), incoming.getRatingCount(), incomingWins));

        // The waiver belongs to whichever side supplied the ramp fee
        boolean rampFeeFromIncoming = incoming.getRampFee() != null
                && (incomingWins || existing.getRampFee() == null);
        merged.rampFeeWaived(rampFeeFromIncoming ? incoming.isRampFeeWaived() : existing.isRampFeeWaived());

        Set<Amenity> amenities = EnumSet.noneOf(Amenity.class);
        amenities.addAll(existing.getAmenities());
        amenities.addAll(incoming.getAmenities());
        merged.amenities(amenities);

        FacilityRecord fuelSource = incomingHasNewerFuelPrice(existing, incoming) ? incoming : existing;
        merged.fuelPrice(fuelSource.getJetAPrice(), fuelSource.getAvgasPrice(),
                fuelSource.getFuelPriceDate(), fuelSource.getFuelPriceReporter());

        // A dataset refresh never takes over the provenance of a record somebody edited
        boolean keepExistingProvenance = incoming.isBulkImported() && !existing.isBulkImported();
        boolean incomingIsNewer = !keepExistingProvenance
                && incoming.getLastUpdated().isAfter(existing.getLastUpdated());
        merged.lastUpdated(incomingIsNewer ? incoming.getLastUpdated() : existing.getLastUpdated())
                .updatedBy(incomingIsNewer ? incoming.getUpdatedBy() : existing.getUpdatedBy())
                .verified(existing.isVerified() || incoming.isVerified())
                .pendingUpload(existing.isPendingUpload());

        return merged.build();
    }

    /**
     * Decides whether incoming's non-null contact, fee and rating values replace existing's.
     */
    boolean incomingOverridesCommercialFields(FacilityRecord existing, FacilityRecord incoming) {
        if (incoming.getUpdatedBy() == null || incoming.isBulkImported()) {
            return false;
        }
        boolean existingIsUserLabelled = existing.getUpdatedBy() != null && !existing.isBulkImported();
        if (existingIsUserLabelled && contactPrecedence == ContactPrecedence.MOST_RECENT) {
            return !incoming.getLastUpdated().isBefore(existing.getLastUpdated());
        }
        return true;
    }

    private static boolean incomingHasNewerFuelPrice(FacilityRecord existing, FacilityRecord incoming) {
        if (!incoming.hasFuelPrice()) {
            return false;
        }
        if (!existing.hasFuelPrice()) {
            return true;
        }
        Instant existingDate = existing.getFuelPriceDate();
        return incoming.getFuelPriceDate().isAfter(existingDate);
    }

    private static <T> T pick(T existingValue, T incomingValue, boolean incomingWins) {
        if (incomingWins) {
            return incomingValue != null ? incomingValue : existingValue;
        }
        return existingValue != null ? existingValue : incomingValue;
    }
}
