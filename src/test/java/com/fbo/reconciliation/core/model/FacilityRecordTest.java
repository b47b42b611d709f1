package com.fbo.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FacilityRecordTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    @DisplayName("Should uppercase and trim the location code")
    void testLocationCodeNormalized() {
        FacilityRecord record = FacilityRecord.builder().locationCode(" ksfo ").name("Signature").build();
        assertEquals("KSFO", record.getLocationCode());
    }

    @Test
    @DisplayName("Should require location code and name")
    void testRequiredFields() {
        assertThrows(NullPointerException.class, () -> FacilityRecord.builder().name("X").build());
        assertThrows(NullPointerException.class, () -> FacilityRecord.builder().locationCode("KSFO").build());
    }

    @Test
    @DisplayName("Should accept only 3 or 4 character location codes")
    void testLocationCodeLength() {
        assertEquals("SFO", FacilityRecord.builder().locationCode("sfo").name("Signature").build().getLocationCode());
        assertThrows(IllegalArgumentException.class,
                () -> FacilityRecord.builder().locationCode("KS").name("Signature").build());
        assertThrows(IllegalArgumentException.class,
                () -> FacilityRecord.builder().locationCode("KSFOX").name("Signature").build());
        assertThrows(IllegalArgumentException.class,
                () -> FacilityRecord.builder().locationCode("   ").name("Signature").build());
    }

    @Test
    @DisplayName("Should drop prices that have no timestamp")
    void testPriceWithoutDateDropped() {
        FacilityRecord record = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature")
                .jetAPrice(6.5)
                .fuelPriceReporter("pilot")
                .build();

        assertFalse(record.hasFuelPrice());
        assertNull(record.getJetAPrice());
        assertNull(record.getFuelPriceReporter());
    }

    @Test
    @DisplayName("Should drop a timestamp that has no price")
    void testDateWithoutPriceDropped() {
        FacilityRecord record = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature")
                .fuelPriceDate(T0)
                .fuelPriceReporter("pilot")
                .build();

        assertNull(record.getFuelPriceDate());
        assertNull(record.getFuelPriceReporter());
    }

    @Test
    @DisplayName("Should keep the fuel unit when price and date are both present")
    void testFuelUnitKept() {
        FacilityRecord record = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature")
                .fuelPrice(null, 7.1, T0, "pilot")
                .build();

        assertTrue(record.hasFuelPrice());
        assertEquals(7.1, record.getAvgasPrice());
        assertEquals(T0, record.getFuelPriceDate());
        assertEquals("pilot", record.getFuelPriceReporter());
    }

    @Test
    @DisplayName("Ramp fee waiver requires a ramp fee")
    void testWaiverRequiresRampFee() {
        FacilityRecord noFee = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature").rampFeeWaived(true).build();
        FacilityRecord withFee = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature")
                .rampFee(new BigDecimal("50")).rampFeeWaived(true).build();

        assertFalse(noFee.isRampFeeWaived());
        assertTrue(withFee.isRampFeeWaived());
    }

    @Test
    @DisplayName("Should default lastUpdated to the epoch")
    void testDefaultLastUpdated() {
        FacilityRecord record = FacilityRecord.builder().locationCode("KSFO").name("Signature").build();
        assertEquals(Instant.EPOCH, record.getLastUpdated());
    }

    @Test
    @DisplayName("Copy builder should produce an equal record")
    void testCopyBuilder() {
        FacilityRecord original = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature")
                .phone("650-555-0100")
                .fuelPrice(6.5, null, T0, "CSV Import")
                .amenities(List.of(Amenity.CREW_CAR, Amenity.OXYGEN))
                .rampFee(new BigDecimal("25.00"))
                .lastUpdated(T0)
                .updatedBy("pilot")
                .remoteIdentifier("r-1")
                .verified(true)
                .build();

        FacilityRecord copy = FacilityRecord.builder(original).build();

        assertEquals(original, copy);
        assertEquals(original.hashCode(), copy.hashCode());
    }

    @Test
    @DisplayName("Amenity set should be immutable")
    void testAmenitiesImmutable() {
        FacilityRecord record = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature").amenity(Amenity.CATERING).build();
        assertThrows(UnsupportedOperationException.class, () -> record.getAmenities().add(Amenity.DEICE));
    }

    @Test
    @DisplayName("Should render confirmed amenities in declaration order")
    void testAmenitiesSummary() {
        FacilityRecord record = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature")
                .amenity(Amenity.CREW_LOUNGE)
                .amenity(Amenity.CREW_CAR)
                .build();
        assertEquals("Crew Car • Lounge", record.amenitiesSummary());
    }

    @Test
    @DisplayName("Should recognise the bulk import label")
    void testIsBulkImported() {
        FacilityRecord imported = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature").updatedBy(FacilityRecord.BULK_IMPORT_LABEL).build();
        FacilityRecord edited = FacilityRecord.builder()
                .locationCode("KSFO").name("Signature").updatedBy("pilot").build();

        assertTrue(imported.isBulkImported());
        assertFalse(edited.isBulkImported());
    }
}
