package com.fbo.reconciliation.bulk;

import com.fbo.reconciliation.core.model.Amenity;
import com.fbo.reconciliation.core.model.FacilityRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

class CsvBaselineImporterTest {

    private static final Instant IMPORT_TIME = Instant.parse("2024-06-01T08:00:00Z");
    private static final String HEADER = "location_code,name,phone,radio_frequency,website,jet_a_price,avgas_price,"
            + "fuel_price_date,crew_car,crew_lounge,catering,maintenance,hangars,deice,oxygen,ground_power,"
            + "lavatory_service,handling_fee,overnight_fee,ramp_fee,ramp_fee_waived\n";

    private CsvBaselineImporter importer;

    @BeforeEach
    void setUp() {
        importer = new CsvBaselineImporter(Clock.fixed(IMPORT_TIME, ZoneOffset.UTC));
    }

    private ImportResult importCsv(String csv) {
        return importer.importBaseline(importer.readRows(new StringReader(csv)), 1);
    }

    private ImportResult importFixture() {
        Reader reader = new InputStreamReader(
                Objects.requireNonNull(getClass().getResourceAsStream("/fixtures/fbo_baseline.csv")),
                StandardCharsets.UTF_8);
        return importer.importBaseline(importer.readRows(reader), 3);
    }

    private static FacilityRecord byName(ImportResult result, String name) {
        return result.records().stream().filter(r -> r.getName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Should parse every column of a complete row")
    void testFullRow() {
        ImportResult result = importFixture();
        FacilityRecord record = byName(result, "Signature Aviation");

        assertEquals("KSFO", record.getLocationCode());
        assertEquals("650-555-0100", record.getPhone());
        assertEquals("122.95", record.getRadioFrequency());
        assertEquals("https://signature.example", record.getWebsite());
        assertEquals(6.50, record.getJetAPrice());
        assertEquals(7.10, record.getAvgasPrice());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), record.getFuelPriceDate());
        assertEquals(EnumSet.of(Amenity.CREW_CAR, Amenity.CREW_LOUNGE, Amenity.CATERING, Amenity.GROUND_POWER),
                record.getAmenities());
        assertEquals(new BigDecimal("150.00"), record.getHandlingFee());
        assertNull(record.getOvernightFee());
        assertEquals(new BigDecimal("50"), record.getRampFee());
        assertTrue(record.isRampFeeWaived());
    }

    @Test
    @DisplayName("Imported records should be verified and carry the import label")
    void testProvenance() {
        for (FacilityRecord record : importFixture().records()) {
            assertTrue(record.isVerified());
            assertTrue(record.isBulkImported());
            assertFalse(record.isPendingUpload());
            assertEquals(IMPORT_TIME, record.getLastUpdated());
            assertNull(record.getRemoteIdentifier());
        }
    }

    @Test
    @DisplayName("A price without a date should be stamped with the import time")
    void testPriceWithoutDate() {
        FacilityRecord record = byName(importFixture(), "Atlantic Aviation, SFO");

        assertEquals(6.35, record.getJetAPrice());
        assertEquals(IMPORT_TIME, record.getFuelPriceDate());
        assertEquals(FacilityRecord.BULK_IMPORT_LABEL, record.getFuelPriceReporter());
        assertEquals(new BigDecimal("75.00"), record.getOvernightFee());
    }

    @Test
    @DisplayName("Should skip malformed rows and keep going")
    void testSkipsMalformedRows() {
        ImportResult result = importFixture();

        assertEquals(3, result.datasetVersion());
        assertEquals(5, result.totalRows());
        assertEquals(4, result.importedCount());
        assertEquals(1, result.skippedRows());
        ImportResult.ImportError error = result.errors().get(0);
        assertEquals(6, error.lineNumber());
        assertEquals("Broken Row", error.inputName());
    }

    @Test
    @DisplayName("Should not deduplicate; that is left to the reconciler")
    void testNoDeduplication() {
        ImportResult result = importFixture();
        assertTrue(result.records().stream().anyMatch(r -> r.getName().equals("Signature FBO")));
        assertTrue(result.records().stream().anyMatch(r -> r.getName().equals("Signature Aviation")));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "KSFO,Bad Price,,,,abc,,,,,,,,,,,,,,,  | non-numeric price",
            "KSFO,Negative,,,,-1,,,,,,,,,,,,,,,    | invalid price",
            "KSFO,Bad Fee,,,,,,,,,,,,,,,,x,,,      | non-numeric fee",
            "KSFO,Bad Date,,,,6.0,,03/01/2024,,,,,,,,,,,,, | unparseable date",
            "KS,Short Code,,,,,,,,,,,,,,,,,,,      | invalid location code",
            "',,,,,,,,,,,,,,,,,,,,'                | missing location code or name"
    })
    @DisplayName("Should report why a row was skipped")
    void testErrorMessages(String row, String expectedMessage) {
        ImportResult result = importCsv(HEADER + row.trim() + "\n");

        assertEquals(0, result.importedCount());
        assertEquals(1, result.skippedRows());
        assertTrue(result.errors().get(0).message().contains(expectedMessage),
                () -> "unexpected message: " + result.errors().get(0).message());
    }

    @Test
    @DisplayName("Should accept ISO instants as fuel dates")
    void testInstantDate() {
        ImportResult result = importCsv(HEADER
                + "KSFO,Signature,,,,6.0,,2024-03-01T15:30:00Z,,,,,,,,,,,,,\n");

        assertEquals(Instant.parse("2024-03-01T15:30:00Z"), result.records().get(0).getFuelPriceDate());
    }

    @Test
    @DisplayName("Should handle quoted values with embedded quotes")
    void testQuotedValues() {
        ImportResult result = importCsv(HEADER
                + "KSFO,\"Bob \"\"The Fueler\"\" Jones\",,,,,,,,,,,,,,,,,,,\n");

        assertEquals("Bob \"The Fueler\" Jones", result.records().get(0).getName());
    }

    @Test
    @DisplayName("Should skip blank lines and tolerate an empty input")
    void testBlankLines() {
        assertEquals(0, importCsv("").totalRows());
        ImportResult result = importCsv(HEADER + "\n\nKSFO,Signature,,,,,,,,,,,,,,,,,,,\n\n");
        assertEquals(1, result.totalRows());
        assertEquals(1, result.importedCount());
    }

    @ParameterizedTest
    @CsvSource({"1, true", "yes, true", "TRUE, true", "Yes, true", "0, false", "no, false", "'', false", "y, false"})
    @DisplayName("Should parse boolean flags")
    void testBool(String token, boolean expected) {
        RawRow row = new RawRow(2, List.of(token));
        assertEquals(expected, CsvBaselineImporter.bool(row, 0));
    }

    @Test
    @DisplayName("Should report progress at the end of the import")
    void testProgress() {
        List<String> messages = new ArrayList<>();
        List<RawRow> rows = importer.readRows(new StringReader(HEADER + "KSFO,Signature,,,,,,,,,,,,,,,,,,,\n"));

        importer.importBaseline(rows, 1, (processed, total, message) -> messages.add(processed + "/" + total + " " + message));

        assertEquals(List.of("1/1 Import completed"), messages);
        assertEquals("csv", importer.getFormat());
    }
}
