package com.fbo.reconciliation.bulk;

import com.fbo.reconciliation.core.model.Amenity;
import com.fbo.reconciliation.core.model.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * CSV importer for the bundled FBO dataset.
 *
 * <p>Expected format, one header line then one facility per line:</p>
 * <pre>
 * location_code,name,phone,radio_frequency,website,jet_a_price,avgas_price,fuel_price_date,
 * crew_car,crew_lounge,catering,maintenance,hangars,deice,oxygen,ground_power,lavatory_service,
 * handling_fee,overnight_fee,ramp_fee,ramp_fee_waived
 * KSFO,Signature Aviation,650-555-0100,122.95,,6.50,,2024-03-01,yes,1,...
 * </pre>
 *
 * <p>Fields may be double-quoted; a doubled quote inside a quoted field is a literal quote.
 * Boolean columns accept {@code 1}, {@code yes} and {@code true} (any case) as true. A price
 * without a date is stamped with the import time.</p>
 */
public class CsvBaselineImporter implements BaselineImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvBaselineImporter.class);
    private static final int PROGRESS_INTERVAL = 500;

    static final int COLUMN_COUNT = 21;

    private static final int LOCATION_CODE = 0;
    private static final int NAME = 1;
    private static final int PHONE = 2;
    private static final int RADIO_FREQUENCY = 3;
    private static final int WEBSITE = 4;
    private static final int JET_A_PRICE = 5;
    private static final int AVGAS_PRICE = 6;
    private static final int FUEL_PRICE_DATE = 7;
    private static final int FIRST_AMENITY = 8;
    private static final int HANDLING_FEE = 17;
    private static final int OVERNIGHT_FEE = 18;
    private static final int RAMP_FEE = 19;
    private static final int RAMP_FEE_WAIVED = 20;

    // Column order of the nine amenity flags, starting at FIRST_AMENITY
    private static final Amenity[] AMENITY_COLUMNS = {
            Amenity.CREW_CAR,
            Amenity.CREW_LOUNGE,
            Amenity.CATERING,
            Amenity.MAINTENANCE,
            Amenity.HANGARS,
            Amenity.DEICE,
            Amenity.OXYGEN,
            Amenity.GROUND_POWER,
            Amenity.LAVATORY_SERVICE
    };

    private static final Set<String> TRUE_TOKENS = Set.of("1", "yes", "true");

    private final Clock clock;

    public CsvBaselineImporter() {
        this(Clock.systemUTC());
    }

    public CsvBaselineImporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<RawRow> readRows(Reader reader) {
        List<RawRow> rows = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                return rows;
            }
            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                rows.add(new RawRow(lineNumber, splitLine(line)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset", e);
        }
        return rows;
    }

    @Override
    public ImportResult importBaseline(List<RawRow> rows, int datasetVersion, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Instant importedAt = clock.instant();
        List<FacilityRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();

        long processed = 0;
        for (RawRow row : rows) {
            processed++;
            String name = row.field(NAME).trim();
            try {
                records.add(parseRow(row, importedAt));
            } catch (MalformedRowException e) {
                errors.add(new ImportResult.ImportError(row.lineNumber(), name, e.getMessage()));
                log.debug("import.row.skipped line={} name='{}' reason={}", row.lineNumber(), name, e.getMessage());
            }
            if (processed % PROGRESS_INTERVAL == 0) {
                cb.onProgress(processed, rows.size(), "Processed " + processed + " rows");
            }
        }

        ImportResult result = new ImportResult(datasetVersion, rows.size(), records, errors);
        cb.onProgress(processed, rows.size(), "Import completed");
        if (result.hasErrors()) {
            log.info("import.parsed result={} (skipped rows are not fatal)", result);
        } else {
            log.info("import.parsed result={}", result);
        }
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private FacilityRecord parseRow(RawRow row, Instant importedAt) {
        if (row.fieldCount() != COLUMN_COUNT) {
            throw new MalformedRowException("expected " + COLUMN_COUNT + " fields but found " + row.fieldCount());
        }
        String locationCode = text(row, LOCATION_CODE);
        String name = text(row, NAME);
        if (locationCode == null || name == null) {
            throw new MalformedRowException("missing location code or name");
        }
        if (!FacilityRecord.isValidLocationCode(locationCode)) {
            throw new MalformedRowException("invalid location code '" + locationCode + "'");
        }

        Double jetA = price(row, JET_A_PRICE);
        Double avgas = price(row, AVGAS_PRICE);
        Instant priceDate = date(row, FUEL_PRICE_DATE);
        if (priceDate == null && (jetA != null || avgas != null)) {
            priceDate = importedAt;
        }

        FacilityRecord.Builder builder = FacilityRecord.builder()
                .locationCode(locationCode)
                .name(name)
                .phone(text(row, PHONE))
                .radioFrequency(text(row, RADIO_FREQUENCY))
                .website(text(row, WEBSITE))
                .fuelPrice(jetA, avgas, priceDate, FacilityRecord.BULK_IMPORT_LABEL)
                .handlingFee(fee(row, HANDLING_FEE))
                .overnightFee(fee(row, OVERNIGHT_FEE))
                .rampFee(fee(row, RAMP_FEE))
                .rampFeeWaived(bool(row, RAMP_FEE_WAIVED))
                .lastUpdated(importedAt)
                .updatedBy(FacilityRecord.BULK_IMPORT_LABEL)
                .verified(true);

        for (int i = 0; i < AMENITY_COLUMNS.length; i++) {
            builder.amenity(AMENITY_COLUMNS[i], bool(row, FIRST_AMENITY + i));
        }
        return builder.build();
    }

    private static String text(RawRow row, int index) {
        String value = row.field(index).trim();
        return value.isEmpty() ? null : value;
    }

    private static Double price(RawRow row, int index) {
        String value = text(row, index);
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (parsed < 0 || Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new MalformedRowException("invalid price '" + value + "'");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedRowException("non-numeric price '" + value + "'");
        }
    }

    private static BigDecimal fee(RawRow row, int index) {
        String value = text(row, index);
        if (value == null) {
            return null;
        }
        try {
            BigDecimal parsed = new BigDecimal(value);
            if (parsed.signum() < 0) {
                throw new MalformedRowException("negative fee '" + value + "'");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedRowException("non-numeric fee '" + value + "'");
        }
    }

    private static Instant date(RawRow row, int index) {
        String value = text(row, index);
        if (value == null) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new MalformedRowException("unparseable date '" + value + "'");
        }
    }

    static boolean bool(RawRow row, int index) {
        return TRUE_TOKENS.contains(row.field(index).trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Splits one CSV line, handling quoted values and doubled quotes.
     */
    static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static class MalformedRowException extends RuntimeException {
        MalformedRowException(String message) {
            super(message);
        }
    }
}
