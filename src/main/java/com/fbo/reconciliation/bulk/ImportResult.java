package com.fbo.reconciliation.bulk;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;

/**
 * Result of parsing a bundled dataset.
 *
 * @param datasetVersion the version the rows were imported as
 * @param totalRows      number of data rows seen (header excluded)
 * @param records        parsed records, all verified and import-labelled
 * @param errors         one entry per skipped row
 */
public record ImportResult(
        int datasetVersion,
        long totalRows,
        List<FacilityRecord> records,
        List<ImportError> errors
) {
    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long importedCount() {
        return records.size();
    }

    public long skippedRows() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that was skipped.
     *
     * @param lineNumber the line number in the input (1-based)
     * @param inputName  the facility name on that row, if any
     * @param message    why the row was skipped
     */
    public record ImportError(long lineNumber, String inputName, String message) {}

    @Override
    public String toString() {
        return "ImportResult{version=" + datasetVersion +
                ", total=" + totalRows +
                ", imported=" + records.size() +
                ", skipped=" + errors.size() + '}';
    }
}
