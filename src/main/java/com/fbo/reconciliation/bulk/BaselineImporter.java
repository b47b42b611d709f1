package com.fbo.reconciliation.bulk;

import java.io.Reader;
import java.util.List;

/**
 * Parses the bundled facility dataset into verified baseline records.
 * Implementations never write to the local store; {@link BaselineLoader} does that through the
 * reconciler so existing user edits survive a dataset refresh.
 */
public interface BaselineImporter {

    /**
     * Splits the dataset into raw rows. The header line is not returned.
     *
     * @throws java.io.UncheckedIOException if the source cannot be read
     */
    List<RawRow> readRows(Reader reader);

    /**
     * Converts raw rows into records. Malformed or incomplete rows are skipped and reported in
     * {@link ImportResult#errors()}; the import itself always completes.
     *
     * @param rows           the rows to convert
     * @param datasetVersion the version of the dataset the rows came from
     * @param callback       optional progress callback
     */
    ImportResult importBaseline(List<RawRow> rows, int datasetVersion, ProgressCallback callback);

    default ImportResult importBaseline(List<RawRow> rows, int datasetVersion) {
        return importBaseline(rows, datasetVersion, null);
    }

    /**
     * Returns the format supported by this importer (e.g., "csv").
     */
    String getFormat();
}
