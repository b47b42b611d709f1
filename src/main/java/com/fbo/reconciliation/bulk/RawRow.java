package com.fbo.reconciliation.bulk;

import java.util.List;

/**
 * One unparsed row of the bundled dataset.
 *
 * @param lineNumber 1-based line number in the source file
 * @param fields     the column values, unquoted but not yet trimmed or converted
 */
public record RawRow(long lineNumber, List<String> fields) {

    public RawRow {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public int fieldCount() {
        return fields.size();
    }

    public String field(int index) {
        return index < fields.size() ? fields.get(index) : "";
    }
}
