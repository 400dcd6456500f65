package com.identity.resolution.export;

/**
 * Result of an export operation.
 *
 * @param format       the format written, e.g. "csv" or "jsonl"
 * @param totalRecords number of data rows written
 */
public record ExportResult(String format, long totalRecords) {

    @Override
    public String toString() {
        return "ExportResult{format=" + format + ", records=" + totalRecords + '}';
    }
}
