package com.bko.glucosesync.integrations.sheets;

import java.io.IOException;
import java.util.List;

/**
 * Row-level access to the configured spreadsheet. Ranges use A1 notation.
 */
public interface SpreadsheetPort {
    List<List<Object>> readRows(String range) throws IOException;

    void appendRows(String range, List<List<Object>> rows) throws IOException;

    /**
     * Clears everything below the header row of {@code sheetName} and writes {@code rows} in its place.
     */
    void rewriteRows(String sheetName, List<List<Object>> rows) throws IOException;

    /**
     * Writes {@code headers} to row 1 unless it already holds them (compared case-insensitively).
     */
    void writeHeaderRow(String sheetName, List<Object> headers) throws IOException;

    void addSheetIfMissing(String sheetName) throws IOException;
}
