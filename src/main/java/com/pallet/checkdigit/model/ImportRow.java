package com.pallet.checkdigit.model;

/**
 * One data row of a bulk import, after column layout has been resolved.
 *
 * @param rowNumber   1-based source row number (header is row 1 for CSV sources)
 * @param buildingId  building column value, or null when the source has no building column
 * @param stationText station key exactly as written in the source
 * @param checkDigit  check digit text, may be blank for malformed rows
 * @param description optional description
 */
public record ImportRow(int rowNumber, Integer buildingId, String stationText, String checkDigit, String description) {

    public static ImportRow of(int rowNumber, String stationText, String checkDigit) {
        return new ImportRow(rowNumber, null, stationText, checkDigit, null);
    }
}
