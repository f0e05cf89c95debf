package com.pallet.checkdigit.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.pallet.checkdigit.model.ImportRow;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads station check digits from delimited text.
 *
 * The first row is always a header and is skipped. Data rows are either
 * {@code building, station, checkDigit[, description]} or
 * {@code station, checkDigit[, description]}. The layout is taken from the header when its
 * first column names a building ({@code building...}) or a station ({@code station...},
 * {@code key...}); otherwise each row is inspected on its own: three or more fields with a
 * one- or two-digit first field mean a building column.
 *
 * Rows with too few fields are still returned (with blank values) so that the importer can
 * report them as skipped with their row number.
 */
@Singleton
public class StationCsvReader {

    private static final Logger log = LoggerFactory.getLogger(StationCsvReader.class);

    private static final Pattern BUILDING_VALUE = Pattern.compile("[0-9]{1,2}");

    enum Layout { WITH_BUILDING, WITHOUT_BUILDING, PER_ROW }

    private final CsvMapper csvMapper;

    public StationCsvReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Parses every data row of the source.
     *
     * @param reader delimited text, header first
     * @return data rows in source order (empty if the source only has a header or nothing)
     * @throws IOException if the text is not readable as CSV
     */
    public List<ImportRow> read(Reader reader) throws IOException {
        List<String[]> lines;
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(reader)) {
            lines = it.readAll();
        }

        List<ImportRow> rows = new ArrayList<>();
        if (lines.isEmpty()) {
            return rows;
        }

        Layout layout = detectLayout(lines.get(0));
        log.debug("CSV header={} layout={} dataRows={}", String.join(",", lines.get(0)), layout, lines.size() - 1);

        for (int i = 1; i < lines.size(); i++) {
            rows.add(toRow(i + 1, lines.get(i), layout));
        }
        return rows;
    }

    Layout detectLayout(String[] header) {
        if (header.length == 0) {
            return Layout.PER_ROW;
        }
        String first = header[0] == null ? "" : header[0].trim().toLowerCase(Locale.ROOT);
        if (first.startsWith("building")) {
            return Layout.WITH_BUILDING;
        }
        if (first.startsWith("station") || first.startsWith("key")) {
            return Layout.WITHOUT_BUILDING;
        }
        return Layout.PER_ROW;
    }

    private ImportRow toRow(int rowNumber, String[] fields, Layout layout) {
        boolean hasBuilding = switch (layout) {
            case WITH_BUILDING -> true;
            case WITHOUT_BUILDING -> false;
            case PER_ROW -> fields.length >= 3 && BUILDING_VALUE.matcher(field(fields, 0)).matches();
        };

        int offset = hasBuilding ? 1 : 0;
        Integer buildingId = hasBuilding ? parseBuilding(field(fields, 0), rowNumber) : null;
        return new ImportRow(rowNumber,
                buildingId,
                field(fields, offset),
                field(fields, offset + 1),
                field(fields, offset + 2));
    }

    private static Integer parseBuilding(String value, int rowNumber) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Row {} has unparseable building '{}', using default building", rowNumber, value);
            return null;
        }
    }

    private static String field(String[] fields, int index) {
        if (index >= fields.length || fields[index] == null) {
            return "";
        }
        return fields[index].trim();
    }
}
