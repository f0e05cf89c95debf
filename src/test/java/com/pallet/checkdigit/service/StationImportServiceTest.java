package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.*;
import com.pallet.checkdigit.repository.StationRepository;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = false)
class StationImportServiceTest {

    @Inject
    StationImportService importService;

    @Inject
    StationRepository repository;

    @BeforeEach
    void cleanTable() {
        repository.deleteAll();
    }

    @Test
    void malformedRowIsSkippedAndTheRestImported() {
        List<ImportRow> rows = List.of(
                ImportRow.of(2, "58-15", "69"),
                ImportRow.of(3, "5816", "90"),
                ImportRow.of(4, "3-57-30-1", "45"),
                ImportRow.of(5, "40-01", "11"),
                ImportRow.of(6, "40-02", ""),
                ImportRow.of(7, "00-00", "00"));

        Outcome<ImportReport> outcome = importService.importRows(3, rows, false, ImportProgressListener.NONE);

        ImportReport report = outcome.value();
        assertEquals(6, report.totalRows());
        assertEquals(5, report.inserted());
        assertEquals(1, report.skipped());
        assertEquals(6, report.failures().get(0).rowNumber());
        assertEquals("Missing station or check digit", report.failures().get(0).reason());
        assertEquals(5, repository.count(3));
        assertEquals(Optional.of("90"), repository.findCheckDigit(3, "58-16"));
    }

    @Test
    void eachRejectedRowGetsAReason() {
        List<ImportRow> rows = List.of(
                ImportRow.of(2, "58-1", "69"),
                ImportRow.of(3, "58-15", "6x"),
                new ImportRow(4, 9, "58-16", "90", ""));

        ImportReport report = importService.importRows(3, rows, false, ImportProgressListener.NONE).value();

        assertEquals(0, report.inserted());
        assertEquals(3, report.skipped());
        assertTrue(report.failures().get(0).reason().startsWith("Invalid station"));
        assertTrue(report.failures().get(1).reason().startsWith("Invalid check digit"));
        assertEquals("Unknown building 9", report.failures().get(2).reason());
    }

    @Test
    void emptyBatchIsInvalid() {
        Outcome<ImportReport> outcome = importService.importRows(3, List.of(), false, ImportProgressListener.NONE);

        assertEquals(Outcome.Status.INVALID, outcome.status());
        assertEquals("No station rows found to import", outcome.message());
    }

    @Test
    void unknownDefaultBuildingIsInvalid() {
        Outcome<ImportReport> outcome = importService.importRows(7, List.of(ImportRow.of(2, "58-15", "69")),
                false, ImportProgressListener.NONE);

        assertEquals(Outcome.Status.INVALID, outcome.status());
    }

    @Test
    void progressIsReportedAfterEveryRow() {
        List<int[]> calls = new ArrayList<>();
        List<ImportRow> rows = List.of(
                ImportRow.of(2, "58-15", "69"),
                ImportRow.of(3, "bad", "1"),
                ImportRow.of(4, "58-16", "90"));

        importService.importRows(3, rows, false, (processed, total) -> calls.add(new int[]{processed, total}));

        assertEquals(3, calls.size());
        assertArrayEquals(new int[]{1, 3}, calls.get(0));
        assertArrayEquals(new int[]{3, 3}, calls.get(2));
    }

    @Test
    void reimportPreservesUsageUnlessReplacing() {
        importService.importRows(3, List.of(ImportRow.of(2, "58-15", "69")), false, ImportProgressListener.NONE);
        repository.incrementUsage(3, "58-15");

        importService.importRows(3, List.of(ImportRow.of(2, "58-15", "70")), false, ImportProgressListener.NONE);
        StationRecord kept = repository.find(3, "58-15").orElseThrow();
        assertEquals("70", kept.getCheckDigit());
        assertEquals(1, kept.getUsageCount());

        importService.importRows(3, List.of(ImportRow.of(2, "58-16", "90")), true, ImportProgressListener.NONE);
        assertFalse(repository.exists(3, "58-15"));
        assertEquals(0, repository.find(3, "58-16").orElseThrow().getUsageCount());
    }

    @Test
    void replaceOnlyWipesTouchedBuildings() {
        importService.importRows(2, List.of(ImportRow.of(2, "40-01", "11")), false, ImportProgressListener.NONE);
        importService.importRows(3, List.of(ImportRow.of(2, "58-15", "69")), false, ImportProgressListener.NONE);

        importService.importRows(3, List.of(ImportRow.of(2, "58-16", "90")), true, ImportProgressListener.NONE);

        assertTrue(repository.exists(2, "40-01"));
        assertFalse(repository.exists(3, "58-15"));
    }

    @Test
    void importsCsvText() {
        String csv = """
                building,station,check_digit,description
                3,58-15,69,
                3,58-16,90,
                4,40-01,22,
                3,57-30
                """;

        ImportReport report = importService.importCsv(new StringReader(csv), 3, false, ImportProgressListener.NONE).value();

        assertEquals(3, report.inserted());
        assertEquals(1, report.skipped());
        assertEquals(5, report.failures().get(0).rowNumber());
        assertEquals(Optional.of("22"), repository.findCheckDigit(4, "40-01"));
    }

    @Test
    void headerOnlyCsvIsInvalid() {
        Outcome<ImportReport> outcome = importService.importCsv(
                new StringReader("station,check_digit\n"), 3, false, ImportProgressListener.NONE);

        assertEquals(Outcome.Status.INVALID, outcome.status());
    }
}
