package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.ImportReport;
import com.pallet.checkdigit.model.ImportRow;
import com.pallet.checkdigit.repository.StationRepository;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = false)
class StationSeedLoaderTest {

    @Inject
    StationSeedLoader seedLoader;

    @Inject
    StationImportService importService;

    @Inject
    StationRepository repository;

    @BeforeEach
    void cleanTable() {
        repository.deleteAll();
    }

    @Test
    void seedsBundledStationsIntoEmptyTable() {
        ImportReport report = seedLoader.seedIfEmpty().orElseThrow();

        assertEquals(0, report.skipped());
        assertEquals(report.inserted(), repository.countAll());
        assertEquals(Optional.of("69"), repository.findCheckDigit(3, "58-15"));
    }

    @Test
    void existingStationsAreNeverOverwritten() {
        importService.importRows(3, List.of(ImportRow.of(2, "58-15", "01")), false, ImportProgressListener.NONE);

        assertTrue(seedLoader.seedIfEmpty().isEmpty());
        assertEquals(Optional.of("01"), repository.findCheckDigit(3, "58-15"));
        assertEquals(1, repository.countAll());
    }
}
