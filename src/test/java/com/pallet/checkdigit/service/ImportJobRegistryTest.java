package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.ImportJobStatus;
import com.pallet.checkdigit.model.ImportReport;
import com.pallet.checkdigit.model.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ImportJobRegistryTest {

    private StationImportService importService;
    private ExecutorService executor;
    private ImportJobRegistry registry;

    @BeforeEach
    void setUp() {
        importService = mock(StationImportService.class);
        executor = Executors.newSingleThreadExecutor();
        registry = new ImportJobRegistry(importService, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void jobReportsProgressAndFinalReport() throws InterruptedException {
        when(importService.importCsv(any(Reader.class), eq(3), eq(false), any())).thenAnswer(inv -> {
            ImportProgressListener listener = inv.getArgument(3);
            listener.onProgress(1, 2);
            listener.onProgress(2, 2);
            return Outcome.ok(new ImportReport(2, 2, 0, List.of()));
        });

        ImportJob job = registry.submit("station,check_digit\n58-15,69\n58-16,90\n", 3, false);
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        ImportJobStatus status = registry.find(job.getId()).orElseThrow().toStatus();
        assertEquals("DONE", status.state());
        assertEquals(2, status.processed());
        assertEquals(2, status.total());
        assertEquals(2, status.report().inserted());
    }

    @Test
    void failedImportMarksJobFailed() throws InterruptedException {
        when(importService.importCsv(any(Reader.class), anyInt(), anyBoolean(), any()))
                .thenReturn(Outcome.invalid("No station rows found to import"));

        ImportJob job = registry.submit("", 3, false);
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(ImportJob.State.FAILED, job.getState());
        assertEquals("No station rows found to import", job.toStatus().message());
        assertNull(job.getReport());
    }

    @Test
    void unknownJobIsEmpty() {
        assertTrue(registry.find("missing").isEmpty());
    }

    @Test
    void finishedJobsBeyondLimitArePruned() throws InterruptedException {
        when(importService.importCsv(any(Reader.class), anyInt(), anyBoolean(), any()))
                .thenReturn(Outcome.ok(new ImportReport(1, 1, 0, List.of())));
        registry.maxRetainedJobs = 2;

        ImportJob first = registry.submit("x", 3, false);
        waitFor(first);
        ImportJob second = registry.submit("x", 3, false);
        waitFor(second);
        ImportJob third = registry.submit("x", 3, false);

        assertTrue(registry.find(first.getId()).isEmpty());
        assertTrue(registry.find(second.getId()).isPresent());
        assertTrue(registry.find(third.getId()).isPresent());
    }

    private static void waitFor(ImportJob job) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!job.isFinished() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(job.isFinished());
    }
}
