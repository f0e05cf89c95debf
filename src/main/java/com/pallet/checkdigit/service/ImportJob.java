package com.pallet.checkdigit.service;

import com.pallet.checkdigit.model.ImportJobStatus;
import com.pallet.checkdigit.model.ImportReport;
import com.pallet.checkdigit.model.Outcome;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A bulk import running in the background. Progress fields are written by the worker
 * thread and read by pollers.
 */
public class ImportJob implements ImportProgressListener {

    public enum State { RUNNING, DONE, FAILED }

    private final String id;
    private final Instant submittedAt;
    private final AtomicInteger processed = new AtomicInteger();

    private volatile int total;
    private volatile State state = State.RUNNING;
    private volatile String message;
    private volatile ImportReport report;

    ImportJob(String id, Instant submittedAt) {
        this.id = id;
        this.submittedAt = submittedAt;
    }

    @Override
    public void onProgress(int processedRows, int totalRows) {
        this.total = totalRows;
        this.processed.set(processedRows);
    }

    void complete(Outcome<ImportReport> outcome) {
        if (outcome.isOk()) {
            this.report = outcome.value();
            this.total = report.totalRows();
            this.processed.set(report.totalRows());
            this.message = "Imported " + report.inserted() + " of " + report.totalRows() + " rows";
            this.state = State.DONE;
        } else {
            this.message = outcome.message();
            this.state = State.FAILED;
        }
    }

    public String getId() {
        return id;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public State getState() {
        return state;
    }

    public boolean isFinished() {
        return state != State.RUNNING;
    }

    public int getProcessed() {
        return processed.get();
    }

    public int getTotal() {
        return total;
    }

    public ImportReport getReport() {
        return report;
    }

    public ImportJobStatus toStatus() {
        return new ImportJobStatus(id, state.name(), processed.get(), total, message, report);
    }
}
