package com.pallet.checkdigit.service;

/**
 * Receives bulk import progress after every processed row.
 */
@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NONE = (processed, total) -> { };

    /**
     * @param processed rows handled so far, successful or not
     * @param total     rows in the batch
     */
    void onProgress(int processed, int total);
}
