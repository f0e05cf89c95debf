package com.pallet.checkdigit.repository;

/**
 * Thrown by {@link StationRepository} when the underlying database call fails.
 * Carries the failing operation name so callers can report which step broke.
 */
public class StationStorageException extends RuntimeException {

    private final String operation;

    public StationStorageException(String operation, Throwable cause) {
        super("DB error in " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
