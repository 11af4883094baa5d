package com.flagship.casino_ledger.common;

/**
 * Raised when a unit of work kept losing to concurrent writers after every
 * retry attempt. Safe to retry from the caller's side.
 */
public class StorageConflictException extends RuntimeException {

    public StorageConflictException(String operation, int attempts, Throwable cause) {
        super(String.format("Storage conflict in %s after %d attempts", operation, attempts), cause);
    }
}
