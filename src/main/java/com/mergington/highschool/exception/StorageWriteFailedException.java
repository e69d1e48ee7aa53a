package com.mergington.highschool.exception;

/**
 * Raised when the store acknowledges an update that modified nothing although
 * the preconditions said it should.
 */
public class StorageWriteFailedException extends RuntimeException {

    public StorageWriteFailedException(String message) {
        super(message);
    }
}
