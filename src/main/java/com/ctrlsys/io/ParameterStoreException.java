package com.ctrlsys.io;

/**
 * Reading, merging or writing persisted parameters failed.
 */
public final class ParameterStoreException extends RuntimeException {

    public ParameterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
