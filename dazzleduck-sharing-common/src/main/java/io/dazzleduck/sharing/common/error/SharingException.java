package io.dazzleduck.sharing.common.error;

/**
 * Root of the errors raised by catalogs, the access-control layer and the table resolution engine.
 */
public abstract class SharingException extends RuntimeException {

    protected SharingException(String message) {
        super(message);
    }

    protected SharingException(String message, Throwable cause) {
        super(message, cause);
    }
}
