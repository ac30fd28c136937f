package io.dazzleduck.sharing.common.error;

/**
 * Referenced share, schema, table or table version does not exist.
 */
public class NotFoundException extends SharingException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
