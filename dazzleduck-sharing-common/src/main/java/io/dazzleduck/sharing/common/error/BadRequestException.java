package io.dazzleduck.sharing.common.error;

/**
 * Malformed parameter such as a page token, version or timestamp.
 */
public class BadRequestException extends SharingException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
