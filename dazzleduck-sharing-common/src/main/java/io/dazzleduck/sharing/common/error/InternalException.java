package io.dazzleduck.sharing.common.error;

public class InternalException extends SharingException {

    public InternalException(String message) {
        super(message);
    }

    public InternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
