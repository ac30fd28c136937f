package io.dazzleduck.sharing.common.error;

public class UnauthenticatedException extends SharingException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
