package io.dazzleduck.sharing.common.error;

/**
 * Recipient lacks a grant for the entity.
 */
public class PermissionDeniedException extends SharingException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
