package io.dazzleduck.sharing.table.log;

import io.dazzleduck.sharing.common.error.InternalException;

public class TransientLogException extends InternalException {

    public TransientLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
