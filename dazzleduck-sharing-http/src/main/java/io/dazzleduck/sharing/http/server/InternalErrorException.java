package io.dazzleduck.sharing.http.server;

public class InternalErrorException extends HttpException {
    public static final String MESSAGE = "Internal server error";

    public InternalErrorException(Throwable cause) {
        super(500, "INTERNAL_ERROR", MESSAGE, cause);
    }
}
