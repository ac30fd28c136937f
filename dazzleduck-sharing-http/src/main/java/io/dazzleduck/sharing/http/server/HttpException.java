package io.dazzleduck.sharing.http.server;

/**
 * An error response: HTTP status plus the protocol error code written in the body.
 */
abstract public class HttpException extends RuntimeException {
    public final int status;
    public final String errorCode;

    public HttpException(int status, String errorCode, String msg) {
        super(msg);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpException(int status, String errorCode, String msg, Throwable cause) {
        super(msg, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
