package io.dazzleduck.sharing.http.server;

public class InvalidParameterException extends HttpException {
    public InvalidParameterException(String msg) {
        super(400, "INVALID_PARAMETER_VALUE", msg);
    }
}
