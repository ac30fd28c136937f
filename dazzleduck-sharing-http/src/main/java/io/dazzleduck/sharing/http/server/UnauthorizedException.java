package io.dazzleduck.sharing.http.server;

public class UnauthorizedException extends HttpException {
    public UnauthorizedException(String msg) {
        super(401, "UNAUTHENTICATED", msg);
    }
}
