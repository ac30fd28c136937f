package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.error.PermissionDeniedException;
import io.dazzleduck.sharing.common.error.SharingException;
import io.dazzleduck.sharing.common.error.UnauthenticatedException;

public final class HttpErrors {

    private HttpErrors() {
    }

    public static HttpException from(SharingException e) {
        if (e instanceof UnauthenticatedException) {
            return new UnauthorizedException(e.getMessage());
        }
        if (e instanceof NotFoundException || e instanceof PermissionDeniedException) {
            return new ResourceNotFoundException();
        }
        if (e instanceof BadRequestException) {
            return new InvalidParameterException(e.getMessage());
        }
        return new InternalErrorException(e);
    }
}
