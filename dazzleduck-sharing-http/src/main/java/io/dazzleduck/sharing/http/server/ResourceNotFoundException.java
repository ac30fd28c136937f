package io.dazzleduck.sharing.http.server;

/**
 * Missing resources and resources the recipient may not see share this response, so that the two
 * cannot be told apart.
 */
public class ResourceNotFoundException extends HttpException {
    public static final String MESSAGE = "The requested resource does not exist or you do not have access to it";

    public ResourceNotFoundException() {
        super(404, "RESOURCE_DOES_NOT_EXIST", MESSAGE);
    }
}
