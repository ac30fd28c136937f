package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.catalog.acl.AccessControl;
import io.dazzleduck.sharing.common.ShareReader;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.error.SharingException;
import io.dazzleduck.sharing.common.model.Pagination;
import io.dazzleduck.sharing.http.SharingRecorder;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.helidon.webserver.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractSharingService implements Service {

    protected static final Logger logger = LoggerFactory.getLogger(AbstractSharingService.class);

    public static final String MAX_RESULTS_PARAM = "maxResults";
    public static final String PAGE_TOKEN_PARAM = "pageToken";

    protected final AccessControl accessControl;
    protected final SharingRecorder recorder;

    protected AbstractSharingService(AccessControl accessControl, SharingRecorder recorder) {
        this.accessControl = accessControl;
        this.recorder = recorder;
    }

    @FunctionalInterface
    protected interface Operation {
        void run(ShareReader reader) throws Exception;
    }

    /**
     * Runs {@code operation} for the caller and turns any failure into the protocol error body.
     */
    protected void handle(String name, ServerRequest request, ServerResponse response, Operation operation) {
        recorder.recordRequest(name);
        try {
            var recipient = request.context().get(RecipientFilter.RECIPIENT_KEY, RecipientId.class)
                    .orElseThrow(() -> new UnauthorizedException("no recipient identity"));
            logger.debug("{} {} for {}", name, request.path(), recipient);
            operation.run(accessControl.readerFor(recipient));
        } catch (HttpException e) {
            sendError(name, response, e);
        } catch (SharingException e) {
            sendError(name, response, HttpErrors.from(e));
        } catch (Exception e) {
            sendError(name, response, new InternalErrorException(e));
        }
    }

    protected void sendError(String name, ServerResponse response, HttpException e) {
        if (e instanceof InternalErrorException) {
            logger.atError().setCause(e.getCause()).log("{} failed", name);
        }
        recorder.recordError(name, e.status);
        response.status(e.status);
        response.headers().add("Content-Type", ProtocolResponses.JSON_CONTENT_TYPE);
        response.send(ProtocolResponses.error(e));
    }

    protected static void sendJson(ServerResponse response, String body) {
        response.status(200);
        response.headers().add("Content-Type", ProtocolResponses.JSON_CONTENT_TYPE);
        response.send(body);
    }

    protected static Pagination pagination(ServerRequest request) {
        return new Pagination(ParameterUtils.getParameterValue(MAX_RESULTS_PARAM, request, null, Integer.class),
                ParameterUtils.getParameterValue(PAGE_TOKEN_PARAM, request, null, String.class));
    }
}
