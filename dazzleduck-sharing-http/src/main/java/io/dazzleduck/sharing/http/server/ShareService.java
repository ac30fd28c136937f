package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.catalog.acl.AccessControl;
import io.dazzleduck.sharing.http.SharingRecorder;
import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;

/**
 * Share, schema and table listings.
 */
public class ShareService extends AbstractSharingService {

    public ShareService(AccessControl accessControl, SharingRecorder recorder) {
        super(accessControl, recorder);
    }

    @Override
    public void update(Routing.Rules rules) {
        rules.get("/", this::listShares)
                .get("/{share}", this::getShare)
                .get("/{share}/schemas", this::listSchemas)
                .get("/{share}/schemas/{schema}/tables", this::listTables)
                .get("/{share}/all-tables", this::listAllTables);
    }

    private void listShares(ServerRequest request, ServerResponse response) {
        handle("list_shares", request, response, reader ->
                sendJson(response, ProtocolResponses.shares(reader.listShares(pagination(request)))));
    }

    private void getShare(ServerRequest request, ServerResponse response) {
        var share = request.path().param("share");
        handle("get_share", request, response, reader ->
                sendJson(response, ProtocolResponses.getShare(reader.getShare(share))));
    }

    private void listSchemas(ServerRequest request, ServerResponse response) {
        var share = request.path().param("share");
        handle("list_schemas", request, response, reader ->
                sendJson(response, ProtocolResponses.schemas(reader.listSchemas(share, pagination(request)))));
    }

    private void listTables(ServerRequest request, ServerResponse response) {
        var share = request.path().param("share");
        var schema = request.path().param("schema");
        handle("list_tables", request, response, reader ->
                sendJson(response, ProtocolResponses.tables(reader.listTables(share, schema, pagination(request)))));
    }

    private void listAllTables(ServerRequest request, ServerResponse response) {
        var share = request.path().param("share");
        handle("list_all_tables", request, response, reader ->
                sendJson(response, ProtocolResponses.tables(reader.listAllTables(share, pagination(request)))));
    }
}
