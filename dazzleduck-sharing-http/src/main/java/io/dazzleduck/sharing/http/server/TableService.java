package io.dazzleduck.sharing.http.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dazzleduck.sharing.catalog.acl.AccessControl;
import io.dazzleduck.sharing.common.model.TableRef;
import io.dazzleduck.sharing.common.table.FileQuery;
import io.dazzleduck.sharing.common.table.VersionSpec;
import io.dazzleduck.sharing.http.SharingRecorder;
import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;

/**
 * Table version, metadata and data queries.
 */
public class TableService extends AbstractSharingService {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String TABLE_PATH = "/{share}/schemas/{schema}/tables/{table}";

    public TableService(AccessControl accessControl, SharingRecorder recorder) {
        super(accessControl, recorder);
    }

    @Override
    public void update(Routing.Rules rules) {
        rules.get(TABLE_PATH + "/version", this::version)
                .get(TABLE_PATH + "/metadata", this::metadata)
                .post(TABLE_PATH + "/query", this::query);
    }

    private static TableRef tableRef(ServerRequest request) {
        return new TableRef(request.path().param("share"), request.path().param("schema"), request.path().param("table"));
    }

    private void version(ServerRequest request, ServerResponse response) {
        var table = tableRef(request);
        handle("get_table_version", request, response, reader -> {
            var startingTimestamp = ParameterUtils.getParameterValue("startingTimestamp", request, null, String.class);
            var version = reader.getTableVersion(table, VersionSpec.of(null, startingTimestamp));
            response.status(200);
            response.headers().add(ProtocolResponses.TABLE_VERSION_HEADER, Long.toString(version));
            response.send();
        });
    }

    private void metadata(ServerRequest request, ServerResponse response) {
        var table = tableRef(request);
        handle("get_table_metadata", request, response, reader -> {
            var version = VersionSpec.of(ParameterUtils.getParameterValue("version", request, null, Long.class),
                    ParameterUtils.getParameterValue("timestamp", request, null, String.class));
            var metadata = reader.getTableMetadata(table, version);
            response.status(200);
            response.headers().add("Content-Type", ProtocolResponses.NDJSON_CONTENT_TYPE);
            response.headers().add(ProtocolResponses.TABLE_VERSION_HEADER, Long.toString(metadata.version()));
            response.send(ProtocolResponses.metadata(metadata));
        });
    }

    private void query(ServerRequest request, ServerResponse response) {
        var table = tableRef(request);
        request.content().as(String.class)
                .thenAccept(body -> handle("query_table", request, response, reader -> {
                    var queryRequest = parse(body);
                    var query = new FileQuery(VersionSpec.of(queryRequest.version(), queryRequest.timestamp()),
                            queryRequest.predicateHints(), queryRequest.limitHint());
                    var files = reader.getTableFileActions(table, query);
                    recorder.recordFilesServed(files.files().size());
                    response.status(200);
                    response.headers().add("Content-Type", ProtocolResponses.NDJSON_CONTENT_TYPE);
                    response.headers().add(ProtocolResponses.TABLE_VERSION_HEADER, Long.toString(files.version()));
                    if (files.truncated()) {
                        recorder.recordTruncated("query_table");
                        response.headers().add(ProtocolResponses.TRUNCATED_HEADER, "true");
                    }
                    response.send(ProtocolResponses.query(files));
                }))
                .exceptionally(t -> {
                    sendError("query_table", response, new InternalErrorException(t));
                    return null;
                });
    }

    static QueryRequest parse(String body) {
        if (body == null || body.isBlank()) {
            return QueryRequest.EMPTY;
        }
        try {
            var parsed = MAPPER.readValue(body, QueryRequest.class);
            return parsed == null ? QueryRequest.EMPTY : parsed;
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("malformed query body: " + e.getOriginalMessage());
        }
    }
}
