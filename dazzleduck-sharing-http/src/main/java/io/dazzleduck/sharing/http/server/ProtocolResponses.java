package io.dazzleduck.sharing.http.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dazzleduck.sharing.common.model.Page;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.table.FileAction;
import io.dazzleduck.sharing.common.table.MetadataDescriptor;
import io.dazzleduck.sharing.common.table.TableFiles;
import io.dazzleduck.sharing.common.table.TableMetadata;
import io.dazzleduck.sharing.common.table.TableProtocol;

import java.util.function.Function;

/**
 * Wire format of the sharing protocol. Listings and single entities are JSON documents; table
 * metadata and query results are newline-delimited JSON, one action per line.
 */
public final class ProtocolResponses {

    public static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    public static final String NDJSON_CONTENT_TYPE = "application/x-ndjson; charset=utf-8";
    public static final String TABLE_VERSION_HEADER = "Delta-Table-Version";
    public static final String TRUNCATED_HEADER = "Delta-Sharing-Truncated";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProtocolResponses() {
    }

    public static String shares(Page<Share> page) {
        return listing(page, ProtocolResponses::share);
    }

    public static String schemas(Page<Schema> page) {
        return listing(page, ProtocolResponses::schema);
    }

    public static String tables(Page<Table> page) {
        return listing(page, ProtocolResponses::table);
    }

    public static String getShare(Share share) {
        var root = MAPPER.createObjectNode();
        root.set("share", share(share));
        return write(root);
    }

    public static String metadata(TableMetadata metadata) {
        return protocolLine(metadata.protocol()) + "\n" + metadataLine(metadata.metadata()) + "\n";
    }

    public static String query(TableFiles files) {
        var out = new StringBuilder(metadata(files.tableMetadata()));
        for (var file : files.files()) {
            out.append(fileLine(file)).append('\n');
        }
        return out.toString();
    }

    public static String error(HttpException e) {
        var root = MAPPER.createObjectNode();
        root.put("errorCode", e.errorCode);
        root.put("message", e.getMessage());
        return write(root);
    }

    private static <T> String listing(Page<T> page, Function<T, ObjectNode> item) {
        var root = MAPPER.createObjectNode();
        var items = root.putArray("items");
        page.items().forEach(i -> items.add(item.apply(i)));
        if (page.nextPageToken() != null) {
            root.put("nextPageToken", page.nextPageToken());
        }
        return write(root);
    }

    private static ObjectNode share(Share share) {
        var node = MAPPER.createObjectNode();
        node.put("name", share.name());
        node.put("id", share.id());
        return node;
    }

    private static ObjectNode schema(Schema schema) {
        var node = MAPPER.createObjectNode();
        node.put("name", schema.name());
        node.put("share", schema.shareName());
        return node;
    }

    private static ObjectNode table(Table table) {
        var node = MAPPER.createObjectNode();
        node.put("name", table.name());
        node.put("schema", table.schemaName());
        node.put("share", table.shareName());
        node.put("shareId", table.shareId());
        node.put("id", table.id());
        return node;
    }

    private static String protocolLine(TableProtocol protocol) {
        var root = MAPPER.createObjectNode();
        root.putObject("protocol").put("minReaderVersion", protocol.minReaderVersion());
        return write(root);
    }

    private static String metadataLine(MetadataDescriptor metadata) {
        var root = MAPPER.createObjectNode();
        var node = root.putObject("metaData");
        node.put("id", metadata.id());
        if (metadata.name() != null) {
            node.put("name", metadata.name());
        }
        if (metadata.description() != null) {
            node.put("description", metadata.description());
        }
        node.putObject("format").put("provider", metadata.format());
        node.put("schemaString", metadata.schemaString());
        var partitionColumns = node.putArray("partitionColumns");
        metadata.partitionColumns().forEach(partitionColumns::add);
        var configuration = node.putObject("configuration");
        metadata.configuration().forEach(configuration::put);
        return write(root);
    }

    private static String fileLine(FileAction file) {
        var root = MAPPER.createObjectNode();
        var node = root.putObject("file");
        node.put("url", file.url());
        node.put("id", file.id());
        var partitionValues = node.putObject("partitionValues");
        file.partitionValues().forEach(partitionValues::put);
        node.put("size", file.size());
        if (file.stats() != null) {
            node.put("stats", file.stats());
        }
        if (file.version() != null) {
            node.put("version", file.version());
        }
        if (file.timestamp() != null) {
            node.put("timestamp", file.timestamp());
        }
        if (file.expirationTimestamp() != null) {
            node.put("expirationTimestamp", file.expirationTimestamp());
        }
        return write(root);
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
