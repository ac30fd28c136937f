package io.dazzleduck.sharing.http.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.InternalException;
import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.error.PermissionDeniedException;
import io.dazzleduck.sharing.common.error.UnauthenticatedException;
import io.dazzleduck.sharing.common.model.Page;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.table.FileAction;
import io.dazzleduck.sharing.common.table.MetadataDescriptor;
import io.dazzleduck.sharing.common.table.TableFiles;
import io.dazzleduck.sharing.common.table.TableProtocol;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProtocolResponsesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void testListingWithToken() throws Exception {
        var body = MAPPER.readTree(ProtocolResponses.shares(new Page<>(List.of(new Share("id-1", "alpha")), "tok")));
        assertEquals("alpha", body.get("items").get(0).get("name").asText());
        assertEquals("id-1", body.get("items").get(0).get("id").asText());
        assertEquals("tok", body.get("nextPageToken").asText());
    }

    @Test
    public void testLastPageOmitsToken() throws Exception {
        var body = MAPPER.readTree(ProtocolResponses.shares(Page.last(List.of())));
        assertTrue(body.get("items").isEmpty());
        assertFalse(body.has("nextPageToken"));
    }

    @Test
    public void testTableItem() throws Exception {
        var table = new Table("t-1", "orders", "s-1", "sales", "sh-1", "alpha", "s3://bucket/orders", null);
        var item = MAPPER.readTree(ProtocolResponses.tables(Page.last(List.of(table)))).get("items").get(0);
        assertEquals("orders", item.get("name").asText());
        assertEquals("sales", item.get("schema").asText());
        assertEquals("alpha", item.get("share").asText());
        assertEquals("sh-1", item.get("shareId").asText());
        assertEquals("t-1", item.get("id").asText());
        // storage locations stay private
        assertFalse(item.has("storagePath"));
        assertFalse(item.toString().contains("s3://bucket"));
    }

    @Test
    public void testQueryLines() throws Exception {
        var metadata = new MetadataDescriptor("m-1", "orders", null, "parquet", "{}", List.of(), Map.of("k", "v"));
        var file = new FileAction("https://signed/a", "f-1", Map.of("dt", "2024"), 42, null, null, null, 1000L);
        var text = ProtocolResponses.query(new TableFiles(7, new TableProtocol(1), metadata, List.of(file), false));
        var lines = text.split("\n");
        assertEquals(3, lines.length);
        var meta = MAPPER.readTree(lines[1]).get("metaData");
        assertEquals("orders", meta.get("name").asText());
        assertNull(meta.get("description"));
        assertEquals("v", meta.get("configuration").get("k").asText());
        var fileNode = MAPPER.readTree(lines[2]).get("file");
        assertEquals("https://signed/a", fileNode.get("url").asText());
        assertEquals(42, fileNode.get("size").asLong());
        assertEquals(1000L, fileNode.get("expirationTimestamp").asLong());
        assertNull(fileNode.get("stats"));
        assertNull(fileNode.get("version"));
    }

    @Test
    public void testErrorMapping() throws Exception {
        assertInstanceOf(UnauthorizedException.class, HttpErrors.from(new UnauthenticatedException("no")));
        assertInstanceOf(InvalidParameterException.class, HttpErrors.from(new BadRequestException("bad")));
        assertInstanceOf(InternalErrorException.class, HttpErrors.from(new InternalException("boom")));

        var missing = HttpErrors.from(new NotFoundException("share gamma does not exist"));
        var denied = HttpErrors.from(new PermissionDeniedException("share beta is not granted"));
        assertEquals(404, missing.status);
        assertEquals(ProtocolResponses.error(missing), ProtocolResponses.error(denied));
        var body = MAPPER.readTree(ProtocolResponses.error(denied));
        assertEquals("RESOURCE_DOES_NOT_EXIST", body.get("errorCode").asText());
        assertFalse(body.get("message").asText().contains("beta"));
    }

    @Test
    public void testInternalErrorHidesCause() throws Exception {
        var error = HttpErrors.from(new InternalException("jdbc:postgresql://db password=secret"));
        var body = MAPPER.readTree(ProtocolResponses.error(error));
        assertEquals(500, error.status);
        assertEquals("INTERNAL_ERROR", body.get("errorCode").asText());
        assertFalse(body.get("message").asText().contains("secret"));
    }
}
