package io.dazzleduck.sharing.catalog.file;

import io.dazzleduck.sharing.catalog.CatalogFixtures;
import io.dazzleduck.sharing.catalog.acl.Grant;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.model.Pagination;
import io.dazzleduck.sharing.common.model.TableRef;
import io.dazzleduck.sharing.common.pagination.FileToken;
import io.dazzleduck.sharing.common.pagination.PageTokenCodec;
import io.dazzleduck.sharing.table.TableResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class FileCatalogTest {

    @TempDir
    Path tempDir;

    private TableResolver resolver;

    @BeforeEach
    void setup() {
        resolver = mock(TableResolver.class);
    }

    private FileCatalog load(String name, String content) throws Exception {
        var path = tempDir.resolve(name);
        Files.writeString(path, content);
        return FileCatalog.load(path, resolver, CatalogFixtures.LIMITS);
    }

    @Test
    void loadsYamlCatalog() throws Exception {
        var path = Path.of(getClass().getResource("/catalog.yaml").toURI());
        var catalog = FileCatalog.load(path, resolver, CatalogFixtures.LIMITS);

        var alpha = catalog.getShare("alpha");
        assertEquals("0f5e3ae8-1b51-4a0e-9f8b-0b7dd0d3b001", alpha.id());
        var orders = catalog.getTable(new TableRef("alpha", "sales", "orders"));
        assertEquals("delta", orders.storageFormat());
        assertEquals("s3://warehouse/alpha/sales/orders", orders.storagePath());
        assertEquals(CatalogFixtures.id("table", "alpha.sales.orders"), orders.id());
        assertEquals("parquet", catalog.getTable(new TableRef("alpha", "sales", "customers")).storageFormat());
        assertEquals(CatalogFixtures.id("share", "public"), catalog.getShare("public").id());
    }

    @Test
    void recipientsBecomeGrants() throws Exception {
        var catalog = FileCatalog.load(Path.of(getClass().getResource("/catalog.yaml").toURI()), resolver, CatalogFixtures.LIMITS);
        var alphaId = "0f5e3ae8-1b51-4a0e-9f8b-0b7dd0d3b001";
        var publicId = CatalogFixtures.id("share", "public");
        var salesId = CatalogFixtures.id("schema", "alpha.sales");
        var customersId = CatalogFixtures.id("table", "alpha.sales.customers");

        assertEquals(Set.of(Grant.share(alphaId), Grant.share(publicId)),
                Set.copyOf(catalog.grantsFor(RecipientId.named("r1"))));
        assertEquals(Set.of(Grant.table(alphaId, salesId, customersId), Grant.share(publicId)),
                Set.copyOf(catalog.grantsFor(RecipientId.named("r2"))));
        assertEquals(List.of(Grant.share(publicId)), catalog.grantsFor(RecipientId.anonymous()));
    }

    @Test
    void loadsJsonCatalog() throws Exception {
        var catalog = load("catalog.json", "{\"shares\":[{\"name\":\"s\",\"schemas\":[{\"name\":\"d\","
                + "\"tables\":[{\"name\":\"t\",\"location\":\"/data/t\"}]}]}]}");
        assertEquals("/data/t", catalog.getTable(new TableRef("s", "d", "t")).storagePath());
    }

    @Test
    void rejectsDuplicateNames() {
        var duplicateShares = "shares:\n  - name: a\n  - name: a\n";
        assertThrows(IllegalArgumentException.class, () -> load("dup-share.yaml", duplicateShares));
        var duplicateTables = "shares:\n  - name: a\n    schemas:\n      - name: s\n        tables:\n"
                + "          - {name: t, location: /x}\n          - {name: t, location: /y}\n";
        assertThrows(IllegalArgumentException.class, () -> load("dup-table.yaml", duplicateTables));
    }

    @Test
    void rejectsTableWithoutLocation() {
        var content = "shares:\n  - name: a\n    schemas:\n      - name: s\n        tables:\n          - name: t\n";
        assertThrows(IllegalArgumentException.class, () -> load("no-location.yaml", content));
    }

    @Test
    void tokensAreBoundToTheLoadedContent() throws Exception {
        var content = "shares:\n  - name: a\n  - name: b\n  - name: c\n";
        var first = load("first.yaml", content);
        var token = first.listShares(Pagination.of(1)).nextPageToken();
        assertNotNull(token);

        var sameContent = load("same.yaml", content);
        assertEquals("b", sameContent.listShares(Pagination.of(1).next(token)).items().get(0).name());

        var changed = load("changed.yaml", content + "  - name: d\n");
        assertThrows(BadRequestException.class, () -> changed.listShares(Pagination.of(1).next(token)));
    }

    @Test
    void rejectsOffsetsOutsideTheListing() {
        var catalog = CatalogFixtures.fileCatalog(CatalogFixtures.sample(), resolver);
        var token = PageTokenCodec.encode(new FileToken("fixture", "shares", 999));
        assertThrows(BadRequestException.class, () -> catalog.listShares(Pagination.of(1).next(token)));
    }
}
