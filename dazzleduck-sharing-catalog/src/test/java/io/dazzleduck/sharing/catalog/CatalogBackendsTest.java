package io.dazzleduck.sharing.catalog;

import io.dazzleduck.sharing.catalog.acl.Grants;
import io.dazzleduck.sharing.catalog.file.CatalogFile;
import io.dazzleduck.sharing.catalog.jdbc.DuckDbDataSource;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.model.CatalogEntity;
import io.dazzleduck.sharing.common.model.Page;
import io.dazzleduck.sharing.common.model.Pagination;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.model.TableRef;
import io.dazzleduck.sharing.table.TableResolver;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class CatalogBackendsTest {

    private static final List<AutoCloseable> resources = new ArrayList<>();

    private static final List<String> ALL_SHARES = Stream.concat(
            Stream.of("Zeta", "alpha", "beta"),
            Stream.concat(IntStream.rangeClosed(1, 12).mapToObj(i -> String.format("p%02d", i)), Stream.of("public")))
            .collect(Collectors.toList());

    private static final List<String> SALES_TABLES = List.of("2023_archive", "Invoices", "customers", "items", "orders", "returns");

    static Stream<Arguments> backends() throws SQLException {
        return backends(CatalogFixtures.sample());
    }

    static Stream<Arguments> punctuatedBackends() throws SQLException {
        return backends(CatalogFixtures.punctuated());
    }

    private static Stream<Arguments> backends(CatalogFile file) throws SQLException {
        var resolver = mock(TableResolver.class);
        var dataSource = new DuckDbDataSource();
        resources.add(dataSource);
        return Stream.of(
                Arguments.of("file", CatalogFixtures.fileCatalog(file, resolver)),
                Arguments.of("key-value", CatalogFixtures.keyValueCatalog(file, resolver, 4)),
                Arguments.of("relational", CatalogFixtures.relationalCatalog(file, dataSource, resolver)));
    }

    @AfterAll
    static void close() throws Exception {
        for (var resource : resources) {
            resource.close();
        }
        resources.clear();
    }

    static <T> List<T> drain(Function<Pagination, Page<T>> lister, int pageSize) {
        var result = new ArrayList<T>();
        var pagination = Pagination.of(pageSize);
        for (int i = 0; i < 100; i++) {
            var page = lister.apply(pagination);
            assertTrue(page.items().size() <= pageSize);
            result.addAll(page.items());
            if (page.nextPageToken() == null) {
                return result;
            }
            assertEquals(pageSize, page.items().size(), "only the last page may be short");
            pagination = pagination.next(page.nextPageToken());
        }
        return fail("listing did not terminate");
    }

    private static List<String> names(List<? extends CatalogEntity> entities) {
        return entities.stream().map(CatalogEntity::name).collect(Collectors.toList());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("backends")
    void listsSharesInByteOrderOfNames(String backend, Catalog catalog) {
        assertEquals(ALL_SHARES, names(catalog.listShares(Pagination.FIRST).items()));
        assertNull(catalog.listShares(Pagination.FIRST).nextPageToken());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("backends")
    void pagesConcatenateWithoutGapsOrDuplicates(String backend, Catalog catalog) {
        for (int pageSize = 1; pageSize <= 8; pageSize++) {
            assertEquals(ALL_SHARES, names(drain(catalog::listShares, pageSize)), "page size " + pageSize);
            assertEquals(SALES_TABLES, names(drain(p -> catalog.listTables("alpha", "sales", p), pageSize)));
            assertEquals(List.of("hr", "sales"), names(drain(p -> catalog.listSchemas("alpha", p), pageSize)));
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("backends")
    void allTablesSpanEverySchemaOfTheShare(String backend, Catalog catalog) {
        for (int pageSize = 1; pageSize <= 4; pageSize++) {
            var tables = drain(p -> catalog.listAllTables("alpha", p), pageSize);
            assertEquals(List.of("hr.people", "sales.2023_archive", "sales.Invoices", "sales.customers",
                            "sales.items", "sales.orders", "sales.returns"),
                    tables.stream().map(t -> t.schemaName() + "." + t.name()).collect(Collectors.toList()));
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("backends")
    void pagesOnlyCountVisibleEntities(String backend, Catalog catalog) {
        var grants = new Grants(catalog.grantsFor(RecipientId.named("r3")));
        var expected = List.of("p01", "p03", "p05", "p07", "p09", "p11", "public");
        for (int pageSize = 1; pageSize <= 8; pageSize++) {
            assertEquals(expected, names(drain(p -> catalog.listShares(p, grants), pageSize)));
        }
        var page = catalog.listShares(Pagination.of(7), grants);
        assertEquals(expected, names(page.items()));
        assertNull(page.nextPageToken());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("backends")
    void resolvesTablesByName(String backend, Catalog catalog) {
        var table = catalog.getTable(new TableRef("alpha", "sales", "orders"));
        assertEquals(CatalogFixtures.id("table", "alpha.sales.orders"), table.id());
        assertEquals("/data/alpha/sales/orders", table.storagePath());
        assertEquals(Table.DEFAULT_FORMAT, table.storageFormat());
        assertEquals("alpha", table.shareName());
        assertEquals(CatalogFixtures.id("share", "alpha"), table.shareId());
        assertEquals(CatalogFixtures.id("schema", "alpha.sales"), table.schemaId());

        assertThrows(NotFoundException.class, () -> catalog.getShare("gamma"));
        assertThrows(NotFoundException.class, () -> catalog.getTable(new TableRef("alpha", "sales", "order")));
        assertThrows(NotFoundException.class, () -> catalog.listTables("alpha", "finance", Pagination.FIRST));
        assertThrows(NotFoundException.class, () -> catalog.listSchemas("gamma", Pagination.FIRST));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("punctuatedBackends")
    void namesWithSpacesAndPunctuationKeepByteOrder(String backend, Catalog catalog) {
        var shares = List.of("a", "a b", "a!", "a#b", "a-b", "a.b", "ab");
        assertEquals(shares, names(catalog.listShares(Pagination.FIRST).items()));
        for (int pageSize = 1; pageSize <= 3; pageSize++) {
            assertEquals(shares, names(drain(catalog::listShares, pageSize)));
            assertEquals(List.of("s", "s b", "s#x"), names(drain(p -> catalog.listSchemas("a", p), pageSize)));
            assertEquals(List.of("t", "t b", "t#1"), names(drain(p -> catalog.listTables("a", "s", p), pageSize)));
            assertEquals(List.of("s.t", "s.t b", "s.t#1", "s b.t", "s#x.t", "s#x.t b", "s#x.t#1"),
                    drain(p -> catalog.listAllTables("a", p), pageSize).stream()
                            .map(t -> t.schemaName() + "." + t.name()).collect(Collectors.toList()));
        }

        assertEquals("a#b", catalog.getShare("a#b").name());
        assertEquals(CatalogFixtures.id("share", "a"), catalog.getShare("a").id());
        assertEquals(CatalogFixtures.id("table", "a.s#x.t#1"), catalog.getTable(new TableRef("a", "s#x", "t#1")).id());
        assertEquals(CatalogFixtures.id("table", "a.s.t b"), catalog.getTable(new TableRef("a", "s", "t b")).id());
        assertThrows(NotFoundException.class, () -> catalog.getTable(new TableRef("a", "s", "t#")));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("backends")
    void rejectsTokensOfOtherListings(String backend, Catalog catalog) {
        var token = catalog.listShares(Pagination.of(2)).nextPageToken();
        assertNotNull(token);
        assertThrows(BadRequestException.class, () -> catalog.listSchemas("alpha", Pagination.of(2).next(token)));
        var schemaToken = catalog.listTables("alpha", "sales", Pagination.of(2)).nextPageToken();
        assertThrows(BadRequestException.class, () -> catalog.listAllTables("alpha", Pagination.of(2).next(schemaToken)));
        assertThrows(BadRequestException.class, () -> catalog.listShares(Pagination.of(2).next("not-a-token")));
    }

    @Test
    void backendsAgreeOnEveryListing() throws SQLException {
        var catalogs = backends().map(a -> (Catalog) a.get()[1]).collect(Collectors.toList());
        var reference = catalogs.get(0);
        for (var catalog : catalogs.subList(1, catalogs.size())) {
            assertEquals(drain(reference::listShares, 5), drain(catalog::listShares, 3));
            for (Share share : drain(reference::listShares, 50)) {
                assertEquals(drain(p -> reference.listSchemas(share.name(), p), 50),
                        drain(p -> catalog.listSchemas(share.name(), p), 1));
                assertEquals(drain(p -> reference.listAllTables(share.name(), p), 50),
                        drain(p -> catalog.listAllTables(share.name(), p), 2));
            }
        }
    }

    @Test
    void tokensDoNotCrossBackends() throws SQLException {
        var catalogs = backends().map(a -> (Catalog) a.get()[1]).collect(Collectors.toList());
        for (var issuer : catalogs) {
            var token = issuer.listShares(Pagination.of(1)).nextPageToken();
            for (var other : catalogs) {
                if (other != issuer) {
                    assertThrows(BadRequestException.class, () -> other.listShares(Pagination.of(1).next(token)));
                }
            }
        }
    }
}
