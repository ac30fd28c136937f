package io.dazzleduck.sharing.table;

import io.dazzleduck.sharing.common.error.InternalException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class StoragePathsTest {

    @Test
    public void testRootAlwaysEndsWithSlash() {
        assertEquals(URI.create("s3://bucket/tables/orders/"), StoragePaths.root("s3://bucket/tables/orders"));
        assertEquals(URI.create("s3://bucket/tables/orders/"), StoragePaths.root("s3://bucket/tables/orders/"));
    }

    @Test
    public void testResolve() {
        var root = StoragePaths.root("s3://bucket/tables/orders");
        assertEquals(URI.create("s3://bucket/tables/orders/p%3D1/f.parquet"), StoragePaths.resolve(root, "p%3D1/f.parquet"));
        assertEquals(URI.create("s3a://bucket/tables/orders/f.parquet"), StoragePaths.resolve(root, "s3a://bucket/tables/orders/f.parquet"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "s3://other/tables/orders/f.parquet"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "s3://bucket/tables/ordersX/f.parquet"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "../f.parquet"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "%2e%2e/%2e%2e/other/x"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "p=1/%2E%2E/%2e%2e/ordersX/f.parquet"));
    }

    @Test
    public void testEncodedDotSegmentsStayInsideLocalRoots(@TempDir Path warehouse) {
        var root = StoragePaths.root(warehouse.resolve("orders").toString());
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "%2e%2e/%2e%2e/other/x"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "dt=1/%2e%2e/%2e%2e/secret.parquet"));
        assertThrows(InternalException.class, () -> StoragePaths.resolve(root, "%2e/f.parquet"));
        assertEquals(warehouse.resolve("orders").resolve("dt=1").resolve("...parquet").toUri(),
                StoragePaths.resolve(root, "dt=1/...parquet"));
    }
}
