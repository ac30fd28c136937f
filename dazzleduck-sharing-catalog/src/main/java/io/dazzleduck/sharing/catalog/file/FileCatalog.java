package io.dazzleduck.sharing.catalog.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.dazzleduck.sharing.catalog.AbstractCatalog;
import io.dazzleduck.sharing.catalog.Positioned;
import io.dazzleduck.sharing.catalog.acl.Grant;
import io.dazzleduck.sharing.common.auth.ClientId;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.model.CatalogEntity;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.pagination.FileToken;
import io.dazzleduck.sharing.common.pagination.ListScope;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.pagination.PageTokenCodec;
import io.dazzleduck.sharing.table.TableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Catalog loaded once from a YAML or JSON file and served from memory. Page tokens are offsets
 * into the sorted listings, tied to the fingerprint of the loaded content.
 */
public class FileCatalog extends AbstractCatalog<FileToken> {

    private static final Logger logger = LoggerFactory.getLogger(FileCatalog.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final Comparator<Table> ALL_TABLES_ORDER = Comparator.comparing(Table::schemaName)
            .thenComparing(Table::name)
            .thenComparing(Table::id);

    private final String fingerprint;
    private final List<Share> shares = new ArrayList<>();
    private final Map<String, Share> sharesByName = new HashMap<>();
    private final Map<String, List<Schema>> schemasByShare = new HashMap<>();
    private final Map<String, Map<String, Schema>> schemasByName = new HashMap<>();
    private final Map<String, List<Table>> tablesBySchema = new HashMap<>();
    private final Map<String, Map<String, Table>> tablesByName = new HashMap<>();
    private final Map<String, List<Table>> tablesByShare = new HashMap<>();
    private final Map<String, List<Grant>> grantsByPrincipal = new HashMap<>();

    public FileCatalog(CatalogFile file, String fingerprint, TableResolver resolver, PageLimits limits) {
        super(resolver, limits, FileToken.class);
        this.fingerprint = fingerprint;
        var shareEntries = file.shares() == null ? List.<CatalogFile.ShareEntry>of() : file.shares();
        for (var shareEntry : shareEntries) {
            addShare(shareEntry);
        }
        shares.sort(CatalogEntity.NAME_ORDER);
        schemasByShare.values().forEach(l -> l.sort(CatalogEntity.NAME_ORDER));
        tablesBySchema.values().forEach(l -> l.sort(CatalogEntity.NAME_ORDER));
        tablesByShare.values().forEach(l -> l.sort(ALL_TABLES_ORDER));
    }

    public static FileCatalog load(Path path, TableResolver resolver, PageLimits limits) throws IOException {
        var bytes = Files.readAllBytes(path);
        var name = path.getFileName().toString();
        var mapper = name.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        var file = mapper.readValue(bytes, CatalogFile.class);
        var catalog = new FileCatalog(file, PageTokenCodec.instanceId(bytes), resolver, limits);
        logger.info("Loaded {} shares from {}", catalog.shares.size(), path);
        return catalog;
    }

    private void addShare(CatalogFile.ShareEntry entry) {
        var share = new Share(idOf(entry.id(), "share", entry.name()), requireName(entry.name(), "share"));
        if (sharesByName.putIfAbsent(share.name(), share) != null) {
            throw new IllegalArgumentException("duplicate share " + share.name());
        }
        shares.add(share);
        schemasByShare.put(share.id(), new ArrayList<>());
        schemasByName.put(share.id(), new HashMap<>());
        tablesByShare.put(share.id(), new ArrayList<>());
        if (entry.recipients() == null) {
            grant(ClientId.ANONYMOUS_PRINCIPAL, Grant.share(share.id()));
        } else {
            entry.recipients().forEach(r -> grant(r, Grant.share(share.id())));
        }
        if (entry.schemas() != null) {
            entry.schemas().forEach(s -> addSchema(share, s));
        }
    }

    private void addSchema(Share share, CatalogFile.SchemaEntry entry) {
        var name = requireName(entry.name(), "schema");
        var schema = new Schema(idOf(entry.id(), "schema", share.name() + "." + name), name, share.id(), share.name());
        if (schemasByName.get(share.id()).putIfAbsent(name, schema) != null) {
            throw new IllegalArgumentException("duplicate schema " + share.name() + "." + name);
        }
        schemasByShare.get(share.id()).add(schema);
        tablesBySchema.put(schema.id(), new ArrayList<>());
        tablesByName.put(schema.id(), new HashMap<>());
        if (entry.recipients() != null) {
            entry.recipients().forEach(r -> grant(r, Grant.schema(share.id(), schema.id())));
        }
        if (entry.tables() != null) {
            entry.tables().forEach(t -> addTable(schema, t));
        }
    }

    private void addTable(Schema schema, CatalogFile.TableEntry entry) {
        var name = requireName(entry.name(), "table");
        var fullName = schema.shareName() + "." + schema.name() + "." + name;
        if (entry.location() == null || entry.location().isBlank()) {
            throw new IllegalArgumentException("table " + fullName + " has no location");
        }
        var table = new Table(idOf(entry.id(), "table", fullName), name, schema.id(), schema.name(),
                schema.shareId(), schema.shareName(), entry.location(),
                entry.format() == null ? Table.DEFAULT_FORMAT : entry.format());
        if (tablesByName.get(schema.id()).putIfAbsent(name, table) != null) {
            throw new IllegalArgumentException("duplicate table " + fullName);
        }
        tablesBySchema.get(schema.id()).add(table);
        tablesByShare.get(schema.shareId()).add(table);
        if (entry.recipients() != null) {
            entry.recipients().forEach(r -> grant(r, Grant.table(schema.shareId(), schema.id(), table.id())));
        }
    }

    private void grant(String principal, Grant grant) {
        grantsByPrincipal.computeIfAbsent(principal, k -> new ArrayList<>()).add(grant);
    }

    private static String requireName(String name, String kind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " without a name");
        }
        return name;
    }

    private static String idOf(String id, String kind, String qualifiedName) {
        if (id != null) {
            return id;
        }
        return UUID.nameUUIDFromBytes((kind + ":" + qualifiedName).getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    protected String instanceId() {
        return fingerprint;
    }

    @Override
    protected Optional<Share> findShare(String name) {
        return Optional.ofNullable(sharesByName.get(name));
    }

    @Override
    protected Optional<Schema> findSchema(Share share, String name) {
        return Optional.ofNullable(schemasByName.getOrDefault(share.id(), Map.of()).get(name));
    }

    @Override
    protected Optional<Table> findTable(Schema schema, String name) {
        return Optional.ofNullable(tablesByName.getOrDefault(schema.id(), Map.of()).get(name));
    }

    @Override
    protected List<Positioned<Share, FileToken>> scanShares(ListScope scope, FileToken after, int limit) {
        return slice(shares, scope, after, limit);
    }

    @Override
    protected List<Positioned<Schema, FileToken>> scanSchemas(ListScope scope, Share share, FileToken after, int limit) {
        return slice(schemasByShare.getOrDefault(share.id(), List.of()), scope, after, limit);
    }

    @Override
    protected List<Positioned<Table, FileToken>> scanTables(ListScope scope, Schema schema, FileToken after, int limit) {
        return slice(tablesBySchema.getOrDefault(schema.id(), List.of()), scope, after, limit);
    }

    @Override
    protected List<Positioned<Table, FileToken>> scanAllTables(ListScope scope, Share share, FileToken after, int limit) {
        return slice(tablesByShare.getOrDefault(share.id(), List.of()), scope, after, limit);
    }

    private <T> List<Positioned<T, FileToken>> slice(List<T> sorted, ListScope scope, FileToken after, int limit) {
        int start = after == null ? 0 : after.offset();
        if (start < 0 || start > sorted.size()) {
            throw new BadRequestException("page token is out of range");
        }
        int end = Math.min(sorted.size(), start + limit);
        var result = new ArrayList<Positioned<T, FileToken>>(end - start);
        for (int i = start; i < end; i++) {
            result.add(new Positioned<>(sorted.get(i), new FileToken(fingerprint, scope.shape(), i + 1)));
        }
        return result;
    }

    @Override
    public List<Grant> grantsFor(RecipientId recipient) {
        var result = new ArrayList<Grant>();
        for (var principal : ClientId.principalsOf(recipient)) {
            result.addAll(grantsByPrincipal.getOrDefault(principal, List.of()));
        }
        return result;
    }

    @Override
    public void ping() {
    }
}
