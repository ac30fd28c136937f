package io.dazzleduck.sharing.catalog.kv;

import io.dazzleduck.sharing.catalog.AbstractCatalog;
import io.dazzleduck.sharing.catalog.Positioned;
import io.dazzleduck.sharing.catalog.acl.Grant;
import io.dazzleduck.sharing.common.auth.ClientId;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.InternalException;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.pagination.KeyValueToken;
import io.dazzleduck.sharing.common.pagination.ListScope;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.pagination.PageTokenCodec;
import io.dazzleduck.sharing.common.util.Retry;
import io.dazzleduck.sharing.table.TableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Catalog stored in a single DynamoDB table.
 *
 * <p>Every entity is one item keyed by a partition key naming its kind and parent, and a sort key
 * that starts with its name. The components of an entity sort key are joined with {@code U+0000},
 * which sorts below every character a name may hold, so the sort key order of a partition is the
 * name order of its entities. Names containing {@code U+0000} cannot be stored and are never found.
 * Reads are eventually consistent: a listing may briefly miss a just-created entity.
 */
public class KeyValueCatalog extends AbstractCatalog<KeyValueToken> {

    private static final Logger logger = LoggerFactory.getLogger(KeyValueCatalog.class);

    static final String SEPARATOR = "\0";
    static final String GRANT_SEPARATOR = "#";
    static final String SHARE_PK = "SHARE";
    static final String SCHEMA_PK_PREFIX = "SCHEMA#";
    static final String TABLE_PK_PREFIX = "TABLE#";
    static final String GRANT_PK_PREFIX = "GRANT#";

    static final String SCHEMA_ID_ATTRIBUTE = "schemaId";
    static final String STORAGE_PATH_ATTRIBUTE = "storagePath";
    static final String STORAGE_FORMAT_ATTRIBUTE = "storageFormat";

    private final DynamoDbClient client;
    private final String tableName;
    private final String instance;
    private final String partitionKey;
    private final String sortKey;
    private final Retry retry;

    public KeyValueCatalog(DynamoDbClient client, String tableName, String partitionKey, String sortKey,
                           Retry retry, TableResolver resolver, PageLimits limits) {
        super(resolver, limits, KeyValueToken.class);
        this.client = client;
        this.tableName = tableName;
        this.instance = PageTokenCodec.instanceId(tableName);
        this.partitionKey = partitionKey;
        this.sortKey = sortKey;
        this.retry = retry;
    }

    @Override
    protected String instanceId() {
        return instance;
    }

    @Override
    protected Optional<Share> findShare(String name) {
        if (!storable(name)) {
            return Optional.empty();
        }
        return first(SHARE_PK, name + SEPARATOR).map(this::toShare);
    }

    @Override
    protected Optional<Schema> findSchema(Share share, String name) {
        if (!storable(name)) {
            return Optional.empty();
        }
        return first(SCHEMA_PK_PREFIX + share.id(), name + SEPARATOR).map(item -> toSchema(share, item));
    }

    @Override
    protected Optional<Table> findTable(Schema schema, String name) {
        if (!storable(name)) {
            return Optional.empty();
        }
        return first(TABLE_PK_PREFIX + schema.shareId(), schema.name() + SEPARATOR + name + SEPARATOR)
                .map(item -> toTable(schema.shareName(), item));
    }

    private static boolean storable(String name) {
        return !name.contains(SEPARATOR);
    }

    @Override
    protected List<Positioned<Share, KeyValueToken>> scanShares(ListScope scope, KeyValueToken after, int limit) {
        return scan(scope, SHARE_PK, null, after, limit, this::toShare);
    }

    @Override
    protected List<Positioned<Schema, KeyValueToken>> scanSchemas(ListScope scope, Share share, KeyValueToken after, int limit) {
        return scan(scope, SCHEMA_PK_PREFIX + share.id(), null, after, limit, item -> toSchema(share, item));
    }

    @Override
    protected List<Positioned<Table, KeyValueToken>> scanTables(ListScope scope, Schema schema, KeyValueToken after, int limit) {
        return scan(scope, TABLE_PK_PREFIX + schema.shareId(), schema.name() + SEPARATOR, after, limit,
                item -> toTable(schema.shareName(), item));
    }

    @Override
    protected List<Positioned<Table, KeyValueToken>> scanAllTables(ListScope scope, Share share, KeyValueToken after, int limit) {
        return scan(scope, TABLE_PK_PREFIX + share.id(), null, after, limit, item -> toTable(share.name(), item));
    }

    @Override
    public List<Grant> grantsFor(RecipientId recipient) {
        var result = new ArrayList<Grant>();
        for (var principal : ClientId.principalsOf(recipient)) {
            Map<String, AttributeValue> startKey = null;
            do {
                var response = query(GRANT_PK_PREFIX + principal, null, startKey, null);
                for (var item : response.items()) {
                    var grant = toGrant(item.get(sortKey).s());
                    if (grant != null) {
                        result.add(grant);
                    }
                }
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
            } while (startKey != null);
        }
        return result;
    }

    @Override
    public void ping() {
        call("describe table", () -> client.describeTable(r -> r.tableName(tableName)));
    }

    private Optional<Map<String, AttributeValue>> first(String pk, String skPrefix) {
        var response = query(pk, skPrefix, null, 1);
        return response.items().stream().findFirst();
    }

    private <T> List<Positioned<T, KeyValueToken>> scan(ListScope scope, String pk, String skPrefix,
                                                        KeyValueToken after, int limit,
                                                        Function<Map<String, AttributeValue>, T> mapper) {
        var startKey = after == null ? null : startKey(after, pk, skPrefix);
        var result = new ArrayList<Positioned<T, KeyValueToken>>(limit);
        while (result.size() < limit) {
            var response = query(pk, skPrefix, startKey, limit - result.size());
            for (var item : response.items()) {
                var position = new KeyValueToken(instance, scope.shape(),
                        Map.of(partitionKey, pk, sortKey, item.get(sortKey).s()));
                result.add(new Positioned<>(mapper.apply(item), position));
            }
            if (!response.hasLastEvaluatedKey() || response.lastEvaluatedKey().isEmpty()) {
                break;
            }
            startKey = response.lastEvaluatedKey();
        }
        return result;
    }

    private Map<String, AttributeValue> startKey(KeyValueToken token, String pk, String skPrefix) {
        var key = token.key();
        var sk = key == null ? null : key.get(sortKey);
        if (key == null || key.size() != 2 || !pk.equals(key.get(partitionKey)) || sk == null
                || (skPrefix != null && !sk.startsWith(skPrefix))) {
            throw new BadRequestException("page token does not belong to this listing");
        }
        return Map.of(partitionKey, AttributeValue.fromS(pk), sortKey, AttributeValue.fromS(sk));
    }

    private QueryResponse query(String pk, String skPrefix, Map<String, AttributeValue> startKey, Integer limit) {
        var names = new HashMap<String, String>();
        var values = new HashMap<String, AttributeValue>();
        names.put("#pk", partitionKey);
        values.put(":pk", AttributeValue.fromS(pk));
        var condition = "#pk = :pk";
        if (skPrefix != null) {
            names.put("#sk", sortKey);
            values.put(":sk", AttributeValue.fromS(skPrefix));
            condition += " AND begins_with(#sk, :sk)";
        }
        var request = QueryRequest.builder()
                .tableName(tableName)
                .keyConditionExpression(condition)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .consistentRead(false)
                .exclusiveStartKey(startKey)
                .limit(limit)
                .build();
        logger.debug("Querying {} for {} prefix {}", tableName, pk, skPrefix);
        return call("query " + pk, () -> client.query(request));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return retry.call(operation, action, DynamoErrors::isTransient);
        } catch (SdkException e) {
            logger.atError().setCause(e).log("DynamoDB {} on {} failed", operation, tableName);
            throw new InternalException("catalog store is unavailable", e);
        }
    }

    private Share toShare(Map<String, AttributeValue> item) {
        var parts = item.get(sortKey).s().split(SEPARATOR, 2);
        return new Share(parts[1], parts[0]);
    }

    private Schema toSchema(Share share, Map<String, AttributeValue> item) {
        var parts = item.get(sortKey).s().split(SEPARATOR, 2);
        return new Schema(parts[1], parts[0], share.id(), share.name());
    }

    private Table toTable(String shareName, Map<String, AttributeValue> item) {
        var shareId = item.get(partitionKey).s().substring(TABLE_PK_PREFIX.length());
        var parts = item.get(sortKey).s().split(SEPARATOR, 3);
        var format = item.get(STORAGE_FORMAT_ATTRIBUTE);
        return new Table(parts[2], parts[1], item.get(SCHEMA_ID_ATTRIBUTE).s(), parts[0], shareId, shareName,
                item.get(STORAGE_PATH_ATTRIBUTE).s(), format == null ? Table.DEFAULT_FORMAT : format.s());
    }

    private static Grant toGrant(String sk) {
        var parts = sk.split(GRANT_SEPARATOR);
        switch (parts[0]) {
            case "SHARE":
                return parts.length == 2 ? Grant.share(parts[1]) : null;
            case "SCHEMA":
                return parts.length == 3 ? Grant.schema(parts[1], parts[2]) : null;
            case "TABLE":
                return parts.length == 4 ? Grant.table(parts[1], parts[2], parts[3]) : null;
            default:
                logger.warn("Ignoring unrecognized grant {}", sk);
                return null;
        }
    }
}
