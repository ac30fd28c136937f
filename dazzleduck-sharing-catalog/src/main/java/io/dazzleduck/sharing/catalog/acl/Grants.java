package io.dazzleduck.sharing.catalog.acl;

import io.dazzleduck.sharing.catalog.Visibility;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Visibility derived from a set of grants. Grants only ever add visibility:
 * <ul>
 *     <li>a share is visible when any grant refers to it</li>
 *     <li>a schema is visible when its share is granted, or a grant refers to the schema or one of its tables</li>
 *     <li>a table is visible when its share, its schema or the table itself is granted</li>
 * </ul>
 */
public final class Grants implements Visibility {

    private final Set<String> referencedShares = new HashSet<>();
    private final Set<String> grantedShares = new HashSet<>();
    private final Set<String> referencedSchemas = new HashSet<>();
    private final Set<String> grantedSchemas = new HashSet<>();
    private final Set<String> grantedTables = new HashSet<>();

    public Grants(Collection<Grant> grants) {
        for (var grant : grants) {
            referencedShares.add(grant.shareId());
            switch (grant.level()) {
                case SHARE -> grantedShares.add(grant.shareId());
                case SCHEMA -> {
                    referencedSchemas.add(grant.schemaId());
                    grantedSchemas.add(grant.schemaId());
                }
                case TABLE -> {
                    referencedSchemas.add(grant.schemaId());
                    grantedTables.add(grant.tableId());
                }
            }
        }
    }

    @Override
    public boolean canSee(Share share) {
        return referencedShares.contains(share.id());
    }

    @Override
    public boolean canSee(Schema schema) {
        return grantedShares.contains(schema.shareId()) || referencedSchemas.contains(schema.id());
    }

    @Override
    public boolean canSee(Table table) {
        return grantedShares.contains(table.shareId())
                || grantedSchemas.contains(table.schemaId())
                || grantedTables.contains(table.id());
    }
}
