package com.dependforce.sqlserver;

import com.dependforce.config.AppConfig;
import com.dependforce.config.JdbcHelper;
import com.dependforce.dependency.DependencyDirection;
import com.dependforce.dependency.DiscoveryService;
import com.dependforce.dependency.ObjectIdentity;
import com.dependforce.dependency.RawTreeNode;
import com.dependforce.dependency.Urn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * Discovers dependency trees from the SQL Server catalog views.
 *
 * Expression dependencies (views, procedures, functions), foreign keys and
 * triggers are followed. The tree has a synthetic root whose children are the
 * requested root objects.
 */
public class SqlServerDiscoveryService implements DiscoveryService {

    private static final Logger logger = LoggerFactory.getLogger(SqlServerDiscoveryService.class);

    private static final String ROOT_QUERY =
        "SELECT o.object_id, o.type_desc, ISNULL(m.is_schema_bound, 0) AS is_schema_bound " +
        "FROM sys.objects o LEFT JOIN sys.sql_modules m ON m.object_id = o.object_id " +
        "WHERE o.object_id = OBJECT_ID(?)";

    private static final String DEPENDENTS_QUERY =
        "SELECT o.object_id, SCHEMA_NAME(o.schema_id) AS schema_name, o.name, o.type_desc, " +
        "       MAX(x.is_schema_bound) AS is_schema_bound " +
        "FROM ( " +
        "    SELECT d.referencing_id AS object_id, CAST(d.is_schema_bound_reference AS int) AS is_schema_bound " +
        "    FROM sys.sql_expression_dependencies d WHERE d.referenced_id = ? " +
        "    UNION ALL " +
        "    SELECT fk.parent_object_id, 0 FROM sys.foreign_keys fk WHERE fk.referenced_object_id = ? " +
        "    UNION ALL " +
        "    SELECT tr.object_id, 0 FROM sys.triggers tr WHERE tr.parent_id = ? " +
        ") x " +
        "JOIN sys.objects o ON o.object_id = x.object_id " +
        "WHERE x.object_id <> ? AND (? = 1 OR o.is_ms_shipped = 0) " +
        "GROUP BY o.object_id, o.schema_id, o.name, o.type_desc " +
        "ORDER BY SCHEMA_NAME(o.schema_id), o.name";

    private static final String DEPENDENCIES_QUERY =
        "SELECT o.object_id, SCHEMA_NAME(o.schema_id) AS schema_name, o.name, o.type_desc, " +
        "       MAX(x.is_schema_bound) AS is_schema_bound " +
        "FROM ( " +
        "    SELECT d.referenced_id AS object_id, CAST(d.is_schema_bound_reference AS int) AS is_schema_bound " +
        "    FROM sys.sql_expression_dependencies d WHERE d.referencing_id = ? AND d.referenced_id IS NOT NULL " +
        "    UNION ALL " +
        "    SELECT fk.referenced_object_id, 0 FROM sys.foreign_keys fk WHERE fk.parent_object_id = ? " +
        "    UNION ALL " +
        "    SELECT tr.parent_id, 0 FROM sys.triggers tr WHERE tr.object_id = ? AND tr.parent_class = 1 " +
        ") x " +
        "JOIN sys.objects o ON o.object_id = x.object_id " +
        "WHERE x.object_id <> ? AND (? = 1 OR o.is_ms_shipped = 0) " +
        "GROUP BY o.object_id, o.schema_id, o.name, o.type_desc " +
        "ORDER BY SCHEMA_NAME(o.schema_id), o.name";

    private final Connection connection;
    private final int queryTimeoutSeconds;

    public SqlServerDiscoveryService(Connection connection) {
        this(connection, AppConfig.DEFAULT_QUERY_TIMEOUT_SECONDS);
    }

    public SqlServerDiscoveryService(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Catalog row describing one related object
     */
    private static class RelatedObject {
        final int objectId;
        final String schema;
        final String name;
        final String typeDesc;
        final boolean schemaBound;

        RelatedObject(int objectId, String schema, String name, String typeDesc, boolean schemaBound) {
            this.objectId = objectId;
            this.schema = schema;
            this.name = name;
            this.typeDesc = typeDesc;
            this.schemaBound = schemaBound;
        }
    }

    /**
     * Pending expansion on the work stack
     */
    private static class Expansion {
        final SqlServerTreeNode node;
        final int depth;
        final Set<Integer> path;

        Expansion(SqlServerTreeNode node, int depth, Set<Integer> path) {
            this.node = node;
            this.depth = depth;
            this.path = path;
        }
    }

    @Override
    public RawTreeNode discover(Set<ObjectIdentity> roots, boolean includeSystemObjects,
                                DependencyDirection direction) throws SQLException {
        SqlServerTreeNode tree = SqlServerTreeNode.syntheticRoot();
        Map<Integer, List<RelatedObject>> relatedCache = new HashMap<>();

        for (ObjectIdentity identity : roots) {
            Urn urn = Urn.from(identity);
            useDatabase(urn.getDatabase());

            SqlServerTreeNode rootNode = lookupRoot(urn);
            tree.addChild(rootNode);
            int count = expand(rootNode, urn, includeSystemObjects, direction, relatedCache);
            logger.debug("Discovered {} related object(s) for {}", count, urn);
        }

        return tree;
    }

    private void useDatabase(String database) throws SQLException {
        if (database != null && !database.equalsIgnoreCase(connection.getCatalog())) {
            connection.setCatalog(database);
        }
    }

    private SqlServerTreeNode lookupRoot(Urn urn) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(ROOT_QUERY)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, JdbcHelper.getQualifiedName(urn.getSchema(), urn.getName()));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Object not found: " + urn.getUrn());
                }
                return new SqlServerTreeNode(urn, rs.getInt("object_id"), rs.getBoolean("is_schema_bound"));
            }
        }
    }

    private int expand(SqlServerTreeNode rootNode, Urn rootUrn, boolean includeSystemObjects,
                       DependencyDirection direction, Map<Integer, List<RelatedObject>> relatedCache)
            throws SQLException {
        String server = rootUrn.getServer();
        String database = rootUrn.getDatabase();
        int count = 0;

        Deque<Expansion> stack = new ArrayDeque<>();
        stack.push(new Expansion(rootNode, 0, Set.of(rootNode.getObjectId())));

        while (!stack.isEmpty()) {
            Expansion current = stack.pop();
            if (current.depth >= AppConfig.MAX_DISCOVERY_DEPTH) {
                logger.warn("Stopped discovery below {} at depth {}", current.node, current.depth);
                continue;
            }

            int objectId = current.node.getObjectId();
            List<RelatedObject> related = relatedCache.get(objectId);
            if (related == null) {
                related = queryRelated(objectId, includeSystemObjects, direction);
                relatedCache.put(objectId, related);
            }

            for (RelatedObject object : related) {
                Urn urn = Urn.of(server, database, SqlServerObjectTypes.toUrnType(object.typeDesc),
                    object.schema, object.name);
                SqlServerTreeNode child = new SqlServerTreeNode(urn, object.objectId, object.schemaBound);
                current.node.addChild(child);
                count++;

                if (current.path.contains(object.objectId)) {
                    logger.debug("Circular dependency detected involving: {}", urn);
                    continue;
                }
                Set<Integer> path = new HashSet<>(current.path);
                path.add(object.objectId);
                stack.push(new Expansion(child, current.depth + 1, path));
            }
        }

        return count;
    }

    private List<RelatedObject> queryRelated(int objectId, boolean includeSystemObjects,
                                             DependencyDirection direction) throws SQLException {
        String sql = direction == DependencyDirection.DEPENDENCIES ? DEPENDENCIES_QUERY : DEPENDENTS_QUERY;
        List<RelatedObject> related = new ArrayList<>();

        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setInt(1, objectId);
            stmt.setInt(2, objectId);
            stmt.setInt(3, objectId);
            stmt.setInt(4, objectId);
            stmt.setInt(5, includeSystemObjects ? 1 : 0);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    related.add(new RelatedObject(
                        rs.getInt("object_id"),
                        rs.getString("schema_name"),
                        rs.getString("name"),
                        rs.getString("type_desc"),
                        rs.getInt("is_schema_bound") != 0));
                }
            }
        }

        return related;
    }
}
