package com.dependforce.sqlserver;

import com.dependforce.config.AppConfig;
import com.dependforce.config.JdbcHelper;
import com.dependforce.dependency.CatalogObject;
import com.dependforce.dependency.CatalogResolver;
import com.dependforce.dependency.ObjectIdentity;
import com.dependforce.dependency.Urn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves objects against the SQL Server catalog and produces creation scripts.
 *
 * Module scripts come from OBJECT_DEFINITION and are prefixed with the
 * ANSI_NULLS / QUOTED_IDENTIFIER settings the module was created with. Tables
 * are scripted from their column definitions, synonyms from sys.synonyms.
 */
public class SqlServerCatalogResolver implements CatalogResolver {

    private static final Logger logger = LoggerFactory.getLogger(SqlServerCatalogResolver.class);

    private static final String OBJECT_QUERY =
        "SELECT o.name, o.type_desc, " +
        "       COALESCE(USER_NAME(o.principal_id), USER_NAME(s.principal_id)) AS owner, " +
        "       ISNULL(m.is_schema_bound, 0) AS is_schema_bound " +
        "FROM sys.objects o " +
        "JOIN sys.schemas s ON s.schema_id = o.schema_id " +
        "LEFT JOIN sys.sql_modules m ON m.object_id = o.object_id " +
        "WHERE o.object_id = OBJECT_ID(?)";

    private static final String MODULE_QUERY =
        "SELECT m.definition, m.uses_ansi_nulls, m.uses_quoted_identifier " +
        "FROM sys.sql_modules m WHERE m.object_id = OBJECT_ID(?)";

    private static final String COLUMNS_QUERY =
        "SELECT c.name, t.name AS type_name, c.max_length, c.precision, c.scale, c.is_nullable, " +
        "       c.is_identity, CAST(ic.seed_value AS bigint) AS seed_value, " +
        "       CAST(ic.increment_value AS bigint) AS increment_value " +
        "FROM sys.columns c " +
        "JOIN sys.types t ON t.user_type_id = c.user_type_id " +
        "LEFT JOIN sys.identity_columns ic ON ic.object_id = c.object_id AND ic.column_id = c.column_id " +
        "WHERE c.object_id = OBJECT_ID(?) " +
        "ORDER BY c.column_id";

    private static final String SYNONYM_QUERY =
        "SELECT base_object_name FROM sys.synonyms WHERE object_id = OBJECT_ID(?)";

    private static final Set<String> UNICODE_TYPES = Set.of("nvarchar", "nchar");
    private static final Set<String> SIZED_TYPES = Set.of("varchar", "char", "varbinary", "binary");
    private static final Set<String> DECIMAL_TYPES = Set.of("decimal", "numeric");
    private static final Set<String> SCALED_TYPES = Set.of("datetime2", "time", "datetimeoffset");

    private final Connection connection;
    private final int queryTimeoutSeconds;

    // Cache for resolved objects, keyed by URN
    private final Map<String, CatalogObject> objectCache = new ConcurrentHashMap<>();

    public SqlServerCatalogResolver(Connection connection) {
        this(connection, AppConfig.DEFAULT_QUERY_TIMEOUT_SECONDS);
    }

    public SqlServerCatalogResolver(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public CatalogObject resolve(ObjectIdentity identity) throws SQLException {
        CatalogObject cached = objectCache.get(identity.getUrn());
        if (cached != null) {
            return cached;
        }

        Urn urn = Urn.from(identity);
        useDatabase(urn.getDatabase());

        try (PreparedStatement stmt = prepare(OBJECT_QUERY, urn);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                logger.debug("Object not found in catalog: {}", urn);
                return null;
            }
            CatalogObject object = new CatalogObject(
                rs.getString("name"),
                SqlServerObjectTypes.toUrnType(rs.getString("type_desc")),
                rs.getString("owner"),
                rs.getBoolean("is_schema_bound"));
            objectCache.put(identity.getUrn(), object);
            return object;
        }
    }

    @Override
    public String script(ObjectIdentity identity) throws SQLException {
        Urn urn = Urn.from(identity);
        useDatabase(urn.getDatabase());

        String moduleScript = scriptModule(urn);
        if (moduleScript != null) {
            return moduleScript;
        }
        if (SqlServerObjectTypes.isTable(urn.getType())) {
            return scriptTable(urn);
        }
        if ("Synonym".equalsIgnoreCase(urn.getType())) {
            return scriptSynonym(urn);
        }

        logger.debug("No script available for {}", urn);
        return null;
    }

    private String scriptModule(Urn urn) throws SQLException {
        try (PreparedStatement stmt = prepare(MODULE_QUERY, urn);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return null;
            }
            String definition = rs.getString("definition");
            if (definition == null) {
                // encrypted module
                return null;
            }
            String nl = AppConfig.SCRIPT_LINE_SEPARATOR;
            String go = AppConfig.BATCH_TERMINATOR;
            return "SET ANSI_NULLS " + (rs.getBoolean("uses_ansi_nulls") ? "ON" : "OFF") + nl + go + nl
                + "SET QUOTED_IDENTIFIER " + (rs.getBoolean("uses_quoted_identifier") ? "ON" : "OFF") + nl + go + nl
                + definition.trim();
        }
    }

    private String scriptTable(Urn urn) throws SQLException {
        List<String> columns = new ArrayList<>();
        try (PreparedStatement stmt = prepare(COLUMNS_QUERY, urn);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                StringBuilder column = new StringBuilder("    ")
                    .append(JdbcHelper.quoteIdentifier(rs.getString("name")))
                    .append(' ')
                    .append(formatType(rs.getString("type_name"), rs.getInt("max_length"),
                        rs.getInt("precision"), rs.getInt("scale")));
                if (rs.getBoolean("is_identity")) {
                    long seed = rs.getLong("seed_value");
                    long increment = rs.getLong("increment_value");
                    column.append(" IDENTITY(").append(seed).append(',').append(increment).append(')');
                }
                column.append(rs.getBoolean("is_nullable") ? " NULL" : " NOT NULL");
                columns.add(column.toString());
            }
        }
        if (columns.isEmpty()) {
            throw new SQLException("No columns found for " + urn.getUrn());
        }

        String nl = AppConfig.SCRIPT_LINE_SEPARATOR;
        return "CREATE TABLE " + JdbcHelper.getQualifiedName(urn.getSchema(), urn.getName()) + " (" + nl
            + String.join("," + nl, columns) + nl + ")";
    }

    private String scriptSynonym(Urn urn) throws SQLException {
        try (PreparedStatement stmt = prepare(SYNONYM_QUERY, urn);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return null;
            }
            return "CREATE SYNONYM " + JdbcHelper.getQualifiedName(urn.getSchema(), urn.getName())
                + " FOR " + rs.getString("base_object_name");
        }
    }

    /**
     * Formats a column type as it appears in a CREATE TABLE statement.
     */
    static String formatType(String typeName, int maxLength, int precision, int scale) {
        String type = typeName.toLowerCase();
        if (UNICODE_TYPES.contains(type)) {
            return type + "(" + (maxLength == -1 ? "MAX" : String.valueOf(maxLength / 2)) + ")";
        }
        if (SIZED_TYPES.contains(type)) {
            return type + "(" + (maxLength == -1 ? "MAX" : String.valueOf(maxLength)) + ")";
        }
        if (DECIMAL_TYPES.contains(type)) {
            return type + "(" + precision + ", " + scale + ")";
        }
        if (SCALED_TYPES.contains(type)) {
            return type + "(" + scale + ")";
        }
        return type;
    }

    private PreparedStatement prepare(String sql, Urn urn) throws SQLException {
        PreparedStatement stmt = connection.prepareStatement(sql);
        try {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, JdbcHelper.getQualifiedName(urn.getSchema(), urn.getName()));
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    private void useDatabase(String database) throws SQLException {
        if (database != null && !database.equalsIgnoreCase(connection.getCatalog())) {
            connection.setCatalog(database);
        }
    }
}
