package com.dependforce.config;

/**
 * Helper utilities for JDBC operations against SQL Server.
 * Builds connection URLs and quotes identifiers for generated statements.
 */
public class JdbcHelper {

    /**
     * Build the JDBC URL for the configured server.
     *
     * @param config loaded configuration
     * @return the JDBC URL string
     */
    public static String buildJdbcUrl(Config config) {
        return buildJdbcUrl(config.getServer(), config.getPort(), config.getDatabase());
    }

    /**
     * Build a SQL Server JDBC URL.
     *
     * @param host server host name; a named instance may be given as host\instance
     * @param port TCP port, 0 or negative for the default
     * @param database initial database
     * @return the JDBC URL string
     */
    public static String buildJdbcUrl(String host, int port, String database) {
        int sqlPort = port > 0 ? port : AppConfig.DEFAULT_SQL_SERVER_PORT;
        return String.format("jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=true;trustServerCertificate=true",
            host, sqlPort, database);
    }

    /**
     * Quote an identifier with square brackets, escaping embedded closing brackets.
     *
     * @param identifier the identifier to quote
     * @return the quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        return "[" + identifier.replace("]", "]]") + "]";
    }

    /**
     * Build a schema-qualified object name.
     *
     * @param schema the schema name (can be null)
     * @param name the object name
     * @return the qualified name (e.g., [dbo].[Orders])
     */
    public static String getQualifiedName(String schema, String name) {
        if (schema == null || schema.isEmpty()) {
            return quoteIdentifier(name);
        }
        return quoteIdentifier(schema) + "." + quoteIdentifier(name);
    }

    private JdbcHelper() {
        // Utility class - no instantiation
    }
}
