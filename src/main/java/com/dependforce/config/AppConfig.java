package com.dependforce.config;

/**
 * Application-wide configuration constants.
 * Centralized config to avoid magic numbers scattered across the codebase.
 */
public class AppConfig {

    // ============================================
    // Scripting
    // ============================================

    /**
     * Batch terminator appended to every generated creation script.
     */
    public static final String BATCH_TERMINATOR = "GO";

    /**
     * Line separator used when assembling scripts.
     */
    public static final String SCRIPT_LINE_SEPARATOR = "\n";

    // ============================================
    // Discovery
    // ============================================

    /**
     * Maximum depth the SQL Server discovery walks below a root object.
     * Guards against pathological dependency chains.
     */
    public static final int MAX_DISCOVERY_DEPTH = 64;

    /**
     * Default query timeout for catalog queries, in seconds.
     */
    public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 60;

    // ============================================
    // Connection
    // ============================================

    /**
     * Default SQL Server port.
     */
    public static final int DEFAULT_SQL_SERVER_PORT = 1433;

    // ============================================
    // File & Directory Settings
    // ============================================

    /**
     * Default output folder for dependency reports.
     */
    public static final String DEFAULT_OUTPUT_FOLDER = "dependforce-output";

    /**
     * Suffixes of the report files written per root object.
     */
    public static final String REPORT_JSON_SUFFIX = "_dependencies.json";
    public static final String REPORT_CSV_SUFFIX = "_dependencies.csv";
    public static final String REPORT_SQL_SUFFIX = "_dependencies.sql";

    private AppConfig() {
        // Utility class - no instantiation
    }
}
