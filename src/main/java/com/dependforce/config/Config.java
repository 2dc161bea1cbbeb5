package com.dependforce.config;

import com.dependforce.dependency.DependencyDirection;
import com.dependforce.dependency.DependencyOptions;
import com.dependforce.dependency.Urn;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.*;

public class Config {
    private Properties properties;

    public Config(String configFilePath) throws IOException {
        properties = new Properties();
        try (FileInputStream fis = new FileInputStream(configFilePath)) {
            properties.load(fis);
        }
    }

    public String getServer() {
        return getRequiredProperty("db.server");
    }

    public int getPort() {
        return Integer.parseInt(getProperty("db.port", String.valueOf(AppConfig.DEFAULT_SQL_SERVER_PORT)));
    }

    public String getDatabase() {
        return getRequiredProperty("db.database");
    }

    public String getUsername() {
        return getProperty("db.username", "");
    }

    public String getPassword() {
        return getProperty("db.password", "");
    }

    public int getQueryTimeout() {
        return Integer.parseInt(getProperty("db.queryTimeoutSecs",
            String.valueOf(AppConfig.DEFAULT_QUERY_TIMEOUT_SECONDS)));
    }

    public String getOutputFolder() {
        return getProperty("outputFolder", AppConfig.DEFAULT_OUTPUT_FOLDER);
    }

    public DependencyDirection getDirection() {
        return DependencyDirection.fromString(getProperty("dependency.direction", "dependents"));
    }

    public boolean isIncludeSelf() {
        return Boolean.parseBoolean(getProperty("dependency.includeSelf", "false"));
    }

    public boolean isIncludeScript() {
        return Boolean.parseBoolean(getProperty("dependency.includeScript", "true"));
    }

    public boolean isAllowSystemObjects() {
        return Boolean.parseBoolean(getProperty("dependency.allowSystemObjects", "false"));
    }

    /**
     * Root objects to analyze, configured as a comma separated list of
     * {@code Type:schema.name} entries, e.g. {@code Table:dbo.Orders,View:sales.vTotals}.
     * The schema defaults to dbo.
     */
    public List<Urn> getRootObjects() {
        String value = getRequiredProperty("dependency.objects");
        String server = getServer();
        String database = getDatabase();

        List<Urn> roots = new ArrayList<>();
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                throw new RuntimeException("Invalid entry '" + trimmed
                    + "' in 'dependency.objects', expected Type:schema.name");
            }
            String type = trimmed.substring(0, colon).trim();
            String qualifiedName = trimmed.substring(colon + 1).trim();
            int dot = qualifiedName.indexOf('.');
            String schema = dot > 0 ? qualifiedName.substring(0, dot) : "dbo";
            String name = dot > 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
            roots.add(Urn.of(server, database, type, schema, name));
        }
        if (roots.isEmpty()) {
            throw new RuntimeException("Required property 'dependency.objects' lists no objects");
        }
        return roots;
    }

    public DependencyOptions getDependencyOptions() {
        DependencyOptions options = new DependencyOptions();
        options.setDirection(getDirection());
        options.setIncludeSelf(isIncludeSelf());
        options.setIncludeScript(isIncludeScript());
        options.setAllowSystemObjects(isAllowSystemObjects());
        return options;
    }

    private String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue).trim();
    }

    private String getRequiredProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new RuntimeException("Required property '" + key + "' is not set");
        }
        return value.trim();
    }
}
