package com.dependforce.config;

import com.dependforce.dependency.DependencyDirection;
import com.dependforce.dependency.DependencyOptions;
import com.dependforce.dependency.Urn;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Config class.
 * Tests configuration file loading and property retrieval.
 */
@DisplayName("Config Tests")
class ConfigTest {

    private static final String BASE = "db.server=SQL01\n" +
            "db.database=Sales\n" +
            "dependency.objects=Table:dbo.Orders\n";

    @TempDir
    Path tempDir;

    private Config createConfig(String content) throws IOException {
        Path configFile = tempDir.resolve("test-config.properties");
        Files.writeString(configFile, content);
        return new Config(configFile.toString());
    }

    @Test
    @DisplayName("Config loads connection properties from file")
    void testLoadProperties() throws IOException {
        Config config = createConfig(BASE +
                "db.port=14330\n" +
                "db.username=reader\n" +
                "db.password=secret\n");

        assertEquals("SQL01", config.getServer());
        assertEquals("Sales", config.getDatabase());
        assertEquals(14330, config.getPort());
        assertEquals("reader", config.getUsername());
        assertEquals("secret", config.getPassword());
    }

    @Test
    @DisplayName("Config throws for missing config file")
    void testMissingConfigFile() {
        assertThrows(IOException.class, () ->
            new Config("/nonexistent/path/config.properties"));
    }

    @Test
    @DisplayName("Config throws for missing required property")
    void testMissingRequiredProperty() throws IOException {
        Config config = createConfig("db.database=Sales\n");

        RuntimeException e = assertThrows(RuntimeException.class, config::getServer);
        assertTrue(e.getMessage().contains("db.server"));
    }

    @Test
    @DisplayName("Config throws for empty required property")
    void testEmptyRequiredProperty() throws IOException {
        Config config = createConfig("db.server=\ndb.database=Sales\n");

        assertThrows(RuntimeException.class, config::getServer);
    }

    @Test
    @DisplayName("Defaults apply when optional properties are absent")
    void testDefaults() throws IOException {
        Config config = createConfig(BASE);

        assertEquals(AppConfig.DEFAULT_SQL_SERVER_PORT, config.getPort());
        assertEquals(AppConfig.DEFAULT_QUERY_TIMEOUT_SECONDS, config.getQueryTimeout());
        assertEquals(AppConfig.DEFAULT_OUTPUT_FOLDER, config.getOutputFolder());
        assertEquals("", config.getUsername());

        DependencyOptions options = config.getDependencyOptions();
        assertEquals(DependencyDirection.DEPENDENTS, options.getDirection());
        assertFalse(options.isIncludeSelf());
        assertTrue(options.isIncludeScript());
        assertFalse(options.isAllowSystemObjects());
    }

    @Test
    @DisplayName("Dependency options are read from the file")
    void testDependencyOptions() throws IOException {
        Config config = createConfig(BASE +
                "dependency.direction=Dependencies\n" +
                "dependency.includeSelf=true\n" +
                "dependency.includeScript=false\n" +
                "dependency.allowSystemObjects=true\n");

        DependencyOptions options = config.getDependencyOptions();

        assertEquals(DependencyDirection.DEPENDENCIES, options.getDirection());
        assertTrue(options.isIncludeSelf());
        assertFalse(options.isIncludeScript());
        assertTrue(options.isAllowSystemObjects());
    }

    @Test
    @DisplayName("Unknown direction is rejected")
    void testUnknownDirection() throws IOException {
        Config config = createConfig(BASE + "dependency.direction=sideways\n");

        assertThrows(IllegalArgumentException.class, config::getDirection);
    }

    @Test
    @DisplayName("Root objects become URNs on the configured server and database")
    void testRootObjects() throws IOException {
        Config config = createConfig("db.server=SQL01\n" +
                "db.database=Sales\n" +
                "dependency.objects=Table:dbo.Orders, View:sales.vTotals ,StoredProcedure:usp_Load\n");

        List<Urn> roots = config.getRootObjects();

        assertEquals(3, roots.size());
        assertEquals(Urn.of("SQL01", "Sales", "Table", "dbo", "Orders"), roots.get(0));
        assertEquals("sales", roots.get(1).getSchema());
        assertEquals("vTotals", roots.get(1).getName());
        assertEquals("View", roots.get(1).getType());
        assertEquals("dbo", roots.get(2).getSchema());
        assertEquals("usp_Load", roots.get(2).getName());
    }

    @Test
    @DisplayName("Root object entries without a type are rejected")
    void testInvalidRootObject() throws IOException {
        Config config = createConfig("db.server=SQL01\n" +
                "db.database=Sales\n" +
                "dependency.objects=dbo.Orders\n");

        assertThrows(RuntimeException.class, config::getRootObjects);
    }
}
