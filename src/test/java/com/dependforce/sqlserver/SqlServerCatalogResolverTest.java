package com.dependforce.sqlserver;

import com.dependforce.dependency.CatalogObject;
import com.dependforce.dependency.Urn;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.*;

import static com.dependforce.sqlserver.JdbcMocks.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("SqlServerCatalogResolver Tests")
class SqlServerCatalogResolverTest {

    private static final Urn ORDERS = Urn.of("SQL01", "Sales", "Table", "dbo", "Orders");
    private static final Urn TOTALS = Urn.of("SQL01", "Sales", "View", "dbo", "vTotals");

    private Connection connection;
    private SqlServerCatalogResolver resolver;

    private List<Map<String, Object>> objectRows;
    private List<Map<String, Object>> moduleRows;
    private List<Map<String, Object>> columnRows;
    private List<Map<String, Object>> synonymRows;
    private int objectQueries;

    @BeforeEach
    void setUp() throws SQLException {
        connection = mock(Connection.class);
        objectRows = List.of();
        moduleRows = List.of();
        columnRows = List.of();
        synonymRows = List.of();
        objectQueries = 0;

        when(connection.getCatalog()).thenReturn("Sales");
        when(connection.prepareStatement(anyString())).thenAnswer(inv -> {
            String sql = inv.getArgument(0);
            if (sql.contains("USER_NAME")) {
                objectQueries++;
                return statement(objectRows);
            }
            if (sql.contains("m.definition")) {
                return statement(moduleRows);
            }
            if (sql.contains("sys.columns")) {
                return statement(columnRows);
            }
            if (sql.contains("base_object_name")) {
                return statement(synonymRows);
            }
            throw new AssertionError("Unexpected query: " + sql);
        });
        resolver = new SqlServerCatalogResolver(connection, 30);
    }

    private static PreparedStatement statement(List<Map<String, Object>> rows) throws SQLException {
        PreparedStatement stmt = mock(PreparedStatement.class);
        when(stmt.executeQuery()).thenAnswer(inv -> resultSet(rows));
        return stmt;
    }

    private static Map<String, Object> column(String name, String type, int maxLength, boolean nullable) {
        return row("name", name, "type_name", type, "max_length", maxLength, "precision", 0, "scale", 0,
            "is_nullable", nullable, "is_identity", false);
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("Maps catalog row to a catalog object")
        void testResolve() throws SQLException {
            objectRows = List.of(row("name", "vTotals", "type_desc", "VIEW", "owner", "dbo", "is_schema_bound", 1));

            CatalogObject object = resolver.resolve(TOTALS);

            assertEquals("vTotals", object.getName());
            assertEquals("View", object.getKind());
            assertEquals("dbo", object.getOwner());
            assertTrue(object.isSchemaBound());
        }

        @Test
        @DisplayName("Unknown object resolves to null")
        void testUnknownObject() throws SQLException {
            assertNull(resolver.resolve(TOTALS));
        }

        @Test
        @DisplayName("Resolved objects are cached")
        void testCaching() throws SQLException {
            objectRows = List.of(row("name", "Orders", "type_desc", "USER_TABLE", "owner", "dbo", "is_schema_bound", 0));

            CatalogObject first = resolver.resolve(ORDERS);
            CatalogObject second = resolver.resolve(Urn.parse(ORDERS.getUrn()));

            assertSame(first, second);
            assertEquals(1, objectQueries);
        }
    }

    @Nested
    @DisplayName("script")
    class ScriptTests {

        @Test
        @DisplayName("Module definitions carry their SET options")
        void testModuleScript() throws SQLException {
            moduleRows = List.of(row("definition", "\nCREATE VIEW dbo.vTotals AS SELECT 1 AS x\n",
                "uses_ansi_nulls", true, "uses_quoted_identifier", false));

            String script = resolver.script(TOTALS);

            assertEquals("SET ANSI_NULLS ON\nGO\nSET QUOTED_IDENTIFIER OFF\nGO\n"
                + "CREATE VIEW dbo.vTotals AS SELECT 1 AS x", script);
        }

        @Test
        @DisplayName("Encrypted modules have no script")
        void testEncryptedModule() throws SQLException {
            moduleRows = List.of(row("uses_ansi_nulls", true, "uses_quoted_identifier", true));

            assertNull(resolver.script(TOTALS));
        }

        @Test
        @DisplayName("Tables are scripted from their columns")
        void testTableScript() throws SQLException {
            Map<String, Object> id = row("name", "OrderId", "type_name", "int", "max_length", 4, "precision", 10,
                "scale", 0, "is_nullable", false, "is_identity", true, "seed_value", 1L, "increment_value", 1L);
            columnRows = List.of(id, column("Customer", "nvarchar", 200, true), column("Notes", "varchar", -1, true));

            String script = resolver.script(ORDERS);

            assertEquals("CREATE TABLE [dbo].[Orders] (\n"
                + "    [OrderId] int IDENTITY(1,1) NOT NULL,\n"
                + "    [Customer] nvarchar(100) NULL,\n"
                + "    [Notes] varchar(MAX) NULL\n"
                + ")", script);
        }

        @Test
        @DisplayName("Table without columns fails")
        void testTableWithoutColumns() {
            assertThrows(SQLException.class, () -> resolver.script(ORDERS));
        }

        @Test
        @DisplayName("Synonyms point at their base object")
        void testSynonymScript() throws SQLException {
            synonymRows = List.of(row("base_object_name", "[Archive].[dbo].[Orders]"));
            Urn synonym = Urn.of("SQL01", "Sales", "Synonym", "dbo", "OldOrders");

            assertEquals("CREATE SYNONYM [dbo].[OldOrders] FOR [Archive].[dbo].[Orders]", resolver.script(synonym));
        }

        @Test
        @DisplayName("Other object types have no script")
        void testNoScript() throws SQLException {
            Urn type = Urn.of("SQL01", "Sales", "Object", "dbo", "Something");

            assertNull(resolver.script(type));
        }
    }

    @Nested
    @DisplayName("formatType")
    class FormatTypeTests {

        @Test
        @DisplayName("Unicode lengths are halved")
        void testUnicode() {
            assertEquals("nvarchar(50)", SqlServerCatalogResolver.formatType("nvarchar", 100, 0, 0));
            assertEquals("nchar(MAX)", SqlServerCatalogResolver.formatType("NCHAR", -1, 0, 0));
        }

        @Test
        @DisplayName("Sized types keep their byte length")
        void testSized() {
            assertEquals("varbinary(16)", SqlServerCatalogResolver.formatType("varbinary", 16, 0, 0));
            assertEquals("varchar(MAX)", SqlServerCatalogResolver.formatType("varchar", -1, 0, 0));
        }

        @Test
        @DisplayName("Decimal and time types carry precision or scale")
        void testPrecision() {
            assertEquals("decimal(18, 2)", SqlServerCatalogResolver.formatType("decimal", 9, 18, 2));
            assertEquals("datetime2(7)", SqlServerCatalogResolver.formatType("datetime2", 8, 27, 7));
            assertEquals("int", SqlServerCatalogResolver.formatType("int", 4, 10, 0));
        }
    }
}
