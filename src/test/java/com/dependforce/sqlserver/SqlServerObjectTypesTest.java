package com.dependforce.sqlserver;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlServerObjectTypes Tests")
class SqlServerObjectTypesTest {

    @Test
    @DisplayName("Maps catalog type descriptions to URN types")
    void testToUrnType() {
        assertEquals("Table", SqlServerObjectTypes.toUrnType("USER_TABLE"));
        assertEquals("View", SqlServerObjectTypes.toUrnType("view"));
        assertEquals("StoredProcedure", SqlServerObjectTypes.toUrnType("SQL_STORED_PROCEDURE"));
        assertEquals("UserDefinedFunction", SqlServerObjectTypes.toUrnType("SQL_INLINE_TABLE_VALUED_FUNCTION"));
        assertEquals("Trigger", SqlServerObjectTypes.toUrnType("SQL_TRIGGER"));
        assertEquals("Synonym", SqlServerObjectTypes.toUrnType(" SYNONYM "));
    }

    @Test
    @DisplayName("Unmapped or missing types fall back to Object")
    void testFallback() {
        assertEquals("Object", SqlServerObjectTypes.toUrnType("SERVICE_QUEUE"));
        assertEquals("Object", SqlServerObjectTypes.toUrnType(null));
    }

    @Test
    @DisplayName("Recognizes tables")
    void testIsTable() {
        assertTrue(SqlServerObjectTypes.isTable("table"));
        assertFalse(SqlServerObjectTypes.isTable("View"));
    }
}
