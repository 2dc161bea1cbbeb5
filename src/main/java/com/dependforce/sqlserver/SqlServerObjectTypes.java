package com.dependforce.sqlserver;

import java.util.Map;

/**
 * Maps sys.objects type descriptions to the object type names used in URNs.
 */
public final class SqlServerObjectTypes {

    private static final Map<String, String> URN_TYPES = Map.ofEntries(
        Map.entry("USER_TABLE", "Table"),
        Map.entry("SYSTEM_TABLE", "Table"),
        Map.entry("VIEW", "View"),
        Map.entry("SQL_STORED_PROCEDURE", "StoredProcedure"),
        Map.entry("CLR_STORED_PROCEDURE", "StoredProcedure"),
        Map.entry("EXTENDED_STORED_PROCEDURE", "ExtendedStoredProcedure"),
        Map.entry("SQL_SCALAR_FUNCTION", "UserDefinedFunction"),
        Map.entry("SQL_INLINE_TABLE_VALUED_FUNCTION", "UserDefinedFunction"),
        Map.entry("SQL_TABLE_VALUED_FUNCTION", "UserDefinedFunction"),
        Map.entry("CLR_SCALAR_FUNCTION", "UserDefinedFunction"),
        Map.entry("CLR_TABLE_VALUED_FUNCTION", "UserDefinedFunction"),
        Map.entry("AGGREGATE_FUNCTION", "UserDefinedAggregate"),
        Map.entry("SQL_TRIGGER", "Trigger"),
        Map.entry("CLR_TRIGGER", "Trigger"),
        Map.entry("SYNONYM", "Synonym"),
        Map.entry("SEQUENCE_OBJECT", "Sequence"),
        Map.entry("TYPE_TABLE", "UserDefinedTableType")
    );

    private SqlServerObjectTypes() {
    }

    /**
     * @param typeDesc value of sys.objects.type_desc
     * @return the URN type, or "Object" for types without a specific mapping
     */
    public static String toUrnType(String typeDesc) {
        if (typeDesc == null) {
            return "Object";
        }
        return URN_TYPES.getOrDefault(typeDesc.trim().toUpperCase(), "Object");
    }

    public static boolean isTable(String urnType) {
        return "Table".equalsIgnoreCase(urnType);
    }
}
