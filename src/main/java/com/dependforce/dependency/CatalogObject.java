package com.dependforce.dependency;

/**
 * Catalog metadata for one object as reported by a {@link CatalogResolver}.
 */
public class CatalogObject {
    private final String name;
    private final String kind;      // Table, View, StoredProcedure, ...
    private final String owner;
    private final boolean schemaBound;

    public CatalogObject(String name, String kind, String owner, boolean schemaBound) {
        this.name = name;
        this.kind = kind;
        this.owner = owner;
        this.schemaBound = schemaBound;
    }

    public String getName() { return name; }
    public String getKind() { return kind; }
    public String getOwner() { return owner; }
    public boolean isSchemaBound() { return schemaBound; }

    @Override
    public String toString() {
        return kind + " " + name + (owner != null ? " (owner " + owner + ")" : "");
    }
}
