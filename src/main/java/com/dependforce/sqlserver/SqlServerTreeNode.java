package com.dependforce.sqlserver;

import com.dependforce.dependency.ObjectIdentity;
import com.dependforce.dependency.RawTreeNode;
import com.dependforce.dependency.Urn;

/**
 * Dependency tree node built by {@link SqlServerDiscoveryService}.
 * Links are set while the tree is built and not changed afterwards.
 */
public class SqlServerTreeNode implements RawTreeNode {
    private final Urn urn;
    private final int objectId;
    private final boolean schemaBound;
    private SqlServerTreeNode firstChild;
    private SqlServerTreeNode nextSibling;

    SqlServerTreeNode(Urn urn, int objectId, boolean schemaBound) {
        this.urn = urn;
        this.objectId = objectId;
        this.schemaBound = schemaBound;
    }

    static SqlServerTreeNode syntheticRoot() {
        return new SqlServerTreeNode(null, 0, false);
    }

    @Override
    public SqlServerTreeNode getFirstChild() { return firstChild; }

    @Override
    public SqlServerTreeNode getNextSibling() { return nextSibling; }

    @Override
    public ObjectIdentity getIdentity() { return urn; }

    @Override
    public boolean isSchemaBound() { return schemaBound; }

    public int getObjectId() { return objectId; }

    /**
     * Appends a child after the existing children.
     */
    void addChild(SqlServerTreeNode child) {
        if (firstChild == null) {
            firstChild = child;
            return;
        }
        SqlServerTreeNode last = firstChild;
        while (last.nextSibling != null) {
            last = last.nextSibling;
        }
        last.nextSibling = child;
    }

    @Override
    public String toString() {
        return urn != null ? urn.getUrn() : "<root>";
    }
}
