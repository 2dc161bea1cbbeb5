package com.dependforce.dependency;

/**
 * One node of a flattened dependency tree. The synthetic tree root is a
 * FlatNode with no identity and no parent.
 */
public final class FlatNode {
    private final ObjectIdentity identity;
    private final int tier;
    private final FlatNode structuralParent;

    public FlatNode(ObjectIdentity identity, int tier, FlatNode structuralParent) {
        this.identity = identity;
        this.tier = tier;
        this.structuralParent = structuralParent;
    }

    static FlatNode syntheticRoot() {
        return new FlatNode(null, 0, null);
    }

    public ObjectIdentity getIdentity() { return identity; }
    public int getTier() { return tier; }
    public FlatNode getStructuralParent() { return structuralParent; }

    public boolean isSyntheticRoot() {
        return identity == null;
    }

    @Override
    public String toString() {
        return "FlatNode{" + (identity != null ? identity.getUrn() : "<root>") + ", tier=" + tier + "}";
    }
}
