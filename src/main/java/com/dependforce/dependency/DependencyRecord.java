package com.dependforce.dependency;

/**
 * One discovered dependency, enriched with catalog metadata.
 * Immutable once built.
 */
public final class DependencyRecord {
    private final ObjectIdentity dependentIdentity;
    private final String dependentName;
    private final String dependentKind;
    private final String owner;
    private final boolean schemaBound;
    private final ObjectIdentity parentIdentity;
    private final String parentName;
    private final String parentKind;
    private final int tier;
    private final String script;
    private final ObjectIdentity originRootIdentity;

    private DependencyRecord(Builder builder) {
        this.dependentIdentity = builder.dependentIdentity;
        this.dependentName = builder.dependentName;
        this.dependentKind = builder.dependentKind;
        this.owner = builder.owner;
        this.schemaBound = builder.schemaBound;
        this.parentIdentity = builder.parentIdentity;
        this.parentName = builder.parentName;
        this.parentKind = builder.parentKind;
        this.tier = builder.tier;
        this.script = builder.script;
        this.originRootIdentity = builder.originRootIdentity;
    }

    public static Builder builder(ObjectIdentity dependentIdentity) {
        return new Builder(dependentIdentity);
    }

    public ObjectIdentity getDependentIdentity() { return dependentIdentity; }
    public String getDependentName() { return dependentName; }
    public String getDependentKind() { return dependentKind; }
    public String getOwner() { return owner; }
    public boolean isSchemaBound() { return schemaBound; }
    public ObjectIdentity getParentIdentity() { return parentIdentity; }
    public String getParentName() { return parentName; }
    public String getParentKind() { return parentKind; }
    public int getTier() { return tier; }
    public ObjectIdentity getOriginRootIdentity() { return originRootIdentity; }

    /**
     * @return the normalized creation script, or null if scripting was not requested
     */
    public String getScript() { return script; }

    public boolean hasScript() {
        return script != null;
    }

    @Override
    public String toString() {
        return String.format("%s %s (tier %d, parent %s)", dependentKind, dependentName, tier,
            parentName != null ? parentName : "-");
    }

    public static class Builder {
        private final ObjectIdentity dependentIdentity;
        private String dependentName;
        private String dependentKind;
        private String owner;
        private boolean schemaBound;
        private ObjectIdentity parentIdentity;
        private String parentName;
        private String parentKind;
        private int tier;
        private String script;
        private ObjectIdentity originRootIdentity;

        private Builder(ObjectIdentity dependentIdentity) {
            this.dependentIdentity = dependentIdentity;
        }

        public Builder dependentName(String name) { this.dependentName = name; return this; }
        public Builder dependentKind(String kind) { this.dependentKind = kind; return this; }
        public Builder owner(String owner) { this.owner = owner; return this; }
        public Builder schemaBound(boolean schemaBound) { this.schemaBound = schemaBound; return this; }
        public Builder parentIdentity(ObjectIdentity identity) { this.parentIdentity = identity; return this; }
        public Builder parentName(String name) { this.parentName = name; return this; }
        public Builder parentKind(String kind) { this.parentKind = kind; return this; }
        public Builder tier(int tier) { this.tier = tier; return this; }
        public Builder script(String script) { this.script = script; return this; }
        public Builder originRootIdentity(ObjectIdentity identity) { this.originRootIdentity = identity; return this; }

        public DependencyRecord build() {
            if (dependentIdentity == null) {
                throw new IllegalStateException("Dependent identity is required");
            }
            return new DependencyRecord(this);
        }
    }
}
