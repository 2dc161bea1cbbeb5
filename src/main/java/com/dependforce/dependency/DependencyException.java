package com.dependforce.dependency;

/**
 * Failure while resolving dependencies for a root object or one of its nodes.
 * The kind tells which stage failed and whether the failure is per root or per node.
 */
public class DependencyException extends Exception {

    public enum Kind {
        /** Root is missing, unparseable, or the batch is empty */
        INVALID_INPUT,
        /** The server behind an identity cannot be determined */
        CONTEXT_RESOLUTION,
        /** The discovery service call failed */
        DISCOVERY,
        /** A single node could not be resolved during enrichment */
        RESOLUTION,
        /** Work was cancelled before this root completed */
        CANCELLED
    }

    private final Kind kind;
    private final ObjectIdentity identity;

    public DependencyException(Kind kind, ObjectIdentity identity, String message) {
        super(message);
        this.kind = kind;
        this.identity = identity;
    }

    public DependencyException(Kind kind, ObjectIdentity identity, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.identity = identity;
    }

    public Kind getKind() { return kind; }

    /**
     * @return the root or node identity the failure concerns; may be null for an empty batch
     */
    public ObjectIdentity getIdentity() { return identity; }

    /**
     * Node-level failures are isolated to the node; everything else stops the root.
     */
    public boolean isNodeLevel() {
        return kind == Kind.RESOLUTION;
    }
}
