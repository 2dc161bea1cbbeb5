package com.dependforce.dependency;

/**
 * Identity of a database object within a server context.
 *
 * Implementations must provide value equality and a stable hash code based on
 * the URN, since deduplication groups records by identity.
 */
public interface ObjectIdentity {

    /**
     * @return the hierarchical, path-like identifier of the object
     */
    String getUrn();
}
