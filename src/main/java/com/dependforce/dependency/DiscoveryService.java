package com.dependforce.dependency;

import java.sql.SQLException;
import java.util.Set;

/**
 * Walks the server catalog and returns the dependency tree for a set of roots.
 */
public interface DiscoveryService {

    /**
     * @param roots objects to start from, all on the same server
     * @param includeSystemObjects whether system (ms-shipped) objects are reported
     * @param direction which way to walk
     * @return synthetic tree root whose children are the root objects
     */
    RawTreeNode discover(Set<ObjectIdentity> roots, boolean includeSystemObjects,
                         DependencyDirection direction) throws SQLException;
}
