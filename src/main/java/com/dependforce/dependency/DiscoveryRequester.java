package com.dependforce.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates a set of root objects and issues one discovery request for them.
 * Failures of the discovery service are wrapped, never retried.
 */
public class DiscoveryRequester {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryRequester.class);

    private final DiscoveryService discoveryService;

    public DiscoveryRequester(DiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    /**
     * Discovers the dependency tree for the given roots.
     *
     * @param roots non-empty set of objects on one server
     * @param includeSystemObjects whether system objects are reported
     * @param direction which way to walk
     * @return synthetic tree root returned by the discovery service
     * @throws DependencyException INVALID_INPUT, CONTEXT_RESOLUTION or DISCOVERY
     */
    public RawTreeNode discover(Set<ObjectIdentity> roots, boolean includeSystemObjects,
                                DependencyDirection direction) throws DependencyException {
        if (roots == null || roots.isEmpty()) {
            throw new DependencyException(DependencyException.Kind.INVALID_INPUT, null,
                "No root objects supplied for discovery");
        }

        String server = null;
        ObjectIdentity first = null;
        for (ObjectIdentity root : roots) {
            String rootServer = resolveServer(root);
            if (server == null) {
                server = rootServer;
                first = root;
            } else if (!server.equalsIgnoreCase(rootServer)) {
                throw new DependencyException(DependencyException.Kind.INVALID_INPUT, root,
                    "Root " + root.getUrn() + " is on server " + rootServer
                        + " but " + first.getUrn() + " is on server " + server);
            }
        }

        logger.debug("Discovering {} for {} root(s) on {}", direction, roots.size(), server);

        ObjectIdentity context = roots.size() == 1 ? first : null;
        RawTreeNode tree;
        try {
            tree = discoveryService.discover(roots, includeSystemObjects, direction);
        } catch (Exception e) {
            throw new DependencyException(DependencyException.Kind.DISCOVERY, context,
                "Discovery failed for " + describe(roots) + ": " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new DependencyException(DependencyException.Kind.DISCOVERY, context,
                "Discovery returned no tree for " + describe(roots));
        }
        return tree;
    }

    private String resolveServer(ObjectIdentity root) throws DependencyException {
        if (root == null || root.getUrn() == null || root.getUrn().trim().isEmpty()) {
            throw new DependencyException(DependencyException.Kind.INVALID_INPUT, root,
                "Root object has no identity");
        }
        Urn urn;
        try {
            urn = Urn.from(root);
        } catch (IllegalArgumentException e) {
            throw new DependencyException(DependencyException.Kind.INVALID_INPUT, root,
                "Root object has an invalid identity: " + e.getMessage(), e);
        }
        String server = urn.getServer();
        if (server == null || server.trim().isEmpty()) {
            throw new DependencyException(DependencyException.Kind.CONTEXT_RESOLUTION, root,
                "Cannot determine the server for " + root.getUrn());
        }
        return server;
    }

    private static String describe(Set<ObjectIdentity> roots) {
        if (roots.size() == 1) {
            return roots.iterator().next().getUrn();
        }
        return roots.size() + " roots";
    }
}
