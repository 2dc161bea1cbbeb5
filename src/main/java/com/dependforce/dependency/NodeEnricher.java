package com.dependforce.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns flattened nodes into {@link DependencyRecord}s by resolving each node
 * and its structural parent through a {@link CatalogResolver}.
 */
public class NodeEnricher {

    private static final Logger logger = LoggerFactory.getLogger(NodeEnricher.class);

    /**
     * Records built from a set of nodes plus the nodes that could not be resolved.
     */
    public static class Enrichment {
        private final List<DependencyRecord> records;
        private final List<DependencyException> failures;

        public Enrichment(List<DependencyRecord> records, List<DependencyException> failures) {
            this.records = Collections.unmodifiableList(records);
            this.failures = Collections.unmodifiableList(failures);
        }

        public List<DependencyRecord> getRecords() { return records; }
        public List<DependencyException> getFailures() { return failures; }
        public boolean hasFailures() { return !failures.isEmpty(); }
    }

    /**
     * Builds the record for one node.
     *
     * @param node flattened node
     * @param resolver catalog lookups
     * @param includeScript whether to fetch and normalize the creation script
     * @param originRoot root object whose discovery produced this node
     * @throws DependencyException RESOLUTION if the node or its parent cannot be resolved
     */
    public DependencyRecord enrich(FlatNode node, CatalogResolver resolver, boolean includeScript,
                                   ObjectIdentity originRoot) throws DependencyException {
        ObjectIdentity identity = node.getIdentity();
        CatalogObject object = lookup(resolver, identity);

        DependencyRecord.Builder builder = DependencyRecord.builder(identity)
            .dependentName(object.getName())
            .dependentKind(object.getKind())
            .owner(object.getOwner())
            .schemaBound(object.isSchemaBound())
            .tier(node.getTier())
            .originRootIdentity(originRoot);

        FlatNode parent = node.getStructuralParent();
        if (parent != null && !parent.isSyntheticRoot()) {
            CatalogObject parentObject = lookup(resolver, parent.getIdentity());
            builder.parentIdentity(parent.getIdentity())
                .parentName(parentObject.getName())
                .parentKind(parentObject.getKind());
        }

        if (includeScript) {
            String script;
            try {
                script = resolver.script(identity);
            } catch (Exception e) {
                throw new DependencyException(DependencyException.Kind.RESOLUTION, identity,
                    "Could not script " + identity.getUrn() + ": " + e.getMessage(), e);
            }
            builder.script(ScriptNormalizer.normalize(script));
        }

        return builder.build();
    }

    /**
     * Enriches every node. A node that fails is reported and skipped; the rest continue.
     */
    public Enrichment enrichAll(List<FlatNode> nodes, CatalogResolver resolver, boolean includeScript,
                                ObjectIdentity originRoot) {
        List<DependencyRecord> records = new ArrayList<>(nodes.size());
        List<DependencyException> failures = new ArrayList<>();

        for (FlatNode node : nodes) {
            try {
                records.add(enrich(node, resolver, includeScript, originRoot));
            } catch (DependencyException e) {
                logger.warn("Skipping {}: {}", node.getIdentity() != null ? node.getIdentity().getUrn() : node,
                    e.getMessage());
                failures.add(e);
            }
        }

        return new Enrichment(records, failures);
    }

    private CatalogObject lookup(CatalogResolver resolver, ObjectIdentity identity) throws DependencyException {
        if (identity == null) {
            throw new DependencyException(DependencyException.Kind.RESOLUTION, null,
                "Node has no identity");
        }
        CatalogObject object;
        try {
            object = resolver.resolve(identity);
        } catch (Exception e) {
            throw new DependencyException(DependencyException.Kind.RESOLUTION, identity,
                "Could not resolve " + identity.getUrn() + ": " + e.getMessage(), e);
        }
        if (object == null) {
            throw new DependencyException(DependencyException.Kind.RESOLUTION, identity,
                "Object not found: " + identity.getUrn());
        }
        return object;
    }
}
