package com.dependforce.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Flattens a first-child/next-sibling dependency tree into a pre-order list of
 * {@link FlatNode}s, each carrying its tier and structural parent.
 *
 * Tiers are negated when walking dependencies, so that sorting ascending by
 * tier always puts prerequisites first.
 */
public class TreeFlattener {

    private static final Logger logger = LoggerFactory.getLogger(TreeFlattener.class);

    /**
     * Pending visit on the work stack
     */
    private static class Visit {
        final RawTreeNode node;
        final int depth;
        final FlatNode parent;

        Visit(RawTreeNode node, int depth, FlatNode parent) {
            this.node = node;
            this.depth = depth;
            this.parent = parent;
        }
    }

    /**
     * Flattens the tree returned by discovery.
     *
     * Every root object under the synthetic root is walked in order. Without
     * self-inclusion each root's subtree starts at tier 1 under that root, and
     * roots without children contribute nothing.
     *
     * @param tree synthetic tree root; its children are the root objects
     * @param direction discovery direction, decides the tier sign
     * @param includeSelf whether the root objects themselves are emitted (tier 0)
     * @return nodes in pre-order; empty when nothing was discovered
     */
    public List<FlatNode> flatten(RawTreeNode tree, DependencyDirection direction, boolean includeSelf) {
        if (tree == null || tree.getFirstChild() == null) {
            logger.debug("Tree has no root objects, nothing to flatten");
            return Collections.emptyList();
        }

        boolean negate = direction == DependencyDirection.DEPENDENCIES;
        FlatNode syntheticRoot = FlatNode.syntheticRoot();
        List<FlatNode> result = new ArrayList<>();

        for (RawTreeNode self = tree.getFirstChild(); self != null; self = self.getNextSibling()) {
            if (includeSelf) {
                walk(new Visit(self, 0, syntheticRoot), false, negate, result);
            } else if (self.getFirstChild() != null) {
                FlatNode selfNode = new FlatNode(self.getIdentity(), 0, syntheticRoot);
                walk(new Visit(self.getFirstChild(), 1, selfNode), true, negate, result);
            }
        }

        logger.debug("Flattened {} node(s) walking {}", result.size(), direction);
        return result;
    }

    /**
     * Pre-order walk from {@code start}. Siblings of the start node are only
     * followed when {@code followStartSiblings} is set.
     */
    private void walk(Visit start, boolean followStartSiblings, boolean negate, List<FlatNode> result) {
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            Visit visit = stack.pop();
            FlatNode flat = new FlatNode(visit.node.getIdentity(),
                negate ? -visit.depth : visit.depth, visit.parent);
            result.add(flat);

            // sibling is pushed first so the child subtree is visited before it
            RawTreeNode sibling = visit.node.getNextSibling();
            if (sibling != null && (visit != start || followStartSiblings)) {
                stack.push(new Visit(sibling, visit.depth, visit.parent));
            }
            RawTreeNode child = visit.node.getFirstChild();
            if (child != null) {
                stack.push(new Visit(child, visit.depth + 1, flat));
            }
        }
    }
}
