package com.dependforce.dependency;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Node of a discovered dependency tree, linked first-child/next-sibling.
 *
 * The tree returned by discovery has a synthetic root (no identity) whose first
 * child is the root object; the root object's children are what it depends on
 * or what depends on it.
 */
public interface RawTreeNode {

    RawTreeNode getFirstChild();

    RawTreeNode getNextSibling();

    /**
     * @return the object identity, or null for the synthetic tree root
     */
    ObjectIdentity getIdentity();

    boolean isSchemaBound();

    default boolean hasChildNodes() {
        return getFirstChild() != null;
    }

    /**
     * Counts this node and every node reachable through its first-child and
     * next-sibling links.
     */
    default int count() {
        int count = 0;
        Deque<RawTreeNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            RawTreeNode node = stack.pop();
            count++;
            if (node.getNextSibling() != null) {
                stack.push(node.getNextSibling());
            }
            if (node.getFirstChild() != null) {
                stack.push(node.getFirstChild());
            }
        }
        return count;
    }
}
