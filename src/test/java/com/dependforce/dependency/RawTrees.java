package com.dependforce.dependency;

/**
 * Builds in-memory dependency trees for tests.
 */
final class RawTrees {

    static final String SERVER = "SQL01";
    static final String DATABASE = "Sales";

    private RawTrees() {
    }

    static Urn urn(String name) {
        return Urn.of(SERVER, DATABASE, "Table", "dbo", name);
    }

    /**
     * Object node with the given children, linked first-child/next-sibling.
     */
    static Node node(String name, Node... children) {
        Node node = new Node(urn(name), false);
        node.linkChildren(children);
        return node;
    }

    static Node schemaBound(String name, Node... children) {
        Node node = new Node(urn(name), true);
        node.linkChildren(children);
        return node;
    }

    /**
     * Synthetic tree root above the given root objects.
     */
    static Node tree(Node... roots) {
        Node root = new Node(null, false);
        root.linkChildren(roots);
        return root;
    }

    /**
     * Chain of the given depth below a single root object.
     */
    static Node chain(int depth) {
        Node self = node("Level0");
        Node current = self;
        for (int i = 1; i <= depth; i++) {
            Node next = node("Level" + i);
            current.firstChild = next;
            current = next;
        }
        return tree(self);
    }

    static class Node implements RawTreeNode {
        private final ObjectIdentity identity;
        private final boolean schemaBound;
        private Node firstChild;
        private Node nextSibling;

        Node(ObjectIdentity identity, boolean schemaBound) {
            this.identity = identity;
            this.schemaBound = schemaBound;
        }

        private void linkChildren(Node... children) {
            for (int i = 0; i < children.length; i++) {
                if (i == 0) {
                    firstChild = children[0];
                } else {
                    children[i - 1].nextSibling = children[i];
                }
            }
        }

        @Override
        public RawTreeNode getFirstChild() { return firstChild; }

        @Override
        public RawTreeNode getNextSibling() { return nextSibling; }

        @Override
        public ObjectIdentity getIdentity() { return identity; }

        @Override
        public boolean isSchemaBound() { return schemaBound; }
    }
}
