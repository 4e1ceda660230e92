package com.usatiuk.domtree;

import org.pcollections.PVector;

/**
 * Represents a node of the DOM tree, either a tag element or an inner-data (text) leaf.
 * Nodes are immutable, every mutation produces a copy.
 */
public interface DomNode {
    /**
     * Get the UID of the node.
     *
     * @return the UID of the node
     */
    int uid();

    /**
     * Get the UID of the parent node.
     *
     * @return the UID of the parent node, or {@link DomTree#NO_PARENT} for the root
     */
    int parent();

    /**
     * Get the children of this node, in insertion order.
     *
     * @return the UIDs of the child nodes
     */
    PVector<Integer> children();

    /**
     * Get the payload of the node: the tag name for tag nodes, the text for inner-data nodes.
     *
     * @return the payload of the node
     */
    String payload();

    /**
     * Checks whether this node carries inner data rather than a tag.
     *
     * @return true for inner-data nodes
     */
    boolean isInnerData();

    /**
     * Make a copy of this node with a new parent.
     *
     * @param parent the UID of the new parent node
     * @return a new node with the updated parent
     */
    DomNode withParent(int parent);

    /**
     * Make a copy of this node with new children.
     *
     * @param children the new children
     * @return a new node with the updated children
     */
    DomNode withChildren(PVector<Integer> children);

    /**
     * Make a copy of this node with a child appended to its children.
     *
     * @param child the UID of the child
     * @return a new node with the child appended
     */
    default DomNode withChild(int child) {
        return withChildren(children().plus(child));
    }

    /**
     * Make a copy of this node with the first occurrence of a child removed.
     *
     * @param child the UID of the child
     * @return a new node without the child, or this node if it has no such child
     */
    default DomNode withoutChild(int child) {
        var children = children();
        if (!children.contains(child)) return this;
        return withChildren(children.minus(Integer.valueOf(child)));
    }
}
