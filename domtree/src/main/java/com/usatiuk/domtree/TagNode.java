package com.usatiuk.domtree;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.Objects;

/**
 * Tag element node.
 *
 * @param tagName  the tag name
 * @param uid      the UID of the node
 * @param parent   the UID of the parent node
 * @param children the UIDs of the child nodes
 */
public record TagNode(String tagName, int uid, int parent, PVector<Integer> children) implements DomNode {
    public TagNode {
        Objects.requireNonNull(tagName, "tagName");
        Objects.requireNonNull(children, "children");
    }

    public TagNode(String tagName, int uid, int parent) {
        this(tagName, uid, parent, TreePVector.empty());
    }

    @Override
    public String payload() {
        return tagName;
    }

    @Override
    public boolean isInnerData() {
        return false;
    }

    @Override
    public TagNode withParent(int parent) {
        return new TagNode(tagName, uid, parent, children);
    }

    @Override
    public TagNode withChildren(PVector<Integer> children) {
        return new TagNode(tagName, uid, parent, children);
    }
}
