package com.usatiuk.domtree;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.Objects;

/**
 * Inner-data (text) node. Parsers keep these childless, though nothing here forbids children.
 *
 * @param uid      the UID of the node
 * @param parent   the UID of the parent node
 * @param data     the text payload
 * @param children the UIDs of the child nodes
 */
public record InnerDataNode(int uid, int parent, String data, PVector<Integer> children) implements DomNode {
    public InnerDataNode {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(children, "children");
    }

    public InnerDataNode(int uid, int parent, String data) {
        this(uid, parent, data, TreePVector.empty());
    }

    @Override
    public String payload() {
        return data;
    }

    @Override
    public boolean isInnerData() {
        return true;
    }

    @Override
    public InnerDataNode withParent(int parent) {
        return new InnerDataNode(uid, parent, data, children);
    }

    @Override
    public InnerDataNode withChildren(PVector<Integer> children) {
        return new InnerDataNode(uid, parent, data, children);
    }
}
