package com.usatiuk.domtree;

import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * In-memory DOM tree.
 * <p>
 * Nodes live in an arena indexed by their UID, nodes refer to each other only by UID.
 * A slot is either occupied by a live node or vacant, vacant UIDs are reused by later insertions,
 * oldest freed first. The root is always the tag node at {@link #ROOT_ID}.
 * <p>
 * Not thread-safe: all calls on one tree must be serialized by the caller.
 */
public class DomTree {
    public static final int ROOT_ID = 0;
    public static final int INVALID_ID = -1;
    public static final int NO_PARENT = -1;

    private static final Logger LOGGER = Logger.getLogger(DomTree.class.getName());
    private static final ArenaSlot<DomNode> VACANT = new Vacant<>();

    private DomTreeOptions _options;
    private ArrayList<ArenaSlot<DomNode>> _nodes;
    private UidAllocator _allocator;

    /**
     * Creates a tree with a root node and default options.
     *
     * @param rootTag tag name of the root node
     */
    public DomTree(String rootTag) {
        this(rootTag, DomTreeOptions.defaults());
    }

    /**
     * Creates a tree with a root node.
     *
     * @param rootTag tag name of the root node
     * @param options tree options
     */
    public DomTree(String rootTag, DomTreeOptions options) {
        _options = Objects.requireNonNull(options, "options");
        _nodes = new ArrayList<>(options.initialCapacity());
        _allocator = new UidAllocator();
        createRoot(rootTag);
    }

    /**
     * Creates a copy of another tree. The copy shares no mutable state with the original.
     *
     * @param other the tree to copy
     */
    public DomTree(DomTree other) {
        _options = other._options;
        _nodes = new ArrayList<>(other._nodes);
        _allocator = new UidAllocator(other._allocator);
    }

    /**
     * Replaces the contents of this tree with a copy of another tree.
     *
     * @param other the tree to copy
     */
    public void assign(DomTree other) {
        if (other == this) return;
        _options = other._options;
        _nodes = new ArrayList<>(other._nodes);
        _allocator = new UidAllocator(other._allocator);
    }

    /**
     * Creates the root node of an empty tree, after the previous root was deleted.
     *
     * @param rootTag tag name of the root node
     * @return {@link #ROOT_ID}, or {@link #INVALID_ID} if the tree still has live nodes
     */
    public int createRoot(String rootTag) {
        Objects.requireNonNull(rootTag, "rootTag");
        if (_allocator.liveCount() != 0) {
            LOGGER.fine(() -> "Root already exists, not creating " + rootTag);
            return INVALID_ID;
        }
        int uid = _allocator.allocate();
        place(new TagNode(rootTag, uid, NO_PARENT));
        return uid;
    }

    /**
     * Checks whether a node with the given UID is live.
     *
     * @param uid the UID
     * @return true if the node exists
     */
    public boolean exists(int uid) {
        return getNode(uid) != null;
    }

    /**
     * Get the node with the given UID.
     *
     * @param uid the UID
     * @return the node, or null if it does not exist
     */
    @Nullable
    public DomNode getNode(int uid) {
        if (uid < 0 || uid >= _nodes.size()) return null;
        if (_nodes.get(uid) instanceof Occupied<DomNode> occupied) return occupied.node();
        return null;
    }

    /**
     * Adds a tag node as the last child of a parent.
     *
     * @param parent  the UID of the parent node
     * @param tagName tag name of the new node
     * @return the UID of the new node, or {@link #INVALID_ID} if the parent does not exist
     */
    public int addNode(int parent, String tagName) {
        Objects.requireNonNull(tagName, "tagName");
        return insert(parent, uid -> new TagNode(tagName, uid, parent));
    }

    /**
     * Adds an inner-data node as the last child of a parent.
     *
     * @param parent the UID of the parent node
     * @param data   the text payload
     * @return the UID of the new node, or {@link #INVALID_ID} if the parent does not exist
     */
    public int addInnerDataNode(int parent, String data) {
        Objects.requireNonNull(data, "data");
        return insert(parent, uid -> new InnerDataNode(uid, parent, data));
    }

    private int insert(int parent, IntFunction<DomNode> nodeFactory) {
        var parentNode = getNode(parent);
        if (parentNode == null) {
            LOGGER.fine(() -> "Parent not found: " + parent);
            return INVALID_ID;
        }

        int uid = _allocator.allocate();
        place(nodeFactory.apply(uid));
        putNode(appendChild(parentNode, uid));
        LOGGER.finer(() -> "Added node " + uid + " under " + parent);
        return uid;
    }

    /**
     * Moves a whole subtree under another parent, appending it to the new parent's children.
     * Fails, changing nothing, if either node does not exist, the subtree root is the tree root,
     * both UIDs are the same, or the new parent is inside the subtree.
     *
     * @param subtreeRoot the UID of the subtree root
     * @param newParent   the UID of the new parent
     * @return true if the subtree was moved
     */
    public boolean moveSubtree(int subtreeRoot, int newParent) {
        var node = getNode(subtreeRoot);
        if (node == null || !exists(newParent)) {
            LOGGER.fine(() -> "Not moving " + subtreeRoot + " to " + newParent + ": node not found");
            return false;
        }
        if (subtreeRoot == ROOT_ID) {
            LOGGER.fine(() -> "Not moving the root to " + newParent);
            return false;
        }
        if (subtreeRoot == newParent) {
            LOGGER.fine(() -> "Not moving " + subtreeRoot + " under itself");
            return false;
        }
        if (getAncestorList(newParent).contains(subtreeRoot)) {
            LOGGER.fine(() -> "Not moving " + subtreeRoot + " to its descendant " + newParent);
            return false;
        }

        var oldParentNode = getExisting(node.parent());
        putNode(oldParentNode.withoutChild(subtreeRoot));

        // Needs to be read after changing the old parent, as it might be the same node
        var newParentNode = getExisting(newParent);
        putNode(appendChild(newParentNode, subtreeRoot));
        putNode(node.withParent(newParent));
        LOGGER.finer(() -> "Moved " + subtreeRoot + " from " + oldParentNode.uid() + " to " + newParent);
        return true;
    }

    /**
     * Deletes a node together with all its descendants, breadth-first.
     * Deleted UIDs become vacant in the order they were visited.
     * Does nothing if the node does not exist.
     *
     * @param subtreeRoot the UID of the subtree root
     */
    public void deleteSubtree(int subtreeRoot) {
        var root = getNode(subtreeRoot);
        if (root == null) {
            LOGGER.finer(() -> "Nothing to delete at " + subtreeRoot);
            return;
        }

        if (_options.unlinkDeletedFromParent() && root.parent() != NO_PARENT) {
            var parentNode = getExisting(root.parent());
            putNode(parentNode.withoutChild(subtreeRoot));
        }

        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(subtreeRoot);
        int deleted = 0;

        while (!queue.isEmpty()) {
            int uid = queue.poll();
            var node = getNode(uid);
            if (node == null) continue;
            // Children have to be collected before the slot is overwritten
            for (var child : node.children()) {
                var childNode = getNode(child);
                // Dangling UIDs left behind by a non-unlinking delete may already belong to another node
                if (childNode != null && childNode.parent() == uid)
                    queue.add(child);
            }
            _nodes.set(uid, VACANT);
            _allocator.release(uid);
            deleted++;
        }

        int finalDeleted = deleted;
        LOGGER.finer(() -> "Deleted " + finalDeleted + " nodes under " + subtreeRoot);
    }

    /**
     * Get the ancestors of a node, starting from its parent and ending with the root.
     *
     * @param uid the UID of the node
     * @return the UIDs of the ancestors, empty for the root and also for a node that does not exist,
     * use {@link #exists(int)} to tell the two apart
     * @throws IllegalStateException if the parent chain is broken or does not reach the root
     */
    @Nonnull
    public List<Integer> getAncestorList(int uid) {
        var node = getNode(uid);
        if (node == null) return List.of();

        ArrayList<Integer> ancestors = new ArrayList<>();
        int bound = _allocator.liveCount();
        while (node.uid() != ROOT_ID) {
            int parent = node.parent();
            node = getNode(parent);
            if (node == null || ancestors.size() >= bound) {
                LOGGER.severe("Broken ancestor chain of " + uid + " at " + parent);
                throw new IllegalStateException("Broken ancestor chain of " + uid + " at " + parent);
            }
            ancestors.add(parent);
        }
        return Collections.unmodifiableList(ancestors);
    }

    /**
     * Get the children of a node.
     *
     * @param uid the UID of the node
     * @return the UIDs of the children in insertion order, empty if the node does not exist
     */
    @Nonnull
    public List<Integer> getChildren(int uid) {
        var node = getNode(uid);
        if (node == null) return List.of();
        return node.children();
    }

    /**
     * Walk the tree breadth-first from the root and apply the given consumer to each node.
     *
     * @param consumer the consumer to apply to each node
     */
    public void walkTree(Consumer<DomNode> consumer) {
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        if (exists(ROOT_ID)) queue.add(ROOT_ID);

        while (!queue.isEmpty()) {
            var node = getNode(queue.poll());
            if (node == null) continue;
            for (var child : node.children()) {
                var childNode = getNode(child);
                if (childNode != null && childNode.parent() == node.uid())
                    queue.add(child);
            }
            consumer.accept(node);
        }
    }

    /**
     * Find the first node, in breadth-first order, matching the given predicate, along with its parent.
     *
     * @param kidPredicate the predicate to match the child node
     * @return a pair of the UID of the matching node and the UID of its parent, or null if not found
     */
    @Nullable
    public Pair<Integer, Integer> findParent(Predicate<DomNode> kidPredicate) {
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        if (exists(ROOT_ID)) queue.add(ROOT_ID);

        while (!queue.isEmpty()) {
            var node = getNode(queue.poll());
            if (node == null) continue;
            for (var child : node.children()) {
                var childNode = getNode(child);
                if (childNode == null || childNode.parent() != node.uid()) continue;
                if (kidPredicate.test(childNode))
                    return Pair.of(child, node.uid());
                queue.add(child);
            }
        }
        return null;
    }

    /**
     * @return the number of live nodes
     */
    public int size() {
        return _allocator.liveCount();
    }

    /**
     * @return the number of arena slots, live or vacant
     */
    public int arenaSize() {
        return _nodes.size();
    }

    /**
     * @return the vacant UIDs, in the order they will be reused
     */
    public List<Integer> vacantUids() {
        return _allocator.vacantUids();
    }

    /**
     * @return the options of this tree
     */
    public DomTreeOptions options() {
        return _options;
    }

    private DomNode getExisting(int uid) {
        var node = getNode(uid);
        if (node == null) {
            LOGGER.severe("Node " + uid + " is referenced but does not exist");
            throw new IllegalStateException("Node " + uid + " is referenced but does not exist");
        }
        return node;
    }

    // A parent may still list the UID from before it was deleted, if deletions don't unlink
    private DomNode appendChild(DomNode parentNode, int child) {
        return parentNode.withoutChild(child).withChild(child);
    }

    private void putNode(DomNode node) {
        _nodes.set(node.uid(), new Occupied<>(node));
    }

    private void place(DomNode node) {
        int uid = node.uid();
        if (uid < _nodes.size()) {
            _nodes.set(uid, new Occupied<>(node));
        } else if (uid == _nodes.size()) {
            _nodes.add(new Occupied<>(node));
        } else {
            throw new IllegalStateException("Uid " + uid + " is past the end of the arena of size " + _nodes.size());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomTree other)) return false;
        return _nodes.equals(other._nodes) && _allocator.equals(other._allocator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_nodes, _allocator);
    }

    @Override
    public String toString() {
        return "DomTree{nodes=" + _nodes + ", allocator=" + _allocator + "}";
    }
}
