package com.usatiuk.domtree;

/**
 * Per-tree settings.
 *
 * @param unlinkDeletedFromParent whether {@link DomTree#deleteSubtree(int)} also removes the deleted node
 *                                from its parent's children; if false, the parent keeps a dangling UID
 * @param initialCapacity         initial number of arena slots, values {@code <= 0} mean the default
 */
public record DomTreeOptions(boolean unlinkDeletedFromParent, int initialCapacity) {
    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    public DomTreeOptions {
        if (initialCapacity <= 0)
            initialCapacity = DEFAULT_INITIAL_CAPACITY;
    }

    public static DomTreeOptions defaults() {
        return new DomTreeOptions(true, DEFAULT_INITIAL_CAPACITY);
    }

    public DomTreeOptions withUnlinkDeletedFromParent(boolean unlinkDeletedFromParent) {
        return new DomTreeOptions(unlinkDeletedFromParent, initialCapacity);
    }

    public DomTreeOptions withInitialCapacity(int initialCapacity) {
        return new DomTreeOptions(unlinkDeletedFromParent, initialCapacity);
    }
}
