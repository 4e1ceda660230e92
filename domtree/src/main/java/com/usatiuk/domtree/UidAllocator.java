package com.usatiuk.domtree;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Issues node UIDs, reusing the UIDs of deleted nodes in FIFO order (oldest freed first).
 * <p>
 * Whenever no node is live, UID {@link DomTree#ROOT_ID} is handed out, so an emptied tree
 * can never end up with a root-like node anywhere but in slot 0.
 */
class UidAllocator {
    private static final Logger LOGGER = Logger.getLogger(UidAllocator.class.getName());

    private final ArrayDeque<Integer> _vacant;
    private int _highWater = 0;
    private int _liveCount = 0;

    public UidAllocator() {
        _vacant = new ArrayDeque<>();
    }

    /**
     * Creates an independent copy of another allocator.
     *
     * @param other the allocator to copy
     */
    public UidAllocator(UidAllocator other) {
        _vacant = new ArrayDeque<>(other._vacant);
        _highWater = other._highWater;
        _liveCount = other._liveCount;
    }

    /**
     * Allocates a new UID. Never fails, the arena grows if there is nothing to reuse.
     *
     * @return the allocated UID
     */
    public int allocate() {
        int uid;
        if (_liveCount == 0) {
            _vacant.remove(DomTree.ROOT_ID);
            uid = DomTree.ROOT_ID;
            if (_highWater == 0) _highWater = 1;
        } else if (!_vacant.isEmpty()) {
            uid = _vacant.poll();
        } else {
            uid = _highWater++;
        }
        _liveCount++;
        LOGGER.finer(() -> "Allocated uid " + uid + ", live: " + _liveCount);
        return uid;
    }

    /**
     * Returns a UID to the back of the vacant queue.
     *
     * @param uid the UID of a deleted node
     * @throws IllegalStateException if no UIDs are live, the UID was never issued or is already vacant
     */
    public void release(int uid) {
        if (_liveCount == 0)
            throw new IllegalStateException("Releasing uid " + uid + " with no live uids");
        if (uid < 0 || uid >= _highWater)
            throw new IllegalStateException("Releasing uid " + uid + " that was never issued");
        if (_vacant.contains(uid))
            throw new IllegalStateException("Releasing uid " + uid + " twice");
        _vacant.add(uid);
        _liveCount--;
    }

    /**
     * @return the number of live UIDs
     */
    public int liveCount() {
        return _liveCount;
    }

    /**
     * @return one past the largest UID ever issued, which is the size the arena needs
     */
    public int highWater() {
        return _highWater;
    }

    /**
     * @return the vacant UIDs, in the order they will be reused
     */
    public List<Integer> vacantUids() {
        return List.copyOf(_vacant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UidAllocator other)) return false;
        return _highWater == other._highWater
                && _liveCount == other._liveCount
                && Arrays.equals(_vacant.toArray(), other._vacant.toArray());
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(_highWater);
        result = 31 * result + Integer.hashCode(_liveCount);
        result = 31 * result + Arrays.hashCode(_vacant.toArray());
        return result;
    }

    @Override
    public String toString() {
        return "UidAllocator{highWater=" + _highWater + ", live=" + _liveCount + ", vacant=" + _vacant + "}";
    }
}
