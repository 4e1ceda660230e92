package com.usatiuk.domtree;

/**
 * Optional-like slot of the node arena, can either be {@link Occupied} or {@link Vacant}.
 *
 * @param <T> the type of the stored node
 */
public sealed interface ArenaSlot<T> permits Occupied, Vacant {
}
