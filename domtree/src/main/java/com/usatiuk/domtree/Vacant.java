package com.usatiuk.domtree;

/**
 * Arena slot whose node was deleted, its identifier is waiting in the vacant queue.
 *
 * @param <T> the type of the node
 */
public record Vacant<T>() implements ArenaSlot<T> {
}
