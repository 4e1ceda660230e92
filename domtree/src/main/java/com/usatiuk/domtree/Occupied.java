package com.usatiuk.domtree;

/**
 * Arena slot holding a live node.
 *
 * @param node the node
 * @param <T>  the type of the node
 */
public record Occupied<T>(T node) implements ArenaSlot<T> {
}
