package com.wlru.core;

/**
 * Computes how many units of capacity an entry consumes. A weight of zero or
 * less makes {@code put} reject the entry.
 */
@FunctionalInterface
public interface Weigher<K,V>
{
    long weigh(K key, V value);
}
