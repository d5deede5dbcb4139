package com.wlru.core;

import com.wlru.core.model.RemovalCause;

/**
 * Önbellekten ayrılan her girdi için çağrılır. Dinleyiciler kilit bırakıldıktan
 * sonra çalıştırılır, bu nedenle önbelleğe geri çağrı yapabilirler.
 */
@FunctionalInterface
public interface RemovalListener<K,V>
{
    void onRemoval(K key, V value, RemovalCause cause);
}
