package com.wlru.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Anahtardan {@link RecencyList} tutamacına giden karma tabanlı dizindir. Girdi
 * verisini kendisi tutmaz; yalnızca anahtarın arenadaki konumunu bilir ve
 * sıralama anlamı taşımaz.
 */
final class EntryStore<K>
{
    private final Map<K, Integer> index = new HashMap<>();

    /**
     * @throws DuplicateKeyException anahtar zaten kayıtlıysa; çağıran önce silmelidir
     */
    void insert(K key, int handle)
    {
        Integer previous = index.putIfAbsent(key, handle);
        if (previous != null) {
            throw new DuplicateKeyException(key);
        }
    }

    int lookup(Object key)
    {
        Integer handle = index.get(key);
        return handle == null ? RecencyList.NIL : handle;
    }

    int remove(Object key)
    {
        Integer handle = index.remove(key);
        return handle == null ? RecencyList.NIL : handle;
    }

    int size()
    {
        return index.size();
    }

    Set<Map.Entry<K, Integer>> entries()
    {
        return index.entrySet();
    }

    void clear()
    {
        index.clear();
    }
}
