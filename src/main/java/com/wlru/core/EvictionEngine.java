package com.wlru.core;

import org.jboss.logging.Logger;

/**
 * Gelen bir ağırlığa yer açmak için en eski erişilen girdileri sırayla çıkarır.
 * Çıkarılan küme, erişim sırasına göre yeni girdiyi sığdırmaya yetecek en kısa
 * önektir; gereğinden fazla girdi çıkarılmaz.
 */
final class EvictionEngine<K,V>
{
    private static final Logger LOG = Logger.getLogger(EvictionEngine.class);

    private final EntryStore<K> store;
    private final RecencyList<K,V> order;
    private final CapacityAccountant accountant;

    EvictionEngine(EntryStore<K> store, RecencyList<K,V> order, CapacityAccountant accountant)
    {
        this.store = store;
        this.order = order;
        this.accountant = accountant;
    }

    /**
     * Makes room for {@code forWeight}, handing every evicted entry to {@code sink}.
     *
     * @return {@code false} if the cache was drained and the weight still does not fit
     */
    boolean makeRoom(long forWeight, EntryConsumer<K,V> sink)
    {
        while (accountant.wouldExceed(forWeight)) {
            int handle = order.popLeastRecent();
            if (handle == RecencyList.NIL) {
                return false;
            }
            K key = order.key(handle);
            V value = order.value(handle);
            long weight = order.weight(handle);
            if (store.remove(key) != handle) {
                throw new CacheCorruptionException("Evicted handle " + handle + " is not indexed under key " + key);
            }
            accountant.release(weight);
            order.release(handle);
            if (LOG.isDebugEnabled()) {
                LOG.debugf("Evicted key %s (weight %d) to admit weight %d", key, weight, forWeight);
            }
            sink.accept(key, value, weight);
        }
        return true;
    }
}
