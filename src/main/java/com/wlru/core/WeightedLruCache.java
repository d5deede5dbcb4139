package com.wlru.core;

import com.wlru.core.model.PutResult;
import com.wlru.core.model.RemovalCause;
import com.wlru.metric.Counter;
import com.wlru.metric.MetricsRegistry;
import com.wlru.metric.Timer;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Kapasiteyi girdi sayısıyla değil girdilerin ağırlık toplamıyla ölçen, en eski
 * erişilen girdiyi tahliye eden sınırlı bellek içi önbellektir.
 * <p>
 * Anahtar dizini ({@link EntryStore}), erişim sırası ({@link RecencyList}),
 * ağırlık defteri ({@link CapacityAccountant}) ve tahliye motoru
 * ({@link EvictionEngine}) tek bir {@link ReentrantLock} altında sıralanır.
 * {@code get} erişim sırasını değiştirdiği için salt okunur operasyon yoktur;
 * sorgu metotları da aynı kilidi alır.
 * <p>
 * Her operasyon iki tutarlı durum arasında atomik bir geçiştir: reddedilen bir
 * {@code put} önbellekte hiçbir değişiklik bırakmaz. Silme dinleyicileri kilit
 * bırakıldıktan sonra çağrılır.
 */
public final class WeightedLruCache<K,V>
{
    private static final Logger LOG = Logger.getLogger(WeightedLruCache.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final EntryStore<K> store = new EntryStore<>();
    private final RecencyList<K,V> order;
    private final CapacityAccountant accountant;
    private final EvictionEngine<K,V> evictionEngine;
    private final Weigher<? super K, ? super V> weigher;
    private final CopyOnWriteArrayList<RemovalListener<K,V>> removalListeners = new CopyOnWriteArrayList<>();

    private final Counter hits, misses, evictions, evictedWeight, rejections;
    private final Timer tGet, tPut, tRemove;

    private WeightedLruCache(long capacity, int initialSlots, Weigher<? super K, ? super V> weigher,
                             MetricsRegistry metrics)
    {
        this.order = new RecencyList<>(initialSlots);
        this.accountant = new CapacityAccountant(capacity);
        this.evictionEngine = new EvictionEngine<>(store, order, accountant);
        this.weigher = weigher;

        if (metrics != null) {
            this.hits = metrics.counter("cache_hits");
            this.misses = metrics.counter("cache_misses");
            this.evictions = metrics.counter("cache_evictions");
            this.evictedWeight = metrics.counter("cache_evicted_weight");
            this.rejections = metrics.counter("cache_rejections");
            this.tGet = metrics.timer("cache_get");
            this.tPut = metrics.timer("cache_put");
            this.tRemove = metrics.timer("cache_remove");
        } else {
            this.hits = this.misses = this.evictions = this.evictedWeight = this.rejections = null;
            this.tGet = this.tPut = this.tRemove = null;
        }
    }

    public static <K,V> Builder<K,V> builder() { return new Builder<>(); }

    /**
     * Shorthand for {@code builder().capacity(capacity).build()}.
     *
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public static <K,V> WeightedLruCache<K,V> withCapacity(long capacity)
    {
        return WeightedLruCache.<K,V>builder().capacity(capacity).build();
    }

    /**
     * Önbelleğin kapasitesini, varsayılan ağırlık hesaplayıcısını ve metrik
     * kaydını ayarlamaya yarayan akıcı yapılandırma sınıfıdır.
     */
    public static final class Builder<K,V>
    {
        private long capacity = -1L;
        private int initialSlots = 16;
        private Weigher<? super K, ? super V> weigher = (k, v) -> 1L;
        private MetricsRegistry metrics;

        public Builder<K,V> capacity(long c){ this.capacity = c; return this; }
        public Builder<K,V> initialSlots(int s){ this.initialSlots = s; return this; }
        public Builder<K,V> weigher(Weigher<? super K, ? super V> w){ this.weigher = Objects.requireNonNull(w); return this; }
        public Builder<K,V> metrics(MetricsRegistry m){ this.metrics = m; return this; }

        /**
         * @throws IllegalArgumentException if the capacity is not positive
         */
        public WeightedLruCache<K,V> build()
        {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
            }
            return new WeightedLruCache<>(capacity, initialSlots, weigher, metrics);
        }
    }

    /**
     * Returns the value for {@code key} and marks it most recently used.
     *
     * @return the value, or {@code null} if absent
     */
    public V get(K key)
    {
        long t0 = System.nanoTime();
        Objects.requireNonNull(key);
        V out = null;
        lock.lock();
        try {
            int handle = store.lookup(key);
            if (handle != RecencyList.NIL) {
                order.promote(handle);
                out = order.value(handle);
            }
        } finally {
            lock.unlock();
        }
        if (out != null) {
            if (hits != null) hits.inc();
        } else if (misses != null) misses.inc();
        if (tGet != null) tGet.record(System.nanoTime() - t0);
        return out;
    }

    /**
     * Stores {@code value} with the weight computed by the configured {@link Weigher}.
     */
    public PutResult put(K key, V value)
    {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
        return put(key, value, weigher.weigh(key, value));
    }

    /**
     * Stores {@code value} under {@code key} with the given weight, evicting the
     * least recently used entries until it fits. An existing entry for the key is
     * replaced; its old weight is released before room is made for the new one.
     *
     * @return {@link PutResult#STORED}, or the reason the entry was rejected; a
     *         rejected put leaves the cache unchanged, including any existing entry
     */
    public PutResult put(K key, V value, long weight)
    {
        long t0 = System.nanoTime();
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);

        PutResult result;
        List<Removal<K,V>> removed = new ArrayList<>(1);
        if (weight <= 0) {
            result = PutResult.INVALID_WEIGHT;
        } else if (weight > accountant.capacity()) {
            result = PutResult.WEIGHT_EXCEEDS_CAPACITY;
        } else {
            lock.lock();
            try {
                result = insertLocked(key, value, weight, removed);
            } finally {
                lock.unlock();
            }
        }

        if (!result.isStored() && rejections != null) rejections.inc();
        notifyRemovals(removed);
        if (tPut != null) tPut.record(System.nanoTime() - t0);
        return result;
    }

    private PutResult insertLocked(K key, V value, long weight, List<Removal<K,V>> removed)
    {
        int existing = store.remove(key);
        if (existing != RecencyList.NIL) {
            order.remove(existing);
            accountant.release(order.weight(existing));
            removed.add(new Removal<>(key, order.value(existing), RemovalCause.REPLACED));
            order.release(existing);
        }

        boolean fits = evictionEngine.makeRoom(weight, (evictedKey, evictedValue, w) -> {
            removed.add(new Removal<>(evictedKey, evictedValue, RemovalCause.EVICTED));
            if (evictions != null) evictions.inc();
            if (evictedWeight != null) evictedWeight.add(w);
        });
        if (!fits) {
            // weight <= capacity was checked above, so a drained cache always has room
            return PutResult.WEIGHT_EXCEEDS_CAPACITY;
        }

        int handle = order.allocate(key, value, weight);
        store.insert(key, handle);
        accountant.admit(weight);
        order.pushMostRecent(handle);
        return PutResult.STORED;
    }

    /**
     * @return whether {@code key} was present
     */
    public boolean remove(K key)
    {
        long t0 = System.nanoTime();
        Objects.requireNonNull(key);
        Removal<K,V> removal = null;
        lock.lock();
        try {
            int handle = store.remove(key);
            if (handle != RecencyList.NIL) {
                order.remove(handle);
                accountant.release(order.weight(handle));
                removal = new Removal<>(order.key(handle), order.value(handle), RemovalCause.EXPLICIT);
                order.release(handle);
            }
        } finally {
            lock.unlock();
        }
        if (removal != null) notifyRemovals(List.of(removal));
        if (tRemove != null) tRemove.record(System.nanoTime() - t0);
        return removal != null;
    }

    /** Membership test that does not change the recency order. */
    public boolean containsKey(K key)
    {
        Objects.requireNonNull(key);
        lock.lock();
        try {
            return store.lookup(key) != RecencyList.NIL;
        } finally {
            lock.unlock();
        }
    }

    /** Current aggregate weight of all entries. */
    public long weight()
    {
        lock.lock();
        try {
            return accountant.currentWeight();
        } finally {
            lock.unlock();
        }
    }

    /** Number of entries. */
    public int count()
    {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public long capacity()
    {
        return accountant.capacity();
    }

    /** Drops every entry at once. Removal listeners are not notified. */
    public void clear()
    {
        lock.lock();
        try {
            store.clear();
            order.clear();
            accountant.reset();
        } finally {
            lock.unlock();
        }
    }

    /** Keys from least to most recently used. */
    public List<K> keysInRecencyOrder()
    {
        lock.lock();
        try {
            List<K> keys = new ArrayList<>(order.size());
            order.forEachFromLeastRecent(h -> keys.add(order.key(h)));
            return keys;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Visits a snapshot of the entries from least to most recently used. The
     * consumer runs outside the lock and does not affect the recency order.
     */
    public void forEachEntry(EntryConsumer<? super K, ? super V> consumer)
    {
        Objects.requireNonNull(consumer);
        List<Snapshot<K,V>> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(order.size());
            order.forEachFromLeastRecent(h -> snapshot.add(new Snapshot<>(order.key(h), order.value(h), order.weight(h))));
        } finally {
            lock.unlock();
        }
        for (Snapshot<K,V> entry : snapshot) {
            consumer.accept(entry.key(), entry.value(), entry.weight());
        }
    }

    public AutoCloseable onRemoval(RemovalListener<K,V> listener)
    {
        Objects.requireNonNull(listener);
        removalListeners.add(listener);
        return () -> removalListeners.remove(listener);
    }

    /**
     * Walks the internal structures and verifies that the key index and the
     * recency order are in bijection, that the tracked weight equals the sum of
     * entry weights and fits the capacity, and that every weight is positive.
     *
     * @throws CacheCorruptionException on the first violation found
     */
    public void checkConsistency()
    {
        lock.lock();
        try {
            long capacity = accountant.capacity();
            if (capacity <= 0) {
                throw new CacheCorruptionException("Non-positive capacity " + capacity);
            }
            long[] sum = {0L};
            int[] linked = {0};
            order.forEachFromLeastRecent(h -> {
                long w = order.weight(h);
                if (w <= 0) {
                    throw new CacheCorruptionException("Entry " + order.key(h) + " has non-positive weight " + w);
                }
                if (store.lookup(order.key(h)) != h) {
                    throw new CacheCorruptionException("Linked handle " + h + " is not indexed under " + order.key(h));
                }
                sum[0] += w;
                linked[0]++;
            });
            if (linked[0] != order.size() || linked[0] != store.size()) {
                throw new CacheCorruptionException("Index holds " + store.size() + " keys but order links "
                        + linked[0] + " (tracked " + order.size() + ")");
            }
            for (Map.Entry<K, Integer> e : store.entries()) {
                int h = e.getValue();
                if (!order.isLinked(h) || !e.getKey().equals(order.key(h))) {
                    throw new CacheCorruptionException("Indexed key " + e.getKey() + " points at stale handle " + h);
                }
            }
            if (sum[0] != accountant.currentWeight()) {
                throw new CacheCorruptionException("Tracked weight " + accountant.currentWeight()
                        + " differs from entry sum " + sum[0]);
            }
            if (sum[0] > capacity) {
                throw new CacheCorruptionException("Weight " + sum[0] + " exceeds capacity " + capacity);
            }
        } finally {
            lock.unlock();
        }
    }

    private void notifyRemovals(List<Removal<K,V>> removals)
    {
        if (removals.isEmpty() || removalListeners.isEmpty()) return;
        for (Removal<K,V> removal : removals) {
            for (RemovalListener<K,V> listener : removalListeners) {
                try {
                    listener.onRemoval(removal.key(), removal.value(), removal.cause());
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Removal listener failed for key %s (%s)", removal.key(), removal.cause());
                }
            }
        }
    }

    private record Removal<K,V>(K key, V value, RemovalCause cause) {}

    private record Snapshot<K,V>(K key, V value, long weight) {}
}
