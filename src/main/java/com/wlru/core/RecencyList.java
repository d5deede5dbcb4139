package com.wlru.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Girdileri en eski erişilenden en yeni erişilene doğru sıralayan çift yönlü
 * listedir. Düğümler bağımsız nesneler yerine büyüyebilen paralel dizilerden
 * oluşan bir arena içinde tutulur; her düğüm sabit bir {@code int} tutamaç
 * (handle) ile adreslenir. Serbest bırakılan tutamaçlar serbest listesine
 * eklenir ve sonraki tahsislerde yeniden kullanılır.
 * <p>
 * Bir tutamacın yaşam döngüsü: {@link #allocate} → {@link #pushMostRecent} →
 * ({@link #promote})* → {@link #remove} veya {@link #popLeastRecent} →
 * {@link #release}. Bu sıranın dışına çıkan çağrılar iç hatadır ve
 * {@link IllegalStateException} fırlatır.
 * <p>
 * Sınıf thread-safe değildir; eşzamanlılık {@link WeightedLruCache} kilidiyle sağlanır.
 */
final class RecencyList<K,V>
{
    /** Boş bağlantı ve "tutamaç yok" işareti. */
    static final int NIL = -1;

    private static final int DEFAULT_INITIAL_SLOTS = 16;

    private final int initialSlots;

    private Object[] keys;
    private Object[] values;
    private long[] weights;
    private int[] prev;
    private int[] next;
    private boolean[] linked;

    private int head = NIL;   // least recently used
    private int tail = NIL;   // most recently used
    private int freeHead = NIL;
    private int highWater;    // slots ever handed out
    private int size;

    RecencyList()
    {
        this(DEFAULT_INITIAL_SLOTS);
    }

    RecencyList(int initialSlots)
    {
        this.initialSlots = Math.max(1, initialSlots);
        allocateArrays(this.initialSlots);
    }

    private void allocateArrays(int slots)
    {
        keys = new Object[slots];
        values = new Object[slots];
        weights = new long[slots];
        prev = new int[slots];
        next = new int[slots];
        linked = new boolean[slots];
    }

    /**
     * Yeni bir düğüm için yer ayırır. Düğüm henüz sıraya bağlanmamıştır.
     *
     * @return yeni düğümün tutamacı
     */
    int allocate(K key, V value, long weight)
    {
        Objects.requireNonNull(key);
        int handle;
        if (freeHead != NIL) {
            handle = freeHead;
            freeHead = next[handle];
        } else {
            if (highWater == keys.length) grow();
            handle = highWater++;
        }
        keys[handle] = key;
        values[handle] = value;
        weights[handle] = weight;
        prev[handle] = NIL;
        next[handle] = NIL;
        linked[handle] = false;
        return handle;
    }

    private void grow()
    {
        int newLength = keys.length << 1;
        if (newLength < 0) newLength = Integer.MAX_VALUE - 8;
        keys = Arrays.copyOf(keys, newLength);
        values = Arrays.copyOf(values, newLength);
        weights = Arrays.copyOf(weights, newLength);
        prev = Arrays.copyOf(prev, newLength);
        next = Arrays.copyOf(next, newLength);
        linked = Arrays.copyOf(linked, newLength);
    }

    /** Appends an allocated, unlinked handle at the most-recent end. */
    void pushMostRecent(int handle)
    {
        checkLive(handle);
        if (linked[handle]) {
            throw new IllegalStateException("Handle " + handle + " is already linked");
        }
        linkLast(handle);
    }

    /** Moves a linked handle to the most-recent end. */
    void promote(int handle)
    {
        checkLinked(handle);
        if (handle == tail) return;
        unlink(handle);
        linkLast(handle);
    }

    /**
     * En eski erişilen düğümü sıradan çıkarır. Düğümün verisi {@link #release}
     * çağrılana kadar okunabilir kalır.
     *
     * @return çıkarılan tutamaç ya da liste boşsa {@link #NIL}
     */
    int popLeastRecent()
    {
        int handle = head;
        if (handle == NIL) return NIL;
        unlink(handle);
        return handle;
    }

    /** Unlinks a handle from anywhere in the order. */
    void remove(int handle)
    {
        checkLinked(handle);
        unlink(handle);
    }

    /** Returns an unlinked slot to the free list and drops its references. */
    void release(int handle)
    {
        checkLive(handle);
        if (linked[handle]) {
            throw new IllegalStateException("Handle " + handle + " must be unlinked before release");
        }
        keys[handle] = null;
        values[handle] = null;
        weights[handle] = 0L;
        prev[handle] = NIL;
        next[handle] = freeHead;
        freeHead = handle;
    }

    @SuppressWarnings("unchecked")
    K key(int handle)
    {
        checkLive(handle);
        return (K) keys[handle];
    }

    @SuppressWarnings("unchecked")
    V value(int handle)
    {
        checkLive(handle);
        return (V) values[handle];
    }

    long weight(int handle)
    {
        checkLive(handle);
        return weights[handle];
    }

    boolean isLinked(int handle)
    {
        return handle >= 0 && handle < highWater && keys[handle] != null && linked[handle];
    }

    /** Number of linked handles. */
    int size()
    {
        return size;
    }

    /** Number of slots currently backing the arena. */
    int slotCapacity()
    {
        return keys.length;
    }

    int leastRecent()
    {
        return head;
    }

    int mostRecent()
    {
        return tail;
    }

    /** Visits linked handles from least to most recently used. */
    void forEachFromLeastRecent(IntConsumer action)
    {
        for (int h = head; h != NIL; h = next[h]) {
            action.accept(h);
        }
    }

    /** Drops every node and shrinks the arena back to its initial size. */
    void clear()
    {
        allocateArrays(initialSlots);
        head = tail = freeHead = NIL;
        highWater = 0;
        size = 0;
    }

    private void linkLast(int handle)
    {
        prev[handle] = tail;
        next[handle] = NIL;
        if (tail == NIL) {
            head = handle;
        } else {
            next[tail] = handle;
        }
        tail = handle;
        linked[handle] = true;
        size++;
    }

    private void unlink(int handle)
    {
        int p = prev[handle];
        int n = next[handle];
        if (p == NIL) head = n; else next[p] = n;
        if (n == NIL) tail = p; else prev[n] = p;
        prev[handle] = NIL;
        next[handle] = NIL;
        linked[handle] = false;
        size--;
    }

    private void checkLive(int handle)
    {
        if (handle < 0 || handle >= highWater || keys[handle] == null) {
            throw new IllegalStateException("Handle " + handle + " does not refer to a live node");
        }
    }

    private void checkLinked(int handle)
    {
        checkLive(handle);
        if (!linked[handle]) {
            throw new IllegalStateException("Handle " + handle + " is not linked");
        }
    }
}
