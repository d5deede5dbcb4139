package com.wlru.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvictionEngineTest
{
    private EntryStore<String> store;
    private RecencyList<String, String> order;
    private CapacityAccountant accountant;
    private EvictionEngine<String, String> engine;
    private List<String> evicted;

    @BeforeEach
    void setup()
    {
        store = new EntryStore<>();
        order = new RecencyList<>();
        accountant = new CapacityAccountant(10);
        engine = new EvictionEngine<>(store, order, accountant);
        evicted = new ArrayList<>();
    }

    // Bu test yer zaten varken hiçbir girdinin çıkarılmadığını doğrular.
    @Test
    void make_room_is_noop_when_weight_fits()
    {
        add("a", 3);
        add("b", 3);
        assertTrue(engine.makeRoom(4, this::record));
        assertTrue(evicted.isEmpty());
        assertEquals(6, accountant.currentWeight());
    }

    // Bu test yalnızca gereken en kısa LRU önekinin çıkarıldığını gösterir.
    @Test
    void make_room_evicts_minimal_lru_prefix()
    {
        add("a", 2);
        add("b", 2);
        add("c", 3);
        add("d", 3);
        assertTrue(engine.makeRoom(4, this::record));
        assertEquals(List.of("a:2", "b:2"), evicted);
        assertEquals(6, accountant.currentWeight());
        assertEquals(RecencyList.NIL, store.lookup("a"));
        assertEquals(RecencyList.NIL, store.lookup("b"));
        assertEquals(2, order.size());
    }

    // Bu test tek bir büyük girdinin çıkarılmasının yeterli olduğu durumda başka girdiye dokunulmadığını doğrular.
    @Test
    void make_room_stops_as_soon_as_weight_fits()
    {
        add("big", 8);
        add("small", 1);
        assertTrue(engine.makeRoom(5, this::record));
        assertEquals(List.of("big:8"), evicted);
        assertEquals(1, accountant.currentWeight());
    }

    // Bu test önbellek boşaldığı hâlde yer açılamadığında false döndüğünü gösterir.
    @Test
    void make_room_reports_insufficient_capacity_after_draining()
    {
        add("a", 4);
        assertFalse(engine.makeRoom(11, this::record));
        assertEquals(List.of("a:4"), evicted);
        assertEquals(0, accountant.currentWeight());
        assertEquals(0, store.size());
    }

    // Bu test dizinde bulunmayan bir LRU tutamacının tutarsızlık olarak raporlandığını doğrular.
    @Test
    void make_room_detects_unindexed_handle()
    {
        int handle = order.allocate("ghost", "v", 10L);
        order.pushMostRecent(handle);
        accountant.admit(10);
        assertThrows(CacheCorruptionException.class, () -> engine.makeRoom(1, this::record));
    }

    private void add(String key, long weight)
    {
        int handle = order.allocate(key, "v-" + key, weight);
        store.insert(key, handle);
        accountant.admit(weight);
        order.pushMostRecent(handle);
    }

    private void record(String key, String value, long weight)
    {
        assertEquals("v-" + key, value);
        evicted.add(key + ":" + weight);
    }
}
