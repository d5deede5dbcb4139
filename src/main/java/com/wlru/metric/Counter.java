package com.wlru.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Önbellek olaylarını (isabet, ıska, tahliye) sayan thread-safe sayaç.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();

    public Counter(String name) { this.name = name; }

    public void inc() { value.increment(); }
    public void add(long delta) { value.add(delta); }
    public long get() { return value.sum(); }
    public String name() { return name; }
}
