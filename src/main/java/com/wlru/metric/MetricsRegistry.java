package com.wlru.metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıları isimleriyle tutan merkezi kayıt. Bir metrik ilk
 * istendiğinde oluşturulur; aynı isimle yapılan sonraki çağrılar aynı örneği döndürür.
 */
public final class MetricsRegistry
{
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }
    public Timer timer(String name) { return timers.computeIfAbsent(name, Timer::new); }

    public Map<String, Counter> counters() { return counters; }
    public Map<String, Timer> timers() { return timers; }

    /** Current counter values ordered by name. */
    public SortedMap<String, Long> counterValues()
    {
        SortedMap<String, Long> out = new TreeMap<>();
        counters.forEach((name, counter) -> out.put(name, counter.get()));
        return out;
    }

    /** Timer samples ordered by name. */
    public List<Timer.Sample> timerSamples()
    {
        List<Timer.Sample> out = new ArrayList<>(timers.size());
        new TreeMap<>(timers).values().forEach(timer -> out.add(timer.snapshot()));
        return out;
    }
}
