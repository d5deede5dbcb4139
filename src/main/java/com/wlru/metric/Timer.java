package com.wlru.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.LongAdder;

/**
 * Önbellek operasyonlarının sürelerini toplayan zamanlayıcıdır. Son ölçümleri
 * sabit boyutlu bir halka tamponda tutarak p50/p95 değerlerini kestirir; toplam
 * çağrı sayısı ile en küçük ve en büyük süreleri ayrıca saklar.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private volatile long minNs = Long.MAX_VALUE;
    private volatile long maxNs = Long.MIN_VALUE;

    private final long[] reservoir;
    private int cursor;
    private int filled;

    public Timer(String name) { this(name, 1024); }

    public Timer(String name, int reservoirSize)
    {
        this.name = name;
        this.reservoir = new long[Math.max(128, reservoirSize)];
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        synchronized (reservoir) {
            if (durationNs < minNs) minNs = durationNs;
            if (durationNs > maxNs) maxNs = durationNs;
            reservoir[cursor] = durationNs;
            cursor = (cursor + 1) % reservoir.length;
            if (filled < reservoir.length) filled++;
        }
    }

    public Sample snapshot()
    {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;

        long[] copy;
        long min;
        long max;
        synchronized (reservoir) {
            copy = Arrays.copyOf(reservoir, filled);
            min = minNs == Long.MAX_VALUE ? 0 : minNs;
            max = maxNs == Long.MIN_VALUE ? 0 : maxNs;
        }
        Arrays.sort(copy);
        long p50 = percentile(copy, 0.50);
        long p95 = percentile(copy, 0.95);

        return new Sample(name, c, t, avg, min, max, p50, p95);
    }

    private static long percentile(long[] sorted, double q)
    {
        if (sorted.length == 0) return 0L;
        return sorted[(int) (q * (sorted.length - 1))];
    }

    /**
     * Zamanlayıcının belirli bir andaki değişmez görüntüsü.
     */
    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
