package com.counter.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Depolama çağrıları ve flush döngüleri gibi işlemlerin sürelerini toplayan
 * zamanlayıcıdır. Sabit boyutlu bir halka tampon üzerinden p50/p95 kestirir,
 * toplam çağrı sayısı ile en küçük/en büyük süreleri saklar.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private volatile long minNs = Long.MAX_VALUE;
    private volatile long maxNs = Long.MIN_VALUE;

    private final int reservoirSize;
    private final long[] reservoir;
    private int idx = 0;

    public Timer(String name) { this(name, 1024); }
    public Timer(String name, int reservoirSize) {
        this.name = name;
        this.reservoirSize = Math.max(128, reservoirSize);
        this.reservoir = new long[this.reservoirSize];
    }

    public <T> T time(Supplier<T> action)
    {
        long t0 = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(System.nanoTime() - t0);
        }
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        if (durationNs < minNs) minNs = durationNs;
        if (durationNs > maxNs) maxNs = durationNs;
        synchronized (reservoir) {
            idx = (idx + 1) % reservoirSize;
            reservoir[idx] = durationNs;
        }
    }

    public Sample snapshot() {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        long min = (minNs == Long.MAX_VALUE) ? 0 : minNs;
        long max = (maxNs == Long.MIN_VALUE) ? 0 : maxNs;

        long[] copy;
        synchronized (reservoir) {
            int filled = (int) Math.min(c, reservoirSize);
            copy = filled == reservoirSize ? reservoir.clone() : Arrays.copyOfRange(reservoir, 1, filled + 1);
        }
        Arrays.sort(copy);
        long p50 = copy.length == 0 ? 0 : copy[(int) (0.50 * (copy.length - 1))];
        long p95 = copy.length == 0 ? 0 : copy[(int) (0.95 * (copy.length - 1))];

        return new Sample(name, c, t, avg, min, max, p50, p95);
    }

    public String name() { return name; }

    /**
     * Zamanlayıcının o anki değerlerini taşıyan değişmez kayıttır.
     */
    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
