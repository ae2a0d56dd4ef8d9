package com.can.autodiscovery.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Keşif ve önbellek işlemlerinin sürelerini toplayan zamanlayıcı. Son
 * ölçümlerden oluşan sabit boyutlu bir örneklem üzerinden p50/p95 değerlerini
 * kestirir.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private final LongAccumulator minNs = new LongAccumulator(Math::min, Long.MAX_VALUE);
    private final LongAccumulator maxNs = new LongAccumulator(Math::max, Long.MIN_VALUE);

    private final long[] reservoir;
    private int idx;

    public Timer(String name) { this(name, 1024); }
    public Timer(String name, int reservoirSize) {
        this.name = name;
        this.reservoir = new long[Math.max(128, reservoirSize)];
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        minNs.accumulate(durationNs);
        maxNs.accumulate(durationNs);
        synchronized (reservoir) {
            reservoir[idx] = durationNs;
            idx = (idx + 1) % reservoir.length;
        }
    }

    public void recordSince(long startNanos)
    {
        record(System.nanoTime() - startNanos);
    }

    public Sample snapshot() {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        long min = c == 0 ? 0 : minNs.get();
        long max = c == 0 ? 0 : maxNs.get();

        long[] copy;
        synchronized (reservoir) {
            copy = Arrays.copyOf(reservoir, (int) Math.min(c, reservoir.length));
        }
        Arrays.sort(copy);
        long p50 = copy.length == 0 ? 0 : copy[(int) (0.50 * (copy.length - 1))];
        long p95 = copy.length == 0 ? 0 : copy[(int) (0.95 * (copy.length - 1))];

        return new Sample(name, c, t, avg, min, max, p50, p95);
    }

    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
