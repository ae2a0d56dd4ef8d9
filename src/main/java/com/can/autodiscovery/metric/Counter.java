package com.can.autodiscovery.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Keşif, istemci kurulumu ve hata gibi olayları sayan thread-safe sayaç.
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
