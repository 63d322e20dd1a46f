package com.counter.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Ziyaret sayacı bileşenlerinin olaylarını (önbellek isabeti, başarısız flush,
 * düşürülen artış...) saymak için kullanılan metriktir. Yoğun yazma altında
 * çekişmeyi azaltmak için {@link LongAdder} kullanır.
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

    @Override
    public String toString() { return name + '=' + get(); }
}
