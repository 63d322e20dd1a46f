package com.counter.metric;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıları isimleriyle tutan merkezi kayıt yapısıdır. Metrikler
 * ilk istendiklerinde oluşturulur; aynı isim her zaman aynı örneği döndürür.
 */
public final class MetricsRegistry {
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }
    public Timer timer(String name) { return timers.computeIfAbsent(name, Timer::new); }

    public Map<String, Counter> counters(){ return counters; }
    public Map<String, Timer> timers(){ return timers; }

    /** Sayaç değerlerinin isim sırasına göre kopyası. */
    public Map<String, Long> counterValues() {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((name, counter) -> out.put(name, counter.get()));
        return out;
    }
}
