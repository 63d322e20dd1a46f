package com.counter.core;

import com.counter.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Anahtar başına son bilinen ziyaret sayısını tutan, kapasite ve TTL ile sınırlı
 * önbellektir. Veriler segmentlere bölünür; her segment kendi kilidi ve LRU
 * sırasıyla çalışır. TTL'i dolan kayıt, depolamanın durumundan bağımsız olarak
 * yok sayılır. Arka planda çalışan temizleyici süresi dolan kayıtları
 * {@link DelayQueue} üzerinden düşürür.
 *
 * <p>Depolamadan okunan değerle yazılan kayıtlar tohumlanmış sayılır ve her
 * artışta TTL pencereleri uzar. Yalnızca yerel artışlarla açılan kayıtların
 * süresi uzamaz; {@link #refresh} ile tohumlanana ya da süreleri dolana kadar
 * depolamadaki değeri gizleyebilirler, ama en fazla bir TTL boyunca.
 */
public final class CountCache implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(CountCache.class);

    private final int segments;
    private final CacheSegment[] table;
    private final DelayQueue<ExpiringKey> ttlQueue = new DelayQueue<>();
    private final ScheduledExecutorService cleaner; // null when cleanerPollMillis <= 0
    private final long ttlMillis;
    private final LongSupplier clock;

    private CountCache(int segments, int capacity, Duration ttl, long cleanerPollMillis,
                       LongSupplier clock, MetricsRegistry metrics) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        int bounded = Math.max(1, capacity);
        this.segments = Math.min(Math.max(1, segments), bounded);
        this.ttlMillis = ttl.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.table = new CacheSegment[this.segments];
        int base = bounded / this.segments;
        int remainder = bounded % this.segments;
        for (int i = 0; i < this.segments; i++) {
            int per = base + (i < remainder ? 1 : 0);
            table[i] = metrics == null
                    ? new CacheSegment(per, null, null, null)
                    : new CacheSegment(per, metrics.counter("cache_hits"), metrics.counter("cache_misses"),
                            metrics.counter("cache_evictions"));
        }

        if (cleanerPollMillis > 0) {
            this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "count-cache-cleaner");
                t.setDaemon(true);
                return t;
            });
            cleaner.scheduleWithFixedDelay(this::purgeExpired, cleanerPollMillis, cleanerPollMillis,
                    TimeUnit.MILLISECONDS);
        } else {
            this.cleaner = null;
        }
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Önbelleğin segment sayısı, kapasite, TTL gibi parametrelerini ayarlamaya
     * yarayan akıcı yapılandırma sınıfıdır.
     */
    public static final class Builder
    {
        private int segments = 8, capacity = 1_000; private long cleanerPollMillis = 100;
        private Duration ttl = Duration.ofSeconds(5);
        private LongSupplier clock = System::currentTimeMillis;
        private MetricsRegistry metrics;
        public Builder segments(int s){ this.segments=s; return this; }
        public Builder capacity(int c){ this.capacity=c; return this; }
        public Builder ttl(Duration t){ this.ttl=t; return this; }
        public Builder cleanerPollMillis(long ms){ this.cleanerPollMillis=ms; return this; }
        public Builder clock(LongSupplier c){ this.clock=Objects.requireNonNull(c); return this; }
        public Builder metrics(MetricsRegistry m){ this.metrics=m; return this; }
        public CountCache build(){ return new CountCache(segments, capacity, ttl, cleanerPollMillis, clock, metrics); }
    }

    private int segIndex(String key){ return (key.hashCode() & 0x7fffffff) % segments; }

    /** Geçerli kayıt yoksa ya da TTL'i dolmuşsa {@code null}. */
    public Long get(String key)
    {
        Objects.requireNonNull(key, "key");
        return table[segIndex(key)].lookup(key, clock.getAsLong());
    }

    public void put(String key, long value)
    {
        Objects.requireNonNull(key, "key");
        int idx = segIndex(key);
        CacheEntry entry = table[idx].put(key, value, clock.getAsLong(), ttlMillis);
        track(key, idx, entry);
    }

    public long increment(String key, long delta)
    {
        return increment(key, delta, null).value();
    }

    /**
     * Artışı uygular; {@code alongside} segment kilidi altında, önbellek değişmeden
     * hemen önce çalışır. Böylece aynı anahtarın {@link #load} ve {@link #refresh}
     * hesaplamaları artışın ya tamamını ya da hiçbirini görür.
     */
    public IncrementResult increment(String key, long delta, Runnable alongside)
    {
        Objects.requireNonNull(key, "key");
        int idx = segIndex(key);
        long now = clock.getAsLong();
        CacheEntry entry = table[idx].increment(key, delta, now, ttlMillis, alongside);
        track(key, idx, entry);
        return new IncrementResult(entry.value(), entry.insertedAtMillis() == now && !entry.seeded()
                && entry.value() == delta);
    }

    /**
     * Değeri segment kilidi altında hesaplayıp yazar ve döndürür. Kayıt yalnızca
     * {@code authoritative} doğruysa tohumlanmış sayılır.
     */
    public long load(String key, LongSupplier value, BooleanSupplier authoritative)
    {
        Objects.requireNonNull(key, "key");
        int idx = segIndex(key);
        CacheEntry entry = table[idx].load(key, value, authoritative, clock.getAsLong(), ttlMillis);
        track(key, idx, entry);
        return entry.value();
    }

    /** Tohumlanmamış geçerli bir kaydı depolama değeriyle yeniler; kayıt yoksa bir şey yapmaz. */
    public boolean refresh(String key, LongSupplier value, BooleanSupplier authoritative)
    {
        Objects.requireNonNull(key, "key");
        int idx = segIndex(key);
        CacheEntry entry = table[idx].refresh(key, value, authoritative, clock.getAsLong(), ttlMillis);
        if (entry == null) {
            return false;
        }
        track(key, idx, entry);
        return true;
    }

    public boolean invalidate(String key)
    {
        Objects.requireNonNull(key, "key");
        return table[segIndex(key)].remove(key);
    }

    public void clear() {
        for (CacheSegment segment : table) {
            segment.clear();
        }
        ttlQueue.clear();
    }

    public int size(){ int t=0; for (CacheSegment s : table) t += s.size(); return t; }

    public CacheStats stats()
    {
        long hits = 0, misses = 0, evictions = 0;
        int size = 0;
        for (CacheSegment segment : table) {
            CacheStats s = segment.stats();
            hits += s.hits();
            misses += s.misses();
            evictions += s.evictions();
            size += s.size();
        }
        return new CacheStats(hits, misses, size, evictions);
    }

    public Duration ttl() {
        return Duration.ofMillis(ttlMillis);
    }

    private void track(String key, int idx, CacheEntry entry) {
        if (cleaner != null) {
            ttlQueue.offer(new ExpiringKey(key, idx, entry.expireAtMillis(), clock));
        }
    }

    void purgeExpired() {
        try {
            ExpiringKey ek;
            while ((ek = ttlQueue.poll()) != null) {
                table[ek.segmentIndex()].removeIfMatches(ek.key(), ek.expireAtMillis());
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to purge expired cache entries", e);
        }
    }

    @Override
    public void close(){
        if (cleaner != null) {
            cleaner.shutdownNow();
        }
    }
}
