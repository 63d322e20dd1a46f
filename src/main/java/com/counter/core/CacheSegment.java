package com.counter.core;

import com.counter.metric.Counter;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Önbellek kapasitesini parçalara ayırarak eşzamanlı erişimi azaltan segment
 * yapısıdır. Her segment erişim sırası izleyen bir {@link LinkedHashMap} ile
 * LRU düzenini korur; isabet/ıskalama sayaçları arama ile aynı kilit altında
 * güncellenir.
 */
final class CacheSegment
{
    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;
    private final LinkedHashMap<String, CacheEntry> map =
            new LinkedHashMap<>(16, 0.75f, true);
    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;

    private long hits;
    private long misses;
    private long evictions;

    CacheSegment(int capacity, Counter hitCounter, Counter missCounter, Counter evictionCounter)
    {
        this.capacity = Math.max(1, capacity);
        this.hitCounter = hitCounter;
        this.missCounter = missCounter;
        this.evictionCounter = evictionCounter;
    }

    /** TTL'i dolmuş kayıt ıskalama sayılır ve silinir. */
    Long lookup(String key, long now) {
        lock.lock();
        try {
            CacheEntry entry = map.get(key);
            if (entry != null && entry.expired(now)) {
                map.remove(key);
                entry = null;
            }
            if (entry == null) {
                misses++;
                if (missCounter != null) missCounter.inc();
                return null;
            }
            hits++;
            if (hitCounter != null) hitCounter.inc();
            return entry.value();
        }
        finally { lock.unlock(); }
    }

    CacheEntry put(String key, long value, long now, long ttlMillis) {
        lock.lock();
        try {
            CacheEntry entry = new CacheEntry(value, now, now + ttlMillis, true);
            store(key, entry);
            return entry;
        } finally { lock.unlock(); }
    }

    /**
     * Değeri kilit altında hesaplayıp yazar. {@code authoritative} değer hesaplandıktan
     * sonra sorulur; {@code false} dönerse kayıt tohumlanmamış sayılır.
     */
    CacheEntry load(String key, LongSupplier value, BooleanSupplier authoritative, long now, long ttlMillis) {
        lock.lock();
        try {
            long v = value.getAsLong();
            CacheEntry entry = new CacheEntry(v, now, now + ttlMillis, authoritative.getAsBoolean());
            store(key, entry);
            return entry;
        } finally { lock.unlock(); }
    }

    /**
     * Yalnızca yerel artışlardan açılmış ve hâlâ geçerli bir kaydı depolama
     * değeriyle yeniler. Kayıt silinmiş, süresi dolmuş ya da zaten tohumlanmışsa
     * dokunulmaz ve {@code null} döner. Tohumlama doğrulanamazsa değer yazılır ama süre uzatılmaz.
     */
    CacheEntry refresh(String key, LongSupplier value, BooleanSupplier authoritative, long now, long ttlMillis) {
        lock.lock();
        try {
            CacheEntry existing = map.get(key);
            if (existing == null || existing.expired(now) || existing.seeded()) {
                return null;
            }
            long v = value.getAsLong();
            boolean seeded = authoritative.getAsBoolean();
            long expireAt = seeded ? now + ttlMillis : existing.expireAtMillis();
            CacheEntry entry = new CacheEntry(v, existing.insertedAtMillis(), expireAt, seeded);
            map.put(key, entry);
            return entry;
        } finally { lock.unlock(); }
    }

    /**
     * Geçerli bir kayıt varsa değerini artırır, yoksa {@code delta} ile tohumlanmamış
     * yeni bir kayıt açar. TTL penceresi yalnızca tohumlanmış kayıtlarda uzar;
     * yerel artışlardan açılan kayıt ilk süresi dolunca düşer.
     * {@code alongside} aynı kilit altında, kayıt değişmeden önce çalışır; hata
     * fırlatırsa önbellek değişmez.
     */
    CacheEntry increment(String key, long delta, long now, long ttlMillis, Runnable alongside) {
        lock.lock();
        try {
            CacheEntry existing = map.get(key);
            if (alongside != null) {
                alongside.run();
            }
            CacheEntry entry;
            if (existing == null || existing.expired(now)) {
                entry = new CacheEntry(delta, now, now + ttlMillis, false);
            } else if (existing.seeded()) {
                entry = new CacheEntry(existing.value() + delta, existing.insertedAtMillis(), now + ttlMillis, true);
            } else {
                entry = new CacheEntry(existing.value() + delta, existing.insertedAtMillis(),
                        existing.expireAtMillis(), false);
            }
            store(key, entry);
            return entry;
        } finally { lock.unlock(); }
    }

    private void store(String key, CacheEntry entry) {
        if (!map.containsKey(key) && map.size() >= capacity) {
            Iterator<Map.Entry<String, CacheEntry>> it = map.entrySet().iterator();
            if (it.hasNext()) {
                it.next();
                it.remove();
                evictions++;
                if (evictionCounter != null) evictionCounter.inc();
            }
        }
        map.put(key, entry);
    }

    boolean remove(String key) {
        lock.lock();
        try {
            return map.remove(key) != null;
        }
        finally { lock.unlock(); }
    }

    boolean removeIfMatches(String key, long expireAtMillis) {
        lock.lock();
        try {
            CacheEntry existing = map.get(key);
            if (existing == null || existing.expireAtMillis() != expireAtMillis) {
                return false;
            }
            map.remove(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock(); try { return map.size(); } finally { lock.unlock(); }
    }

    CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, map.size(), evictions);
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            map.clear();
        } finally {
            lock.unlock();
        }
    }
}
