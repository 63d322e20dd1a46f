package com.counter.core;

import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Zamanı geldiğinde ilgili segmentten düşürülecek anahtarları temsil eden ve
 * {@link java.util.concurrent.DelayQueue} içinde kullanılan kayıt türüdür.
 * Gecikme, önbelleğin kullandığı saat üzerinden hesaplanır.
 */
record ExpiringKey(String key, int segmentIndex, long expireAtMillis, LongSupplier clock) implements Delayed
{
    @Override
    public long getDelay(TimeUnit unit) {
        long d = expireAtMillis - clock.getAsLong();
        return unit.convert(d, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        long d = getDelay(TimeUnit.MILLISECONDS) - o.getDelay(TimeUnit.MILLISECONDS);
        return d == 0 ? 0 : (d < 0 ? -1 : 1);
    }
}
