package com.counter.batch;

/**
 * Bir anahtar için henüz depolamaya yazılmamış toplam artış. Her anahtar için
 * tamponda en fazla bir tane bulunur; yeni artışlar mevcut kayda eklenir.
 */
public record PendingDelta(String key, long delta, long firstSeenAtMillis)
{
    PendingDelta plus(PendingDelta other)
    {
        return new PendingDelta(key, delta + other.delta, firstSeenAtMillis);
    }

    /** Uygulanan kısmı düşer; geriye bir şey kalmazsa {@code null}. */
    PendingDelta minus(long applied)
    {
        long remaining = delta - applied;
        return remaining <= 0 ? null : new PendingDelta(key, remaining, firstSeenAtMillis);
    }
}
