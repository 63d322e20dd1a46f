package com.counter.core;

/**
 * Önbellek artışının sonucu.
 *
 * @param opened kayıt bu artışla açıldıysa {@code true}; değer henüz depolamayla
 *               birleştirilmemiştir
 */
public record IncrementResult(long value, boolean opened) {
}
