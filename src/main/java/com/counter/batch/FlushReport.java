package com.counter.batch;

/**
 * Tek bir boşaltma döngüsünün özeti. {@code failed > 0} ise döngü kısmi
 * başarısızlıkla bitmiştir; başarısız anahtarların artışları tamponda kalır.
 */
public record FlushReport(int attempted, int flushed, int failed, long flushedIncrements)
{
    public static final FlushReport EMPTY = new FlushReport(0, 0, 0, 0L);

    public boolean partialFailure()
    {
        return failed > 0;
    }
}
