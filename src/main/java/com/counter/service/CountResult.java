package com.counter.service;

/**
 * Okunan ziyaret sayısı ve kaynağı. {@code nodeId}, değer depolamadan ya da
 * tampondan geldiğinde anahtarın sahibi olan düğümü gösterir; önbellek
 * isabetlerinde {@code null}'dır.
 */
public record CountResult(String key, long value, Source source, String nodeId)
{
    public static CountResult cached(String key, long value)
    {
        return new CountResult(key, value, Source.CACHE, null);
    }

    public boolean fromCache()
    {
        return source == Source.CACHE;
    }
}
