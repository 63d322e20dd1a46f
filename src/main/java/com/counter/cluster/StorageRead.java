package com.counter.cluster;

/**
 * Bir okuma işleminin sonucu ile okumayı karşılayan düğümün kimliği.
 * Anahtar depolamada yoksa {@code value} {@code null} olur.
 */
public record StorageRead(Long value, String nodeId)
{
    public boolean present()
    {
        return value != null;
    }
}
