package com.counter.cluster;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JVM içinde çalışan depolama düğümüdür. {@code mem://} adresleriyle yerel
 * çalıştırmada ve testlerde kullanılır; {@link #setOnline(boolean)} ile düğüm
 * kapatılarak kesinti senaryoları canlandırılabilir.
 */
public final class InMemoryStorageNode implements StorageNode
{
    private final String id;
    private final Map<String, Long> values = new ConcurrentHashMap<>();
    private volatile boolean online = true;

    public InMemoryStorageNode(String id)
    {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public long incrementBy(String key, long delta)
    {
        ensureOnline();
        return values.merge(key, delta, Long::sum);
    }

    @Override
    public Long get(String key)
    {
        ensureOnline();
        return values.get(key);
    }

    @Override
    public boolean delete(String key)
    {
        ensureOnline();
        return values.remove(key) != null;
    }

    @Override
    public void ping()
    {
        ensureOnline();
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public String address()
    {
        return StorageNodeAddress.MEMORY_SCHEME + "://" + id;
    }

    public void setOnline(boolean online)
    {
        this.online = online;
    }

    public boolean isOnline()
    {
        return online;
    }

    public int size()
    {
        return values.size();
    }

    private void ensureOnline()
    {
        if (!online) {
            throw new StorageNodeException("Storage node " + id + " is offline");
        }
    }

    @Override
    public String toString()
    {
        return "InMemoryStorageNode{" + id + '}';
    }
}
