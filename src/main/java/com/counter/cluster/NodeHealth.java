package com.counter.cluster;

import java.util.Objects;

/**
 * Kayıt defterindeki tek bir düğümün değişebilir sağlık durumunu tutar. Geçişler
 * senkronize metotlarla yapılır; dönüş değeri durumun gerçekten değişip
 * değişmediğini bildirir.
 */
final class NodeHealth
{
    private final StorageNode node;
    private boolean healthy = true;
    private long lastCheckedAtMillis;
    private String lastError;

    NodeHealth(StorageNode node)
    {
        this.node = Objects.requireNonNull(node, "node");
    }

    StorageNode node()
    {
        return node;
    }

    synchronized boolean healthy()
    {
        return healthy;
    }

    synchronized boolean markHealthy(long now)
    {
        lastCheckedAtMillis = now;
        lastError = null;
        boolean changed = !healthy;
        healthy = true;
        return changed;
    }

    synchronized boolean markUnhealthy(long now, String reason)
    {
        lastCheckedAtMillis = now;
        lastError = reason;
        boolean changed = healthy;
        healthy = false;
        return changed;
    }

    synchronized NodeStatus status()
    {
        return new NodeStatus(node.id(), node.address(), healthy, lastCheckedAtMillis, lastError);
    }
}
