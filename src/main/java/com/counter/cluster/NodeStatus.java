package com.counter.cluster;

/**
 * Bir depolama düğümünün dışarıya raporlanan anlık sağlık görüntüsüdür.
 * {@code lastCheckedAtMillis} henüz yoklama yapılmadıysa 0'dır.
 */
public record NodeStatus(String nodeId, String address, boolean healthy, long lastCheckedAtMillis, String lastError)
{
}
