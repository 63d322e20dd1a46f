package com.counter.service;

import com.counter.cluster.NodeStatus;

import java.util.List;
import java.util.Map;

/**
 * Sayaç servisinin dışarıya raporlanan durum özeti. {@code status} tüm düğümler
 * sağlıklıysa {@code healthy}, bir kısmı sağlıksızsa {@code degraded}, hiçbiri
 * yanıt vermiyorsa {@code error} olur. {@code lastSuccessfulFlushAt} hiç
 * başarılı boşaltma olmadıysa {@code null}'dır.
 */
public record CounterMetrics(String status,
                             long cacheHits,
                             long cacheMisses,
                             int cacheSize,
                             long cacheEvictions,
                             int pendingKeys,
                             long pendingIncrements,
                             Map<String, Boolean> nodeHealth,
                             List<NodeStatus> nodes,
                             Long lastSuccessfulFlushAt,
                             long droppedIncrements,
                             long partialFlushFailures)
{
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String ERROR = "error";
}
