package com.counter.service;

import com.counter.batch.BatchWriter;
import com.counter.cluster.ShardRegistry;
import com.counter.cluster.StorageRead;
import com.counter.cluster.StorageUnavailableException;
import com.counter.core.CacheStats;
import com.counter.core.CountCache;
import com.counter.core.IncrementResult;
import com.counter.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Önbellek, toplu yazıcı ve shard kayıt defterini bir araya getiren sayaç
 * servisidir. Ziyaret kaydı yalnızca önbelleği ve bekleyen tamponu günceller;
 * okuma önbellekte yoksa depolamaya tek bir tur atar ve henüz yazılmamış
 * artışı sonuca ekler.
 *
 * <p>Ziyaretle açılan önbellek kaydı yalnızca yerel artışları bilir. Açıldığı
 * anda worker havuzunda depolama okunur ve kayıt depolama değeri ile bekleyen
 * artışın toplamıyla tohumlanır. Tohumlanana kadar, en fazla bir TTL boyunca,
 * depolamada daha büyük değeri olan anahtarlar eksik raporlanabilir.
 *
 * <p>Depolama okuması, aynı anahtar şeridinde bir boşaltma ya da sıfırlama ile
 * çakışırsa değer yazılır ama kayıt tohumlanmış sayılmaz; süresi uzamaz ve bir
 * sonraki ıskalamada yeniden okunur.
 */
public final class CounterService
{
    private static final Logger LOG = Logger.getLogger(CounterService.class);

    private final CountCache cache;
    private final BatchWriter writer;
    private final ShardRegistry registry;
    private final MetricsRegistry metrics;
    private final Executor seedExecutor;

    public CounterService(CountCache cache, BatchWriter writer, ShardRegistry registry, MetricsRegistry metrics,
                          Executor seedExecutor)
    {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = metrics == null ? new MetricsRegistry() : metrics;
        this.seedExecutor = Objects.requireNonNull(seedExecutor, "seedExecutor");
    }

    /**
     * Depolamaya dokunmadan ziyareti kaydeder; önbellekteki güncel değeri döndürür.
     * Önbellek ve tampon aynı segment kilidi altında güncellenir. Kayıt bu ziyaretle
     * açıldıysa tohumlama worker havuzuna bırakılır.
     */
    public long recordVisit(String key)
    {
        requireKey(key);
        IncrementResult result = cache.increment(key, 1L, () -> writer.recordIncrement(key));
        if (result.opened()) {
            scheduleSeed(key);
        }
        return result.value();
    }

    private void scheduleSeed(String key)
    {
        try {
            seedExecutor.execute(() -> seed(key));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Seeding of cache entry %s rejected: %s", key, e.getMessage());
        }
    }

    void seed(String key)
    {
        try {
            long stamp = writer.writeStamp(key);
            StorageRead read = registry.read(key);
            long stored = read.present() ? read.value() : 0L;
            cache.refresh(key, () -> stored + writer.pending(key), () -> writer.unchangedSince(key, stamp));
        } catch (StorageUnavailableException e) {
            LOG.debugf("Cache entry %s left unseeded: %s", key, e.getMessage());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Seeding of cache entry %s failed", key);
        }
    }

    /**
     * Önbellek isabetinde değeri {@link Source#CACHE} ile döndürür. Iskalamada
     * depolamadaki değere bekleyen artışı ekler, önbelleği bu toplamla doldurur.
     *
     * @throws com.counter.cluster.StorageUnavailableException anahtarın düğümüne ulaşılamıyorsa
     */
    public CountResult getCount(String key)
    {
        requireKey(key);
        Long cached = cache.get(key);
        if (cached != null) {
            return CountResult.cached(key, cached);
        }

        long stamp = writer.writeStamp(key);
        StorageRead read = registry.read(key);
        long stored = read.present() ? read.value() : 0L;
        long[] pending = new long[1];
        long total = cache.load(key, () -> {
            pending[0] = writer.pending(key);
            return stored + pending[0];
        }, () -> writer.unchangedSince(key, stamp));

        Source source = !read.present() && pending[0] > 0 ? Source.BUFFER : Source.STORAGE;
        return new CountResult(key, total, source, read.nodeId());
    }

    /**
     * Önce depolamayı sıfırlar; yalnızca bu başarılı olursa bekleyen artışı ve
     * önbellek kaydını siler. Hata durumunda hiçbir şey temizlenmez.
     *
     * @throws com.counter.cluster.StorageUnavailableException sıfırlama yapılamazsa
     */
    public void resetCount(String key)
    {
        requireKey(key);
        long discarded = writer.discard(key, () -> registry.reset(key));
        cache.invalidate(key);
        LOG.debugf("Counter %s reset, %d pending increments discarded", key, discarded);
    }

    public CounterMetrics metrics()
    {
        CacheStats stats = cache.stats();
        Map<String, Boolean> health = registry.healthSnapshot();
        long healthyNodes = health.values().stream().filter(Boolean::booleanValue).count();
        String status;
        if (healthyNodes == health.size()) {
            status = CounterMetrics.HEALTHY;
        } else if (healthyNodes == 0) {
            status = CounterMetrics.ERROR;
        } else {
            status = CounterMetrics.DEGRADED;
        }
        long lastFlush = writer.lastSuccessfulFlushAt();
        return new CounterMetrics(
                status,
                stats.hits(),
                stats.misses(),
                stats.size(),
                stats.evictions(),
                writer.pendingSize(),
                writer.pendingIncrements(),
                health,
                registry.nodeStatuses(),
                lastFlush == 0L ? null : lastFlush,
                metrics.counter("batch_dropped_increments").get(),
                metrics.counter("batch_partial_flush_failures").get()
        );
    }

    public ShardRegistry registry()
    {
        return registry;
    }

    private static void requireKey(String key)
    {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }
}
