package com.counter.batch;

import com.counter.cluster.ShardRegistry;
import com.counter.metric.Counter;
import com.counter.metric.MetricsRegistry;
import com.counter.metric.Timer;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * Ziyaret artışlarını anahtar başına tek bir bekleyen artışta biriktirip
 * depolamaya toplu halde yazan bileşendir. Kayıt yolu hiçbir zaman depolama
 * G/Ç'si yapmaz. Boşaltma sırasında her anahtar için {@link ShardRegistry#increment}
 * çağrılır; başarılı olursa tam olarak uygulanan miktar tampondan düşülür, yani
 * G/Ç sürerken gelen artışlar kaybolmaz. Başarısız anahtarlar bir sonraki
 * döngüye kalır ve diğer anahtarları engellemez.
 *
 * <p>Tampon boyutu sınıra ulaştığında döngü beklenmeden ek bir boşaltma
 * tetiklenir. Son döngüde yazılamayan anahtarlar bu sınıra sayılmaz; kapalı bir
 * düğümün anahtarları her kayıtta yeni bir döngü başlatmaz. Kapatılırken sınırlı
 * süreli son bir boşaltma denenir; yazılamayan artışlar
 * {@code batch_dropped_increments} metriğine eklenerek düşürülür.
 *
 * <p>Depolamaya yazan her işlem (boşaltmada bir anahtarın yazımı, sıfırlama)
 * anahtarı sahiplenir. Aynı anahtarın sıfırlaması süren yazımın bitmesini bekler;
 * bu bekleme en fazla yeniden deneme sayısı çarpı istek zaman aşımı kadardır.
 * Kayıt ve okuma yolları sahiplenmeye hiç bakmaz, başka anahtarlar da etkilenmez.
 * Boşaltma döngüleri ise {@code flushLock} ile birbirini bekler.
 */
public final class BatchWriter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(BatchWriter.class);
    private static final int STRIPES = 64;

    private final ShardRegistry registry;
    private final int sizeLimit;
    private final long shutdownGraceMillis;
    private final Executor executor;
    private final LongSupplier clock;

    private final ConcurrentHashMap<String, PendingDelta> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Void>> claims = new ConcurrentHashMap<>();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final ReentrantReadWriteLock closeGate = new ReentrantReadWriteLock();
    private final AtomicLongArray writesStarted = new AtomicLongArray(STRIPES);
    private final AtomicLongArray writesFinished = new AtomicLongArray(STRIPES);
    private final AtomicBoolean overflowFlushScheduled = new AtomicBoolean(false);
    private volatile boolean closed;
    private volatile int overflowThreshold;
    private volatile long lastSuccessfulFlushAt;

    private final Counter flushCycles;
    private final Counter flushedKeys;
    private final Counter failedKeys;
    private final Counter partialFailures;
    private final Counter bufferOverflows;
    private final Counter droppedIncrements;
    private final Timer flushTimer;

    public BatchWriter(ShardRegistry registry, int sizeLimit, long shutdownGraceMillis,
                       Executor executor, MetricsRegistry metrics)
    {
        this(registry, sizeLimit, shutdownGraceMillis, executor, metrics, System::currentTimeMillis);
    }

    public BatchWriter(ShardRegistry registry, int sizeLimit, long shutdownGraceMillis,
                       Executor executor, MetricsRegistry metrics, LongSupplier clock)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sizeLimit = sizeLimit;
        this.shutdownGraceMillis = Math.max(0L, shutdownGraceMillis);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.overflowThreshold = sizeLimit;

        MetricsRegistry m = metrics == null ? new MetricsRegistry() : metrics;
        this.flushCycles = m.counter("batch_flush_cycles");
        this.flushedKeys = m.counter("batch_flushed_keys");
        this.failedKeys = m.counter("batch_flush_failed_keys");
        this.partialFailures = m.counter("batch_partial_flush_failures");
        this.bufferOverflows = m.counter("batch_buffer_overflows");
        this.droppedIncrements = m.counter("batch_dropped_increments");
        this.flushTimer = m.timer("batch_flush");
    }

    public void recordIncrement(String key)
    {
        recordIncrement(key, 1L);
    }

    public void recordIncrement(String key, long delta)
    {
        Objects.requireNonNull(key, "key");
        if (delta < 0) {
            throw new IllegalArgumentException("delta must not be negative: " + delta);
        }
        closeGate.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Batch writer is closed");
            }
            if (delta == 0) {
                return;
            }
            pending.merge(key, new PendingDelta(key, delta, clock.getAsLong()), PendingDelta::plus);
        } finally {
            closeGate.readLock().unlock();
        }
        if (sizeLimit > 0 && pending.size() >= overflowThreshold) {
            triggerOverflowFlush();
        }
    }

    private void triggerOverflowFlush()
    {
        if (!overflowFlushScheduled.compareAndSet(false, true)) {
            return;
        }
        bufferOverflows.inc();
        LOG.debugf("Pending buffer reached %d keys, flushing out of cycle", pending.size());
        try {
            executor.execute(() -> {
                try {
                    flushNow();
                } catch (RuntimeException e) {
                    LOG.warn("Out-of-cycle flush failed", e);
                } finally {
                    overflowFlushScheduled.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            overflowFlushScheduled.set(false);
            LOG.warnf("Out-of-cycle flush rejected: %s", e.getMessage());
        }
    }

    /** Henüz yazılmamış artış; yoksa 0. */
    public long pending(String key)
    {
        PendingDelta delta = pending.get(key);
        return delta == null ? 0L : delta.delta();
    }

    /** Bekleyen artışı olan anahtar sayısı. */
    public int pendingSize()
    {
        return pending.size();
    }

    public long pendingIncrements()
    {
        long total = 0L;
        for (PendingDelta delta : pending.values()) {
            total += delta.delta();
        }
        return total;
    }

    public Map<String, Long> pendingSnapshot()
    {
        Map<String, Long> snapshot = new TreeMap<>();
        pending.forEach((key, delta) -> snapshot.put(key, delta.delta()));
        return snapshot;
    }

    /**
     * Bekleyen tüm anahtarları depolamaya yazar. Döngüler birbirini bekler. Başka
     * bir işlemin sahiplendiği anahtar bu döngüde atlanır ve bekler. Tampon hiçbir
     * zaman G/Ç süresince kilitli tutulmaz.
     */
    public FlushReport flushNow()
    {
        flushLock.lock();
        try {
            long started = System.nanoTime();
            List<String> keys = new ArrayList<>(pending.keySet());
            int attempted = 0;
            int flushed = 0;
            int failed = 0;
            long increments = 0L;

            for (String key : keys) {
                CompletableFuture<Void> claim = tryClaim(key);
                if (claim == null) {
                    continue;
                }
                int stripe = stripe(key);
                writesStarted.incrementAndGet(stripe);
                try {
                    PendingDelta current = pending.get(key);
                    if (current == null) {
                        continue;
                    }
                    long delta = current.delta();
                    attempted++;
                    try {
                        registry.increment(key, delta);
                    } catch (RuntimeException e) {
                        failed++;
                        LOG.debugf("Flush of %d increments for key %s failed: %s", delta, key, e.getMessage());
                        continue;
                    }
                    pending.computeIfPresent(key, (k, d) -> d.minus(delta));
                    flushed++;
                    increments += delta;
                } finally {
                    writesFinished.incrementAndGet(stripe);
                    release(key, claim);
                }
            }

            flushCycles.inc();
            flushedKeys.add(flushed);
            failedKeys.add(failed);
            overflowThreshold = sizeLimit + failed;
            if (flushed > 0) {
                lastSuccessfulFlushAt = clock.getAsLong();
            }
            if (failed > 0) {
                partialFailures.inc();
                LOG.warnf("Partial flush failure: %d of %d keys kept for the next cycle", failed, attempted);
            }
            flushTimer.record(System.nanoTime() - started);
            if (attempted > 0) {
                LOG.debugf("Flushed %d increments across %d keys", increments, flushed);
            }
            return new FlushReport(attempted, flushed, failed, increments);
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Anahtarın depolamadaki değerini {@code storageReset} ile sıfırlar ve ancak
     * bu başarılı olursa bekleyen artışı siler. Sıfırlama hata verirse tampon
     * olduğu gibi kalır. Çağrı, aynı anahtarın süren bir yazımı bitene kadar bekler.
     *
     * @return silinen bekleyen artış miktarı
     */
    public long discard(String key, Runnable storageReset)
    {
        Objects.requireNonNull(key, "key");
        CompletableFuture<Void> claim = claim(key);
        int stripe = stripe(key);
        writesStarted.incrementAndGet(stripe);
        try {
            storageReset.run();
            PendingDelta removed = pending.remove(key);
            return removed == null ? 0L : removed.delta();
        } finally {
            writesFinished.incrementAndGet(stripe);
            release(key, claim);
        }
    }

    /**
     * Anahtarın şeridinde süren bir depolama yazımı yoksa o anki damgayı, varsa
     * -1 döndürür. Depolamadan okunan değer {@link #unchangedSince} ile doğrulanır.
     */
    public long writeStamp(String key)
    {
        int stripe = stripe(key);
        long finished = writesFinished.get(stripe);
        long started = writesStarted.get(stripe);
        return started == finished ? started : -1L;
    }

    /** Damga alındığından beri anahtarın şeridinde yeni bir depolama yazımı başlamadıysa {@code true}. */
    public boolean unchangedSince(String key, long stamp)
    {
        return stamp >= 0 && writesStarted.get(stripe(key)) == stamp;
    }

    /** En az bir anahtarın yazıldığı son boşaltmanın zamanı; hiç olmadıysa 0. */
    public long lastSuccessfulFlushAt()
    {
        return lastSuccessfulFlushAt;
    }

    public boolean isClosed()
    {
        return closed;
    }

    private int stripe(String key)
    {
        return (key.hashCode() & 0x7fffffff) % STRIPES;
    }

    private CompletableFuture<Void> tryClaim(String key)
    {
        CompletableFuture<Void> mine = new CompletableFuture<>();
        return claims.putIfAbsent(key, mine) == null ? mine : null;
    }

    private CompletableFuture<Void> claim(String key)
    {
        CompletableFuture<Void> mine = new CompletableFuture<>();
        CompletableFuture<Void> other;
        while ((other = claims.putIfAbsent(key, mine)) != null) {
            other.join();
        }
        return mine;
    }

    private void release(String key, CompletableFuture<Void> claim)
    {
        claims.remove(key, claim);
        claim.complete(null);
    }

    /**
     * Yeni kayıtları reddeder ve {@code shutdownGraceMillis} ile sınırlı son bir
     * boşaltma dener. Süre içinde yazılamayan artışlar düşürülür ve sayılır.
     */
    @Override
    public void close()
    {
        closeGate.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            closeGate.writeLock().unlock();
        }
        CompletableFuture<FlushReport> finalFlush = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    finalFlush.complete(flushNow());
                } catch (Throwable t) {
                    finalFlush.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            finalFlush.completeExceptionally(e);
        }

        try {
            FlushReport report = finalFlush.get(shutdownGraceMillis, TimeUnit.MILLISECONDS);
            LOG.infof("Final flush wrote %d increments across %d keys", report.flushedIncrements(), report.flushed());
        } catch (TimeoutException e) {
            LOG.warnf("Final flush did not finish within %d ms", shutdownGraceMillis);
        } catch (ExecutionException e) {
            LOG.warn("Final flush failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the final flush");
        }

        long dropped = 0L;
        int keys = 0;
        for (String key : new ArrayList<>(pending.keySet())) {
            PendingDelta removed = pending.remove(key);
            if (removed != null) {
                dropped += removed.delta();
                keys++;
            }
        }
        if (dropped > 0) {
            droppedIncrements.add(dropped);
            LOG.errorf("Dropped %d pending increments across %d keys on shutdown", dropped, keys);
        }
    }
}
