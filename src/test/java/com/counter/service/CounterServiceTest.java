package com.counter.service;

import com.counter.batch.BatchWriter;
import com.counter.cluster.HashFn;
import com.counter.cluster.InMemoryStorageNode;
import com.counter.cluster.Retrier;
import com.counter.cluster.ShardRegistry;
import com.counter.cluster.StorageNode;
import com.counter.cluster.StorageUnavailableException;
import com.counter.core.CountCache;
import com.counter.metric.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CounterServiceTest
{
    private static final long TTL_MILLIS = 5_000L;

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private InMemoryStorageNode nodeA;
    private InMemoryStorageNode nodeB;
    private MetricsRegistry metrics;
    private ShardRegistry registry;
    private CountCache cache;
    private BatchWriter writer;
    private CounterService service;

    @BeforeEach
    void setup()
    {
        nodeA = new InMemoryStorageNode("node-a");
        nodeB = new InMemoryStorageNode("node-b");
        metrics = new MetricsRegistry();
        registry = new ShardRegistry(List.of(nodeA, nodeB), HashFn.MD5, 100, new Retrier(2, 0), "visits:",
                metrics, now::get);
        cache = CountCache.builder()
                .segments(1)
                .capacity(100)
                .ttl(Duration.ofMillis(TTL_MILLIS))
                .cleanerPollMillis(0)
                .clock(now::get)
                .metrics(metrics)
                .build();
        writer = new BatchWriter(registry, 1_000, 1_000, Runnable::run, metrics, now::get);
        service = new CounterService(cache, writer, registry, metrics, Runnable::run);
    }

    @AfterEach
    void tearDown()
    {
        cache.close();
    }

    private String keyOwnedBy(String nodeId)
    {
        for (int i = 0; i < 10_000; i++) {
            String key = "page" + i;
            if (registry.route(key).id().equals(nodeId)) {
                return key;
            }
        }
        throw new AssertionError("no key routes to " + nodeId);
    }

    @Nested
    class ReadYourWrites
    {
        // Bu test kaydedilen ziyaretin hemen ardından önbellekten okunduğunu doğrular.
        @Test
        void visit_is_visible_from_cache()
        {
            service.recordVisit("page1");
            CountResult result = service.getCount("page1");
            assertEquals(new CountResult("page1", 1, Source.CACHE, null), result);
            assertEquals(0, nodeA.size() + nodeB.size());
        }

        // Bu test önbellek kaydı yoksa bekleyen artışın sonuca eklendiğini gösterir.
        @Test
        void visit_is_visible_without_cache_entry()
        {
            service.recordVisit("page1");
            cache.invalidate("page1");

            CountResult result = service.getCount("page1");
            assertEquals(1L, result.value());
            assertEquals(Source.BUFFER, result.source());
            assertEquals(registry.route("page1").id(), result.nodeId());
        }

        // Bu test depolamadaki değere bekleyen artışın eklendiğini doğrular.
        @Test
        void stored_value_is_merged_with_pending_delta()
        {
            registry.increment("page1", 10);
            service.recordVisit("page1");
            cache.invalidate("page1");

            CountResult result = service.getCount("page1");
            assertEquals(11L, result.value());
            assertEquals(Source.STORAGE, result.source());
        }

        // Bu test ıskalamadan sonra önbelleğin birleşik değerle doldurulduğunu gösterir.
        @Test
        void miss_repopulates_cache()
        {
            registry.increment("page1", 4);
            assertEquals(Source.STORAGE, service.getCount("page1").source());
            assertEquals(new CountResult("page1", 4, Source.CACHE, null), service.getCount("page1"));
        }

        // Bu test hiç görülmemiş anahtarın sıfır olarak okunduğunu doğrular.
        @Test
        void unknown_key_reads_as_zero()
        {
            CountResult result = service.getCount("never-seen");
            assertEquals(0L, result.value());
            assertEquals(Source.STORAGE, result.source());
        }

        // Bu test boş anahtarın reddedildiğini gösterir.
        @Test
        void blank_key_is_rejected()
        {
            assertThrows(IllegalArgumentException.class, () -> service.recordVisit(" "));
            assertThrows(IllegalArgumentException.class, () -> service.getCount(null));
        }
    }

    @Nested
    class Scenarios
    {
        // Bu test üç ziyaret ve bir boşaltma döngüsünden sonra değerin depolamadan geldiğini doğrular.
        @Test
        void three_visits_then_flush_reads_from_storage()
        {
            service.recordVisit("page1");
            service.recordVisit("page1");
            service.recordVisit("page1");

            now.addAndGet(5_000);
            writer.flushNow();

            CountResult result = service.getCount("page1");
            assertEquals(3L, result.value());
            assertEquals(Source.STORAGE, result.source());
            assertEquals(registry.route("page1").id(), result.nodeId());
        }

        // Bu test TTL dolduktan sonra ilk önbellek kaydının yeniden kullanılmadığını gösterir.
        @Test
        void expired_cache_entry_is_not_reused()
        {
            service.recordVisit("page1");
            assertEquals(Source.CACHE, service.getCount("page1").source());

            now.addAndGet(6_000);

            CountResult second = service.getCount("page1");
            assertNotEquals(Source.CACHE, second.source());
            assertEquals(1L, second.value());
        }

        // Bu test iki düğümlü halkada sağlıksız düğümün anahtarlarının kurtarılana kadar hata verdiğini doğrular.
        @Test
        void two_node_ring_with_one_unhealthy_node()
        {
            String healthyKey = keyOwnedBy("node-a");
            String brokenKey = keyOwnedBy("node-b");
            registry.markUnhealthy("node-b");

            service.recordVisit(healthyKey);
            writer.flushNow();
            cache.clear();
            assertEquals(1L, service.getCount(healthyKey).value());

            StorageUnavailableException thrown =
                    assertThrows(StorageUnavailableException.class, () -> service.getCount(brokenKey));
            assertEquals("node-b", thrown.nodeId());

            registry.probeNow();

            CountResult recovered = service.getCount(brokenKey);
            assertEquals(0L, recovered.value());
            assertEquals("node-b", recovered.nodeId());
        }
    }

    @Nested
    class Unavailability
    {
        // Bu test sahibi erişilemeyen anahtarın önbellek yoksa hata verdiğini, varsa önbellekten döndüğünü gösterir.
        @Test
        void cached_value_survives_owner_outage()
        {
            String key = keyOwnedBy("node-a");
            service.recordVisit(key);
            service.recordVisit(key);
            nodeA.setOnline(false);

            assertEquals(new CountResult(key, 2, Source.CACHE, null), service.getCount(key));

            cache.invalidate(key);
            assertThrows(StorageUnavailableException.class, () -> service.getCount(key));
            assertFalse(registry.healthSnapshot().get("node-a"));
        }

        // Bu test kayıt yolunun depolama kesintisinden etkilenmediğini doğrular.
        @Test
        void recording_works_during_outage()
        {
            String key = keyOwnedBy("node-b");
            nodeB.setOnline(false);
            registry.probeNow();

            assertEquals(1L, service.recordVisit(key));
            assertEquals(2L, service.recordVisit(key));
            assertEquals(2L, writer.pending(key));
        }
    }

    @Nested
    class Reset
    {
        // Bu test sıfırlamadan sonra okunan değerin sıfır olduğunu doğrular.
        @Test
        void reset_then_read_returns_zero()
        {
            service.recordVisit("page1");
            service.recordVisit("page1");
            writer.flushNow();
            service.recordVisit("page1");

            service.resetCount("page1");

            assertEquals(0L, writer.pending("page1"));
            CountResult result = service.getCount("page1");
            assertEquals(0L, result.value());
            assertEquals(Source.STORAGE, result.source());
        }

        // Bu test sıfırlama başarısız olursa önbellek ve tamponun korunduğunu gösterir.
        @Test
        void failed_reset_leaves_state_untouched()
        {
            String key = keyOwnedBy("node-a");
            service.recordVisit(key);
            service.recordVisit(key);
            nodeA.setOnline(false);

            assertThrows(StorageUnavailableException.class, () -> service.resetCount(key));

            assertEquals(2L, writer.pending(key));
            assertEquals(new CountResult(key, 2, Source.CACHE, null), service.getCount(key));
        }
    }

    @Nested
    class Metrics
    {
        // Bu test durum özetinin önbellek, tampon ve düğüm sağlığını yansıttığını doğrular.
        @Test
        void metrics_reflect_state()
        {
            CounterMetrics initial = service.metrics();
            assertEquals(CounterMetrics.HEALTHY, initial.status());
            assertNull(initial.lastSuccessfulFlushAt());

            service.recordVisit("page1");
            service.recordVisit("page2");
            service.getCount("page1");
            service.getCount("missing");

            CounterMetrics metricsNow = service.metrics();
            assertEquals(1, metricsNow.cacheHits());
            assertEquals(1, metricsNow.cacheMisses());
            assertEquals(3, metricsNow.cacheSize());
            assertEquals(2, metricsNow.pendingKeys());
            assertEquals(2, metricsNow.pendingIncrements());
            assertEquals(2, metricsNow.nodes().size());

            writer.flushNow();
            assertEquals(now.get(), service.metrics().lastSuccessfulFlushAt());
        }

        // Bu test düğüm sağlığına göre genel durumun değiştiğini gösterir.
        @Test
        void status_follows_node_health()
        {
            registry.markUnhealthy("node-a");
            assertEquals(CounterMetrics.DEGRADED, service.metrics().status());
            registry.markUnhealthy("node-b");
            assertEquals(CounterMetrics.ERROR, service.metrics().status());
            assertFalse(service.metrics().nodeHealth().get("node-b"));
        }
    }

    @Nested
    class Seeding
    {
        // Bu test depolamada büyük değeri olan anahtara TTL'den sık gelen ziyaretlerin depolama değerini gizlemediğini doğrular.
        @Test
        void steady_traffic_keeps_stored_count_visible()
        {
            registry.increment("page1", 1_000);

            for (int i = 0; i < 20; i++) {
                now.addAndGet(3_000);
                service.recordVisit("page1");
                writer.flushNow();
            }

            CountResult result = service.getCount("page1");
            assertTrue(result.value() >= 1_000L);
            assertEquals(new CountResult("page1", 1_020, Source.CACHE, null), result);
            assertEquals(1_020L, registry.get("page1"));
        }

        // Bu test tohumlama bitene kadar yerel değerin sunulduğunu, sonra depolama değeriyle düzeltildiğini gösterir.
        @Test
        void provisional_entry_is_corrected_by_seed()
        {
            Queue<Runnable> deferred = new ArrayDeque<>();
            CounterService lazy = new CounterService(cache, writer, registry, metrics, deferred::add);
            registry.increment("page1", 1_000);

            assertEquals(1L, lazy.recordVisit("page1"));
            assertEquals(1, deferred.size());
            assertEquals(new CountResult("page1", 1, Source.CACHE, null), lazy.getCount("page1"));

            assertEquals(2L, lazy.recordVisit("page1"));
            assertEquals(1, deferred.size());

            deferred.poll().run();
            assertEquals(new CountResult("page1", 1_002, Source.CACHE, null), lazy.getCount("page1"));
        }

        // Bu test tohumlanamayan kaydın ziyaretlerle uzamadığını ve TTL sonunda depolamadan okunduğunu doğrular.
        @Test
        void unseeded_entry_expires_despite_traffic()
        {
            String key = keyOwnedBy("node-a");
            registry.increment(key, 500);
            nodeA.setOnline(false);
            long opened = now.get();

            service.recordVisit(key);
            now.addAndGet(2_000);
            service.recordVisit(key);
            now.addAndGet(2_000);
            assertEquals(3L, service.recordVisit(key));
            assertEquals(new CountResult(key, 3, Source.CACHE, null), service.getCount(key));

            nodeA.setOnline(true);
            registry.probeNow();
            now.set(opened + TTL_MILLIS);

            CountResult result = service.getCount(key);
            assertEquals(503L, result.value());
            assertEquals(Source.STORAGE, result.source());
        }

        // Bu test depolama okuması bir boşaltmayla çakışırsa kaydın süresinin uzatılmadığını gösterir.
        @Test
        void seed_racing_flush_is_not_trusted()
        {
            InMemoryStorageNode backing = new InMemoryStorageNode("hooked");
            AtomicReference<Runnable> afterGet = new AtomicReference<>(() -> { });
            StorageNode hooked = new StorageNode()
            {
                @Override
                public long incrementBy(String key, long delta) { return backing.incrementBy(key, delta); }

                @Override
                public Long get(String key)
                {
                    Long value = backing.get(key);
                    afterGet.getAndSet(() -> { }).run();
                    return value;
                }

                @Override
                public boolean delete(String key) { return backing.delete(key); }

                @Override
                public void ping() { }

                @Override
                public String id() { return "hooked"; }

                @Override
                public String address() { return "mem://hooked"; }
            };
            ShardRegistry single = new ShardRegistry(List.of(hooked), HashFn.MD5, 10, new Retrier(1, 0), "visits:",
                    metrics, now::get);
            BatchWriter racingWriter = new BatchWriter(single, 1_000, 1_000, Runnable::run, metrics, now::get);
            CounterService racing = new CounterService(cache, racingWriter, single, metrics, Runnable::run);
            single.increment("page1", 10);
            afterGet.set(racingWriter::flushNow);
            long opened = now.get();

            assertEquals(1L, racing.recordVisit("page1"));
            assertEquals(11L, single.get("page1"));

            now.addAndGet(3_000);
            racing.recordVisit("page1");
            now.set(opened + TTL_MILLIS);

            CountResult result = racing.getCount("page1");
            assertEquals(12L, result.value());
            assertEquals(Source.STORAGE, result.source());
        }
    }

    @Nested
    class Concurrency
    {
        // Bu test eşzamanlı ziyaretlerin boşaltmadan sonra eksiksiz sayıldığını doğrular.
        @Test
        void concurrent_visits_are_all_counted() throws Exception
        {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch done = new CountDownLatch(4);
            try {
                for (int t = 0; t < 4; t++) {
                    pool.execute(() -> {
                        for (int i = 0; i < 500; i++) {
                            service.recordVisit("hot");
                            if (i % 100 == 0) {
                                writer.flushNow();
                            }
                        }
                        done.countDown();
                    });
                }
                assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }

            writer.flushNow();
            cache.clear();
            CountResult result = service.getCount("hot");
            assertEquals(2_000L, result.value());
            assertEquals(Source.STORAGE, result.source());
        }
    }
}
