package com.counter.metric;

import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsComponentsTest
{
    @Nested
    class CounterBehavior
    {
        // Bu test sayaç artışının ve toplamanın değeri doğru güncellediğini doğrular.
        @Test
        void counter_handles_increment_and_add()
        {
            Counter counter = new Counter("batch_dropped_increments");
            counter.inc();
            counter.add(4);
            assertEquals(5, counter.get());
            assertEquals("batch_dropped_increments=5", counter.toString());
        }
    }

    @Nested
    class TimerBehavior
    {
        // Bu test ölçülen işlemin sonucunu döndürüp süresini kaydettiğini gösterir.
        @Test
        void timer_measures_supplier()
        {
            Timer timer = new Timer("storage_get", 16);
            assertEquals("value", timer.time(() -> "value"));
            assertEquals(1, timer.snapshot().count());
        }

        // Bu test işlem hata verse de süresinin kaydedildiğini doğrular.
        @Test
        void timer_records_failed_supplier()
        {
            Timer timer = new Timer("storage_increment", 16);
            assertThrows(IllegalStateException.class, () -> timer.time(() -> {
                throw new IllegalStateException("boom");
            }));
            assertEquals(1, timer.snapshot().count());
        }

        // Bu test süre kayıtlarının istatistiklere yansıtıldığını gösterir.
        @Test
        void timer_aggregates_durations_into_statistics()
        {
            Timer timer = new Timer("batch_flush", 128);
            timer.record(1_000);
            timer.record(2_000);
            Timer.Sample sample = timer.snapshot();
            assertEquals(2, sample.count());
            assertEquals(3_000, sample.totalNs());
            assertEquals(1_000, sample.minNs());
            assertEquals(2_000, sample.maxNs());
        }
    }

    @Nested
    class RegistryBehavior
    {
        // Bu test aynı isim için aynı sayacın döndüğünü ve anlık görüntünün sıralı olduğunu doğrular.
        @Test
        void registry_reuses_components_and_sorts_snapshot()
        {
            MetricsRegistry registry = new MetricsRegistry();
            assertSame(registry.counter("cache_misses"), registry.counter("cache_misses"));
            assertSame(registry.timer("storage_get"), registry.timer("storage_get"));
            registry.counter("cache_hits").add(3);

            Map<String, Long> values = registry.counterValues();
            assertEquals(List.of("cache_hits", "cache_misses"), List.copyOf(values.keySet()));
            assertEquals(3L, values.get("cache_hits"));
        }
    }

    @Nested
    class ReporterBehavior
    {
        // Bu test geçerli aralıkla başlatılan raporlama görevinin çalışıp durdurulabildiğini doğrular.
        @Test
        void reporter_runs_with_valid_interval()
        {
            MetricsRegistry registry = new MetricsRegistry();
            registry.counter("cache_hits").inc();
            registry.timer("storage_get").record(5_000);
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                MetricsReporter reporter = new MetricsReporter(registry, 1, vertx, worker);
                reporter.start(1);
                assertTrue(reporter.isRunning());
                reporter.dump();
                reporter.close();
                assertFalse(reporter.isRunning());
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }

        // Bu test geçersiz aralıkta raporlayıcının başlamadığını gösterir.
        @Test
        void reporter_ignores_invalid_interval()
        {
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                MetricsReporter reporter = new MetricsReporter(new MetricsRegistry(), 0, vertx, worker);
                reporter.start(0);
                assertFalse(reporter.isRunning());
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }
    }
}
