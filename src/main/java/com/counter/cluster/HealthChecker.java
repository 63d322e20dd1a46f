package com.counter.cluster;

import com.counter.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Depolama düğümlerini belirli aralıklarla PING ile yoklayan arka plan
 * zamanlayıcısıdır. Vert.x periyodik zamanlayıcısı tetiklenir, yoklamanın kendisi
 * ise bloklayan G/Ç içerdiği için paylaşılan worker havuzunda çalışır. Önceki
 * yoklama bitmeden yenisi başlatılmaz.
 */
@Startup
@Singleton
public class HealthChecker implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(HealthChecker.class);

    private final ShardRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean probing = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public HealthChecker(ShardRegistry registry, AppProperties properties, Vertx vertx, WorkerExecutor workerExecutor)
    {
        this(registry, properties.storage().healthCheckIntervalSeconds(), vertx, workerExecutor);
    }

    public HealthChecker(ShardRegistry registry, long intervalSeconds, Vertx vertx, WorkerExecutor workerExecutor)
    {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init()
    {
        start();
    }

    public synchronized void start()
    {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id -> {
            if (!probing.compareAndSet(false, true)) {
                return;
            }
            workerExecutor.executeBlocking(promise -> {
                try {
                    safeProbe();
                } finally {
                    probing.set(false);
                }
                promise.complete();
            });
        });
        LOG.debugf("Storage health checks scheduled every %d seconds", intervalSeconds);
    }

    public boolean isRunning()
    {
        return running.get();
    }

    private void safeProbe()
    {
        try {
            registry.probeNow();
        } catch (RuntimeException e) {
            LOG.error("Storage health probe failed", e);
        }
    }

    @PreDestroy
    void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
