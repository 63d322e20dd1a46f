package com.counter.metric;

import com.counter.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Metrik kayıt defterindeki sayaç ve zamanlayıcıları belirli aralıklarla loga
 * yazan yardımcı servistir. Zamanlayıcı Vert.x üzerinde tetiklenir, raporun
 * kendisi worker havuzunda hazırlanır.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, AppProperties properties, Vertx vertx, WorkerExecutor workerExecutor) {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx, workerExecutor);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx, WorkerExecutor workerExecutor) {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init() {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds) {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id ->
                workerExecutor.executeBlocking(promise -> {
                    dump();
                    promise.complete();
                })
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    void dump() {
        if (!LOG.isInfoEnabled()) {
            return;
        }
        LOG.infof("metrics counters %s", registry.counterValues());
        Map<String, Timer> timers = new TreeMap<>(registry.timers());
        timers.values().forEach(timer -> {
            Timer.Sample sample = timer.snapshot();
            if (sample.count() == 0) {
                return;
            }
            LOG.infof("timer %s count=%d avg=%.2fµs p50=%.2fµs p95=%.2fµs min=%.2fµs max=%.2fµs",
                    sample.name(),
                    sample.count(),
                    sample.avgNs() / 1_000.0,
                    sample.p50Ns() / 1_000.0,
                    sample.p95Ns() / 1_000.0,
                    sample.minNs() / 1_000.0,
                    sample.maxNs() / 1_000.0);
        });
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
