package com.counter;

import com.counter.batch.BatchWriter;
import com.counter.batch.FlushScheduler;
import com.counter.cluster.HealthChecker;
import com.counter.cluster.ShardRegistry;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Başlangıçta düğümleri bir kez yoklar; kapanışta önce zamanlayıcıları durdurur,
 * ardından bean'ler yok edilmeden tampondaki artışları son kez boşaltır.
 */
@Singleton
class CounterLifecycle {
    private static final Logger LOG = Logger.getLogger(CounterLifecycle.class);

    private final ShardRegistry registry;
    private final BatchWriter writer;
    private final FlushScheduler flushScheduler;
    private final HealthChecker healthChecker;

    CounterLifecycle(ShardRegistry registry, BatchWriter writer, FlushScheduler flushScheduler,
                     HealthChecker healthChecker) {
        this.registry = registry;
        this.writer = writer;
        this.flushScheduler = flushScheduler;
        this.healthChecker = healthChecker;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Visit counter started, storage nodes %s", registry.probeNow());
    }

    void onStop(@Observes ShutdownEvent event) {
        flushScheduler.close();
        healthChecker.close();
        writer.close();
        LOG.info("Visit counter stopped");
    }
}
