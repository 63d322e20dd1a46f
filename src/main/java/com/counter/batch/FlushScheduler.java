package com.counter.batch;

import com.counter.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BatchWriter} tamponunu sabit aralıklarla boşaltan zamanlayıcıdır. Vert.x
 * periyodik zamanlayıcısı tetiklenir, boşaltmanın kendisi worker havuzunda
 * çalışır. {@link #close()} zamanlayıcıyı iptal eder; süren döngü yazıcının
 * boşaltma kilidi sayesinde son boşaltmadan önce tamamlanır.
 */
@Startup
@Singleton
public class FlushScheduler implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(FlushScheduler.class);

    private final BatchWriter writer;
    private final long intervalMillis;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private long periodicTimerId = -1L;

    @Inject
    public FlushScheduler(BatchWriter writer, AppProperties properties, Vertx vertx, WorkerExecutor workerExecutor)
    {
        this(writer, properties.batch().intervalMillis(), vertx, workerExecutor);
    }

    public FlushScheduler(BatchWriter writer, long intervalMillis, Vertx vertx, WorkerExecutor workerExecutor)
    {
        this.writer = writer;
        this.intervalMillis = intervalMillis;
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
        if (intervalMillis <= 0 || !started.compareAndSet(false, true)) {
            return;
        }
        periodicTimerId = vertx.setPeriodic(intervalMillis, id -> {
            if (!flushing.compareAndSet(false, true)) {
                return;
            }
            workerExecutor.executeBlocking(promise -> {
                try {
                    safeFlush();
                } finally {
                    flushing.set(false);
                }
                promise.complete();
            });
        });
        LOG.debugf("Batch flush scheduled every %d ms", intervalMillis);
    }

    public boolean isRunning()
    {
        return started.get();
    }

    private void safeFlush()
    {
        if (writer.isClosed()) {
            return;
        }
        try {
            writer.flushNow();
        } catch (RuntimeException e) {
            LOG.error("Batch flush cycle failed", e);
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
        if (!started.getAndSet(false)) {
            return;
        }
        if (periodicTimerId >= 0L) {
            vertx.cancelTimer(periodicTimerId);
            periodicTimerId = -1L;
        }
    }
}
