package com.counter.config;

import com.counter.batch.BatchWriter;
import com.counter.cluster.HashFn;
import com.counter.cluster.InMemoryStorageNode;
import com.counter.cluster.NoAvailableNodeException;
import com.counter.cluster.Retrier;
import com.counter.cluster.ShardRegistry;
import com.counter.cluster.StorageNode;
import com.counter.cluster.StorageNodeAddress;
import com.counter.cluster.remote.RedisStorageNode;
import com.counter.core.CountCache;
import com.counter.metric.MetricsRegistry;
import com.counter.service.CounterService;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, depolama düğümleri, shard
 * kayıt defteri, önbellek, toplu yazıcı ve sayaç servisi gibi uygulamanın
 * çalışması için gerekli tüm tekil bean'leri üretir. Değerler {@link AppProperties}
 * üzerinden okunur; Vert.x örneği Quarkus tarafından sağlanır. Her bean için
 * kaynakları serbest bırakan bir dispose metodu bulunur.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public WorkerExecutor workerExecutor(Vertx vertx)
    {
        int poolSize = Math.max(1, properties.worker().poolSize());
        return vertx.createSharedWorkerExecutor("counter-worker", poolSize);
    }

    void disposeWorkerExecutor(@Disposes WorkerExecutor workerExecutor)
    {
        workerExecutor.close();
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public CountCache countCache(MetricsRegistry metrics)
    {
        var cacheProps = properties.cache();
        return CountCache.builder()
                .segments(cacheProps.segments())
                .capacity(cacheProps.capacity())
                .ttl(Duration.ofSeconds(cacheProps.ttlSeconds()))
                .cleanerPollMillis(cacheProps.cleanerPollMillis())
                .metrics(metrics)
                .build();
    }

    void disposeCountCache(@Disposes CountCache cache) {
        cache.close();
    }

    @Produces
    @Singleton
    public ShardRegistry shardRegistry(Vertx vertx, MetricsRegistry metrics)
    {
        var storage = properties.storage();
        List<StorageNode> nodes = storageNodes(storage, vertx);
        Retrier retrier = new Retrier(storage.retryAttempts(), storage.retryBackoffMillis());
        ShardRegistry registry = new ShardRegistry(nodes, HashFn.MD5, storage.virtualNodes(), retrier,
                storage.keyPrefix(), metrics);
        LOG.infof("Shard registry started with %d storage nodes and %d virtual nodes each",
                nodes.size(), storage.virtualNodes());
        return registry;
    }

    void disposeShardRegistry(@Disposes ShardRegistry registry) {
        registry.close();
    }

    static List<StorageNode> storageNodes(AppProperties.Storage storage, Vertx vertx)
    {
        List<String> configured = storage.nodes();
        if (configured == null || configured.isEmpty()) {
            throw new NoAvailableNodeException("app.storage.nodes must list at least one storage node");
        }
        List<StorageNode> nodes = new ArrayList<>(configured.size());
        for (String raw : configured) {
            StorageNodeAddress address = StorageNodeAddress.parse(raw);
            if (address.inMemory()) {
                nodes.add(new InMemoryStorageNode(address.nodeId()));
            } else {
                int database = address.database() >= 0 ? address.database() : storage.database();
                nodes.add(new RedisStorageNode(
                        address.nodeId(),
                        address.host(),
                        address.port(),
                        storage.password().orElse(null),
                        database,
                        storage.connectTimeoutMillis(),
                        storage.requestTimeoutMillis(),
                        vertx));
            }
        }
        return nodes;
    }

    @Produces
    @Singleton
    public BatchWriter batchWriter(ShardRegistry registry, WorkerExecutor workerExecutor, MetricsRegistry metrics)
    {
        var batch = properties.batch();
        return new BatchWriter(registry, batch.sizeLimit(), batch.shutdownGraceMillis(), onWorker(workerExecutor),
                metrics);
    }

    void disposeBatchWriter(@Disposes BatchWriter writer) {
        writer.close();
    }

    @Produces
    @Singleton
    public CounterService counterService(CountCache cache, BatchWriter writer, ShardRegistry registry,
                                         MetricsRegistry metrics, WorkerExecutor workerExecutor)
    {
        return new CounterService(cache, writer, registry, metrics, onWorker(workerExecutor));
    }

    /** Görevleri sırasız olarak paylaşılan worker havuzunda çalıştırır. */
    static Executor onWorker(WorkerExecutor workerExecutor)
    {
        return command -> workerExecutor.executeBlocking(promise -> {
            command.run();
            promise.complete();
        }, false);
    }
}
