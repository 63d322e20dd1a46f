package com.counter.cluster;

import com.counter.metric.Counter;
import com.counter.metric.MetricsRegistry;
import com.counter.metric.Timer;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.BiFunction;
import java.util.function.LongSupplier;

/**
 * Anahtarları tutarlı hash halkası üzerinden sahibi olan depolama düğümüne
 * yönlendiren ve her ilkel işlemi sınırlı yeniden deneme ile çalıştıran kayıt
 * defteridir. Yeniden deneme bütçesi tükendiğinde düğüm sağlıksız işaretlenir
 * ve çağırana {@link StorageUnavailableException} döner. Sağlıksız düğüme giden
 * çağrılar G/Ç yapmadan hemen reddedilir; düğüm ancak sağlık yoklaması başarılı
 * olduğunda geri döner. Başka bir düğüme yeniden yönlendirme yapılmaz, anahtarın
 * sahibi her zaman halka tarafından belirlenir.
 */
public final class ShardRegistry implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(ShardRegistry.class);

    private final ConsistentHashRing<StorageNode> ring;
    private final Map<String, NodeHealth> nodes = new ConcurrentSkipListMap<>();
    private final Retrier retrier;
    private final String keyPrefix;
    private final LongSupplier clock;

    private final Counter storageFailures;
    private final Counter markedUnhealthy;
    private final Counter recovered;
    private final Timer getTimer;
    private final Timer incrementTimer;
    private final Timer resetTimer;

    public ShardRegistry(List<? extends StorageNode> storageNodes,
                         HashFn hash,
                         int virtualNodes,
                         Retrier retrier,
                         String keyPrefix,
                         MetricsRegistry metrics)
    {
        this(storageNodes, hash, virtualNodes, retrier, keyPrefix, metrics, System::currentTimeMillis);
    }

    public ShardRegistry(List<? extends StorageNode> storageNodes,
                         HashFn hash,
                         int virtualNodes,
                         Retrier retrier,
                         String keyPrefix,
                         MetricsRegistry metrics,
                         LongSupplier clock)
    {
        if (storageNodes == null || storageNodes.isEmpty()) {
            throw new NoAvailableNodeException("No storage nodes configured");
        }
        this.ring = new ConsistentHashRing<>(hash, virtualNodes);
        this.retrier = Objects.requireNonNull(retrier, "retrier");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.clock = Objects.requireNonNull(clock, "clock");

        MetricsRegistry registry = metrics == null ? new MetricsRegistry() : metrics;
        this.storageFailures = registry.counter("storage_failures");
        this.markedUnhealthy = registry.counter("storage_node_marked_unhealthy");
        this.recovered = registry.counter("storage_node_recovered");
        this.getTimer = registry.timer("storage_get");
        this.incrementTimer = registry.timer("storage_increment");
        this.resetTimer = registry.timer("storage_reset");

        for (StorageNode node : storageNodes) {
            if (nodes.containsKey(node.id())) {
                throw new IllegalArgumentException("Duplicate storage node id: " + node.id());
            }
            addNode(node);
        }
    }

    public Long get(String key)
    {
        return read(key).value();
    }

    /** Değeri, okumayı yapan düğümün kimliğiyle birlikte döndürür. */
    public StorageRead read(String key)
    {
        StorageNode owner = route(key);
        Long value = execute(owner, key, "GET", getTimer, StorageNode::get);
        return new StorageRead(value, owner.id());
    }

    public long increment(String key, long delta)
    {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must not be negative: " + delta);
        }
        return execute(route(key), key, "INCRBY", incrementTimer, (node, storageKey) -> node.incrementBy(storageKey, delta));
    }

    /** Anahtarı sahibi olan düğümden siler; anahtar hiç yoksa da başarılı sayılır. */
    public boolean reset(String key)
    {
        execute(route(key), key, "DEL", resetTimer, StorageNode::delete);
        return true;
    }

    public StorageNode route(String key)
    {
        Objects.requireNonNull(key, "key");
        return ring.route(key.getBytes(StandardCharsets.UTF_8));
    }

    private <T> T execute(StorageNode owner, String key, String command, Timer timer,
                          BiFunction<StorageNode, String, T> primitive)
    {
        NodeHealth health = nodes.get(owner.id());
        if (health == null) {
            throw new StorageUnavailableException(owner.id(), "Storage node " + owner.id() + " is not registered");
        }
        if (!health.healthy()) {
            throw new StorageUnavailableException(owner.id(), "Storage node " + owner.id() + " is marked unhealthy");
        }

        String storageKey = keyPrefix + key;
        try {
            return timer.time(() -> retrier.call(command + ' ' + storageKey + " on " + owner.id(),
                    () -> primitive.apply(owner, storageKey)));
        } catch (StorageNodeException e) {
            storageFailures.inc();
            markUnhealthy(health, e.getMessage());
            throw new StorageUnavailableException(owner.id(),
                    "Storage node " + owner.id() + " is unavailable after " + retrier.maxAttempts() + " attempts", e);
        }
    }

    /** Düğüm kimliğine göre sıralı sağlık haritası. */
    public Map<String, Boolean> healthSnapshot()
    {
        Map<String, Boolean> snapshot = new LinkedHashMap<>();
        nodes.forEach((id, health) -> snapshot.put(id, health.healthy()));
        return snapshot;
    }

    public List<NodeStatus> nodeStatuses()
    {
        List<NodeStatus> statuses = new ArrayList<>(nodes.size());
        for (NodeHealth health : nodes.values()) {
            statuses.add(health.status());
        }
        return statuses;
    }

    /**
     * Tüm düğümlere tek seferlik PING gönderir. Yanıt veren sağlıksız düğümler
     * geri alınır, yanıt vermeyen sağlıklı düğümler sağlıksız işaretlenir.
     */
    public Map<String, Boolean> probeNow()
    {
        for (NodeHealth health : nodes.values()) {
            StorageNode node = health.node();
            try {
                node.ping();
                markHealthy(health);
            } catch (RuntimeException e) {
                LOG.debugf(e, "Health probe failed for storage node %s", node.id());
                markUnhealthy(health, e.getMessage());
            }
        }
        return healthSnapshot();
    }

    public boolean markUnhealthy(String nodeId)
    {
        NodeHealth health = requireNode(nodeId);
        return markUnhealthy(health, "marked unhealthy manually");
    }

    public boolean markHealthy(String nodeId)
    {
        return markHealthy(requireNode(nodeId));
    }

    private boolean markUnhealthy(NodeHealth health, String reason)
    {
        boolean changed = health.markUnhealthy(clock.getAsLong(), reason);
        if (changed) {
            markedUnhealthy.inc();
            LOG.warnf("Storage node %s (%s) marked unhealthy: %s",
                    health.node().id(), health.node().address(), reason);
        }
        return changed;
    }

    private boolean markHealthy(NodeHealth health)
    {
        boolean changed = health.markHealthy(clock.getAsLong());
        if (changed) {
            recovered.inc();
            LOG.infof("Storage node %s (%s) is healthy again", health.node().id(), health.node().address());
        }
        return changed;
    }

    private NodeHealth requireNode(String nodeId)
    {
        NodeHealth health = nodes.get(nodeId);
        if (health == null) {
            throw new IllegalArgumentException("Unknown storage node: " + nodeId);
        }
        return health;
    }

    /** Düğümü halkaya ekler; aynı kimlikte bir düğüm varsa onun yerini alır. */
    public synchronized void addNode(StorageNode node)
    {
        Objects.requireNonNull(node, "node");
        NodeHealth previous = nodes.put(node.id(), new NodeHealth(node));
        if (previous != null && previous.node() != node) {
            ring.removeNode(previous.node());
        }
        ring.addNode(node, node.id().getBytes(StandardCharsets.UTF_8));
        LOG.debugf("Storage node %s registered at %s", node.id(), node.address());
    }

    /** Düğümü halkadan çıkarır; son düğüm de çıkarılırsa yönlendirme {@link NoAvailableNodeException} verir. */
    public synchronized StorageNode removeNode(String nodeId)
    {
        NodeHealth removed = nodes.remove(nodeId);
        if (removed == null) {
            return null;
        }
        ring.removeNode(removed.node());
        LOG.infof("Storage node %s removed from the ring", nodeId);
        return removed.node();
    }

    public List<StorageNode> nodes()
    {
        List<StorageNode> result = new ArrayList<>(nodes.size());
        nodes.values().forEach(health -> result.add(health.node()));
        return result;
    }

    public StorageNode node(String nodeId)
    {
        NodeHealth health = nodes.get(nodeId);
        return health == null ? null : health.node();
    }

    /** Düğüm kimliği başına halkadaki sanal konum sayısı. */
    public Map<String, Integer> distribution()
    {
        Map<String, Integer> result = new LinkedHashMap<>();
        ring.distribution().forEach((node, count) -> result.put(node.id(), count));
        return result;
    }

    public String keyPrefix()
    {
        return keyPrefix;
    }

    @Override
    public void close()
    {
        for (NodeHealth health : nodes.values()) {
            try {
                health.node().close();
            } catch (Exception e) {
                LOG.warnf(e, "Failed to close storage node %s", health.node().id());
            }
        }
    }
}
