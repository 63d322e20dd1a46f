package com.counter.cluster;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Depolama düğümlerini ve anahtarları sabit bir hash halkasında konumlandırarak
 * yük dağılımını sağlayan veri yapısıdır. Her düğüm, sanal düğüm sayısı kadar
 * konuma yerleşir; bir anahtarın sahibi, anahtarın hash değerine eşit ya da
 * ondan büyük ilk konumdaki düğümdür (sonda başa sarılır). Düğüm eklemek veya
 * çıkarmak yalnızca ardılı değişen anahtarları yeniden eşler.
 */
public final class ConsistentHashRing<N>
{
    private static final byte[] COLLISION_SUFFIX = "#c".getBytes(StandardCharsets.UTF_8);

    private final SortedMap<Integer, N> ring = new TreeMap<>();
    private final Map<N, int[]> positions = new LinkedHashMap<>();
    private final HashFn hash;
    private final int vnodes;

    public ConsistentHashRing(HashFn hash, int virtualNodes) {
        this.hash = Objects.requireNonNull(hash, "hash");
        this.vnodes = Math.max(1, virtualNodes);
    }

    public void addNode(N node, byte[] idBytes) {
        addNode(node, idBytes, vnodes);
    }

    /**
     * Düğümü verilen sayıda sanal konuma yerleştirir. Aynı düğüm ikinci kez
     * eklenirse eski konumları silinip yenileri yazılır.
     */
    public synchronized void addNode(N node, byte[] idBytes, int virtualCount)
    {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(idBytes, "idBytes");
        removePositions(node);

        int count = Math.max(1, virtualCount);
        int[] placed = new int[count];
        for (int i = 0; i < count; i++) {
            byte[] candidate = join(idBytes, i);
            int position = hash.hash(candidate);
            while (ring.containsKey(position)) {
                candidate = concat(candidate, COLLISION_SUFFIX);
                position = hash.hash(candidate);
            }
            ring.put(position, node);
            placed[i] = position;
        }
        positions.put(node, placed);
    }

    public synchronized boolean removeNode(N node)
    {
        return removePositions(node);
    }

    /**
     * Anahtarın sahibi olan düğümü döndürür.
     *
     * @throws NoAvailableNodeException halka boşsa
     */
    public synchronized N route(byte[] key)
    {
        if (ring.isEmpty()) {
            throw new NoAvailableNodeException("Hash ring is empty");
        }
        int h = hash.hash(key);
        SortedMap<Integer, N> tail = ring.tailMap(h);
        if (!tail.isEmpty()) {
            return tail.get(tail.firstKey());
        }
        return ring.get(ring.firstKey());
    }

    public synchronized List<N> nodes() {
        return new ArrayList<>(positions.keySet());
    }

    public synchronized boolean contains(N node) {
        return positions.containsKey(node);
    }

    /** Her düğümün halkadaki sanal konum sayısı. */
    public synchronized Map<N, Integer> distribution()
    {
        Map<N, Integer> out = new LinkedHashMap<>();
        positions.forEach((node, placed) -> out.put(node, placed.length));
        return out;
    }

    public synchronized boolean isEmpty() {
        return ring.isEmpty();
    }

    public synchronized int size() {
        return ring.size();
    }

    private boolean removePositions(N node)
    {
        int[] placed = positions.remove(node);
        if (placed == null) {
            return false;
        }
        for (int position : placed) {
            ring.remove(position, node);
        }
        return true;
    }

    private static byte[] join(byte[] id, int i){
        return concat(id, (":" + i).getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] concat(byte[] head, byte[] tail) {
        byte[] combined = new byte[head.length + tail.length];
        System.arraycopy(head, 0, combined, 0, head.length);
        System.arraycopy(tail, 0, combined, head.length, tail.length);
        return combined;
    }
}
