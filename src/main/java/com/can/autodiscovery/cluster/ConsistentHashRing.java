package com.can.autodiscovery.cluster;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Önbellek düğümlerini ve anahtarları sabit bir hash halkasında konumlandırır.
 * Her düğüm sanal düğüm sayısı kadar noktaya yerleşir; bir anahtarın sahibi,
 * anahtarın hash değerinden sonra gelen ilk noktadaki düğümdür. Halka bir
 * istemci örneği kurulurken doldurulur, üyelik değiştiğinde yeni bir halka
 * kurulur.
 */
public final class ConsistentHashRing<N>
{
    private final SortedMap<Integer, N> ring = new TreeMap<>();
    private final HashFn hash;
    private final int vnodes;

    public ConsistentHashRing(HashFn hash, int virtualNodes) {
        this.hash = hash; this.vnodes = Math.max(1, virtualNodes);
    }

    public synchronized void addNode(N node, byte[] idBytes) {
        for (int i = 0; i < vnodes; i++) ring.put(hash.hash(join(idBytes, i)), node);
    }

    /**
     * Anahtarın sahibi olan düğümü döndürür; halka boşsa {@code null}.
     */
    public synchronized N nodeFor(byte[] key) {
        if (ring.isEmpty()) return null;
        SortedMap<Integer, N> tail = ring.tailMap(hash.hash(key));
        return tail.isEmpty() ? ring.get(ring.firstKey()) : tail.get(tail.firstKey());
    }

    public synchronized List<N> nodes() {
        return new ArrayList<>(new LinkedHashSet<>(ring.values()));
    }

    public synchronized boolean isEmpty() {
        return ring.isEmpty();
    }

    private static byte[] join(byte[] id, int i){
        byte[] suffix = ("#" + i).getBytes(StandardCharsets.UTF_8);
        byte[] combined = new byte[id.length + suffix.length];
        System.arraycopy(id, 0, combined, 0, id.length);
        System.arraycopy(suffix, 0, combined, id.length, suffix.length);
        return combined;
    }
}
