package io.zeroledger.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Canonical hashes of every accepted result, each mapped to the sequence number of its
 * first acceptance. Rebuilt from the ledger on startup; not thread-safe on its own, the
 * acceptance gate serializes access.
 */
public final class DedupSet {
    private final Map<String, Long> firstSeqByHash = new LinkedHashMap<>();

    public boolean contains(String hash) {
        return firstSeqByHash.containsKey(hash);
    }

    /**
     * @return {@code false} when the hash was already present; the first sequence is kept
     */
    public boolean add(String hash, long seq) {
        return firstSeqByHash.putIfAbsent(hash, seq) == null;
    }

    public long firstSeq(String hash) {
        Long seq = firstSeqByHash.get(hash);
        return seq == null ? -1L : seq;
    }

    public int size() {
        return firstSeqByHash.size();
    }

    public Set<String> hashes() {
        return Collections.unmodifiableSet(firstSeqByHash.keySet());
    }

    public Map<String, Long> snapshot() {
        return Map.copyOf(firstSeqByHash);
    }
}
