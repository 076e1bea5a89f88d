package com.deepansh.pawsagent.tool.idempotency;

import com.deepansh.pawsagent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded per-process cache. Insertion-ordered: once over capacity the oldest
 * entry is evicted, regardless of how recently it was read.
 */
@Slf4j
public class InMemoryIdempotencyCache implements IdempotencyCache {

    private final int capacity;
    private final Map<String, ToolResult> entries;

    public InMemoryIdempotencyCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ToolResult> eldest) {
                boolean evict = size() > InMemoryIdempotencyCache.this.capacity;
                if (evict) {
                    log.debug("Evicting idempotency entry {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized Optional<ToolResult> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized void put(String key, ToolResult result) {
        entries.put(key, result);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int capacity() {
        return capacity;
    }
}
