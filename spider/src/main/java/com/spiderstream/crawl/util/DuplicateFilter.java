package com.spiderstream.crawl.util;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped "seen before" set. Grows for the lifetime of the session; nothing is evicted.
 */
public class DuplicateFilter {
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    /**
     * Atomically records {@code key}.
     *
     * @return {@code true} if the key was already present and the caller must discard it,
     *     {@code false} if it was newly inserted
     */
    public boolean testAndInsert(String key) {
        return !seen.add(key);
    }

    public boolean contains(String key) {
        return seen.contains(key);
    }

    public int size() {
        return seen.size();
    }
}
