package com.pagesentry.analyze.service;

import com.pagesentry.config.RuntimeSizing;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * LRU of recently processed page HTML, plus the set of URLs whose HTML has already been archived.
 * Evicting a URL also forgets its archived marker so the marker set stays bounded.
 */
@Component
public class HtmlCache {
    private final int capacity;
    private final Set<String> persisted = new HashSet<>();
    private final LinkedHashMap<String, String> entries;

    @Autowired
    public HtmlCache(RuntimeSizing sizing) {
        this(sizing.htmlCacheCapacity());
    }

    HtmlCache(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                if (size() > HtmlCache.this.capacity) {
                    persisted.remove(eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    public synchronized void put(String url, String html) {
        entries.put(url, html);
    }

    public synchronized String get(String url) {
        return entries.get(url);
    }

    /**
     * Marks a cached {@code url} as archived; false when it already was or is not cached.
     */
    public synchronized boolean markPersisted(String url) {
        return entries.containsKey(url) && persisted.add(url);
    }

    public synchronized boolean isPersisted(String url) {
        return persisted.contains(url);
    }

    public synchronized void evictAll(Collection<String> urls) {
        for (String url : urls) {
            entries.remove(url);
            persisted.remove(url);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized int persistedCount() {
        return persisted.size();
    }
}
