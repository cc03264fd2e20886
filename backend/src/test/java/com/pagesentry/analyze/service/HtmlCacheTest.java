package com.pagesentry.analyze.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlCacheTest {

    @Test
    void evictsLeastRecentlyUsedAndForgetsItsArchiveMarker() {
        HtmlCache cache = new HtmlCache(2);
        cache.put("a", "<p>a</p>");
        assertThat(cache.markPersisted("a")).isTrue();
        cache.put("b", "<p>b</p>");
        cache.get("b");
        cache.put("c", "<p>c</p>");

        assertThat(cache.get("a")).isNull();
        assertThat(cache.isPersisted("a")).isFalse();
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.persistedCount()).isZero();
    }

    @Test
    void marksEachCachedUrlOnlyOnce() {
        HtmlCache cache = new HtmlCache(4);
        assertThat(cache.markPersisted("a")).isFalse();

        cache.put("a", "<p>a</p>");
        assertThat(cache.markPersisted("a")).isTrue();
        assertThat(cache.markPersisted("a")).isFalse();
        assertThat(cache.isPersisted("a")).isTrue();
    }

    @Test
    void evictAllDropsEntriesAndMarkers() {
        HtmlCache cache = new HtmlCache(4);
        cache.put("a", "1");
        cache.put("b", "2");
        cache.markPersisted("a");

        cache.evictAll(List.of("a", "b", "unknown"));

        assertThat(cache.size()).isZero();
        assertThat(cache.persistedCount()).isZero();
    }
}
