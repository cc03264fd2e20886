package com.pagesentry.analyze.dlq;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

public class InMemoryDeadLetterStore implements DeadLetterStore {
    private final Map<String, Deque<String>> lists = new HashMap<>();
    private boolean available = true;

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public synchronized boolean push(String kind, String payload) {
        if (!available) {
            return false;
        }
        lists.computeIfAbsent(kind, ignored -> new ArrayDeque<>()).addLast(payload);
        return true;
    }

    @Override
    public synchronized String pop(String kind) {
        Deque<String> list = lists.get(kind);
        return list == null ? null : list.pollFirst();
    }

    @Override
    public synchronized long size(String kind) {
        if (!available) {
            return -1;
        }
        Deque<String> list = lists.get(kind);
        return list == null ? 0 : list.size();
    }
}
