package com.pagesentry.analyze.service;

import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.config.AnalyzerProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Task-keyed accumulators. Created on batch 1 (replacing any earlier state for the same task id),
 * folded into by every page worker, removed on completion.
 */
@Component
public class TaskStateStore {
    private final Map<String, BatchAccumulator> tasks = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxSnippets;

    public TaskStateStore(AnalyzerProperties properties) {
        this.maxSnippets = properties.getBatch().getMaxSnippets();
    }

    /**
     * Opens the task for {@code batchNum}. Returns the discarded snapshot when batch 1 replaced
     * earlier state, otherwise null.
     */
    public BatchAccumulator.Snapshot begin(String taskId, String mainUrl, int batchNum) {
        lock.lock();
        try {
            BatchAccumulator previous = null;
            if (batchNum <= 1) {
                previous = tasks.remove(taskId);
            }
            BatchAccumulator accumulator = tasks.computeIfAbsent(
                taskId, id -> new BatchAccumulator(id, mainUrl, maxSnippets)
            );
            accumulator.batchSeen(batchNum);
            return previous == null ? null : previous.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims {@code url} for processing within the task; false when it was already claimed.
     */
    public boolean claimPage(String taskId, String url) {
        lock.lock();
        try {
            BatchAccumulator accumulator = tasks.get(taskId);
            return accumulator != null && accumulator.claim(url);
        } finally {
            lock.unlock();
        }
    }

    public int fold(String taskId, String url, List<MatchCandidate> candidates) {
        lock.lock();
        try {
            BatchAccumulator accumulator = tasks.get(taskId);
            return accumulator == null ? 0 : accumulator.fold(url, candidates);
        } finally {
            lock.unlock();
        }
    }

    public BatchAccumulator.Snapshot snapshot(String taskId) {
        lock.lock();
        try {
            BatchAccumulator accumulator = tasks.get(taskId);
            return accumulator == null ? null : accumulator.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public BatchAccumulator.Snapshot finish(String taskId) {
        lock.lock();
        try {
            BatchAccumulator accumulator = tasks.remove(taskId);
            return accumulator == null ? null : accumulator.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public int activeTasks() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }
}
