package com.example.batchinference.service.tracker;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.model.BatchResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the most recent result per request id for local test loops. Entries
 * live in memory only and the least recently used entry is evicted once
 * {@code inference.local-mode.tracker-capacity} is reached.
 */
@Component
public class RequestTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, BatchResult> results;
    private final int capacity;

    public RequestTracker(InferenceProperties properties) {
        this.capacity = properties.getLocalMode().getTrackerCapacity();
        this.results = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, BatchResult> eldest) {
                return size() > capacity;
            }
        };
    }

    public void put(String requestId, BatchResult result) {
        lock.lock();
        try {
            results.put(requestId, result);
        } finally {
            lock.unlock();
        }
    }

    public Optional<BatchResult> get(String requestId) {
        lock.lock();
        try {
            return Optional.ofNullable(results.get(requestId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return results.size();
        } finally {
            lock.unlock();
        }
    }
}
