package com.deployguard.storage.impl;

import com.deployguard.storage.AppendOnlyStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store; entries live as long as the instance.
 */
public class InMemoryAppendOnlyStore implements AppendOnlyStore {

    private final ConcurrentMap<String, List<String>> streams = new ConcurrentHashMap<>();

    @Override
    public long append(String streamId, String payload) {
        List<String> list = streams.computeIfAbsent(streamId, k -> new ArrayList<>());
        synchronized (list) {
            list.add(payload);
            return list.size() - 1L;
        }
    }

    @Override
    public List<String> readAll(String streamId) {
        List<String> list = streams.get(streamId);
        if (list == null) return List.of();
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    @Override
    public List<String> streams(String prefix) {
        return streams.keySet().stream()
                .filter(k -> prefix == null || k.startsWith(prefix))
                .sorted()
                .toList();
    }
}
