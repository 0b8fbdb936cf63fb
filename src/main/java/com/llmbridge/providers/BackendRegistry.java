package com.llmbridge.providers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class BackendRegistry {

    private final Map<String, BackendAdapter> backends = new LinkedHashMap<>();

    public synchronized BackendRegistry register(BackendAdapter backend) {
        if (backends.containsKey(backend.name())) {
            throw new IllegalArgumentException("Duplicate backend: " + backend.name());
        }
        backends.put(backend.name(), backend);
        return this;
    }

    public synchronized Optional<BackendAdapter> get(String name) {
        return Optional.ofNullable(backends.get(name));
    }

    public synchronized List<BackendAdapter> all() {
        return new ArrayList<>(backends.values());
    }

    public synchronized List<String> names() {
        return new ArrayList<>(backends.keySet());
    }

    public synchronized boolean isEmpty() {
        return backends.isEmpty();
    }
}
