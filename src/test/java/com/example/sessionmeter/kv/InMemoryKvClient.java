package com.example.sessionmeter.kv;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link KvClient} for tests.
 */
public class InMemoryKvClient implements KvClient {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private volatile RuntimeException failure;

    @Override
    public Optional<String> get(String key) {
        throwIfFailing();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        throwIfFailing();
        values.put(key, value);
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    private void throwIfFailing() {
        if (failure != null) {
            throw failure;
        }
    }
}
