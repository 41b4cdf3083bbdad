package com.example.sessionmeter.kv;

import java.util.Optional;

/**
 * Key/value store holding the session tables and manager settings. Values are opaque strings.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value);
}
