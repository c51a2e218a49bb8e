package com.mytrainpro.handoff.client.storage;

import java.util.Optional;

/**
 * Small string key-value storage that survives app restarts (platform preferences, a file, a
 * keychain). Writes must be durable when the call returns. Implementations must be thread-safe.
 */
public interface DurableKeyValueStore {

  Optional<String> get(String key);

  void put(String key, String value);

  void remove(String key);
}
