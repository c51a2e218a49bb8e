package com.mytrainpro.handoff.client.storage;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link DurableKeyValueStore}. Nothing survives a restart; for tests and for
 * platforms that supply their own durable store.
 */
public class InMemoryKeyValueStore implements DurableKeyValueStore {

  private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void put(String key, String value) {
    values.put(key, value);
  }

  @Override
  public void remove(String key) {
    values.remove(key);
  }
}
