package com.mytrainpro.handoff.client.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mytrainpro.handoff.client.exceptions.HandoffStorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DurableKeyValueStore} persisted as a single JSON object in a file.
 * <p>
 * Every write replaces the file through a sibling temp file and an atomic move, so a crash
 * mid-write leaves either the old or the new content, never a torn file.
 */
public class JsonFileKeyValueStore implements DurableKeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileKeyValueStore.class);
  private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {
  };

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Map<String, String> values;

  /**
   * Opens the store, loading existing content if the file exists.
   *
   * @param file         the backing file; its parent directory is created if missing
   * @param objectMapper mapper used for the file content
   * @throws HandoffStorageException if the existing file cannot be read
   */
  public JsonFileKeyValueStore(Path file, ObjectMapper objectMapper) {
    log.info("JsonFileKeyValueStore({})", file);
    this.file = file;
    this.objectMapper = objectMapper;
    this.values = load();
  }

  @Override
  public synchronized Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public synchronized void put(String key, String value) {
    String previous = values.put(key, value);
    try {
      write();
    } catch (HandoffStorageException e) {
      restore(key, previous);
      throw e;
    }
  }

  @Override
  public synchronized void remove(String key) {
    String previous = values.remove(key);
    if (previous == null) {
      return;
    }
    try {
      write();
    } catch (HandoffStorageException e) {
      restore(key, previous);
      throw e;
    }
  }

  private void restore(String key, String previous) {
    if (previous == null) {
      values.remove(key);
    } else {
      values.put(key, previous);
    }
  }

  private Map<String, String> load() {
    if (!Files.exists(file)) {
      return new HashMap<>();
    }
    try {
      Map<String, String> loaded = objectMapper.readValue(file.toFile(), MAP_TYPE);
      return loaded == null ? new HashMap<>() : new HashMap<>(loaded);
    } catch (IOException e) {
      throw new HandoffStorageException("Cannot read " + file, e);
    }
  }

  private void write() {
    try {
      Path parent = file.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), values);
        Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new HandoffStorageException("Cannot write " + file, e);
    }
  }
}
