package com.mytrainpro.handoff.client.storage;

import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies the per-install device id, generating and persisting a random UUID on first use.
 */
@Singleton
public class DeviceIdProvider {

  private static final Logger log = LoggerFactory.getLogger(DeviceIdProvider.class);

  static final String DEVICE_ID_KEY = "handoff.deviceId";

  private final DurableKeyValueStore store;

  @Inject
  public DeviceIdProvider(final DurableKeyValueStore store) {
    this.store = store;
  }

  /**
   * Returns the device id, stable across restarts for as long as the store keeps it.
   *
   * @return the device id
   */
  public synchronized String deviceId() {
    return store.get(DEVICE_ID_KEY).orElseGet(() -> {
      String generated = UUID.randomUUID().toString();
      store.put(DEVICE_ID_KEY, generated);
      log.info("Generated new device id");
      return generated;
    });
  }
}
