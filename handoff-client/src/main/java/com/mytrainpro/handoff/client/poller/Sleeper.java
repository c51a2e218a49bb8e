package com.mytrainpro.handoff.client.poller;

import java.time.Duration;

/**
 * Waits between retries. Tests substitute one that returns immediately.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeps on the current thread.
   */
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
