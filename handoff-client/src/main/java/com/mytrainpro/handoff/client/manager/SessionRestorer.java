package com.mytrainpro.handoff.client.manager;

import com.mytrainpro.handoff.model.pending.AppSession;

/**
 * Installs an issued session into the app context, for example by writing
 * {@link AppSession#cookieHeader(java.time.Instant)} into the WebView cookie store and reloading.
 */
@FunctionalInterface
public interface SessionRestorer {

  /**
   * @param appSession the session to install
   * @throws RuntimeException if the session could not be installed
   */
  void restore(AppSession appSession);
}
