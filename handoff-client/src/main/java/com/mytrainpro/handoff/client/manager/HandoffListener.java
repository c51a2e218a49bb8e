package com.mytrainpro.handoff.client.manager;

/**
 * Receives handoff state transitions, typically to drive the UI.
 */
@FunctionalInterface
public interface HandoffListener {

  void onHandoffEvent(HandoffEvent event);
}
