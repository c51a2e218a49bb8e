package com.mytrainpro.handoff.springboot.controller;

import com.mytrainpro.handoff.model.callback.CallbackCompleteRequest;
import com.mytrainpro.handoff.model.callback.CallbackCompleteResponse;
import com.mytrainpro.handoff.model.pending.PendingConsumeRequest;
import com.mytrainpro.handoff.model.pending.PendingConsumeResponse;
import com.mytrainpro.handoff.model.pending.PendingCreateRequest;
import com.mytrainpro.handoff.model.pending.PendingCreateResponse;
import com.mytrainpro.handoff.model.pending.PendingLookupRequest;
import com.mytrainpro.handoff.model.pending.PendingLookupResponse;
import com.mytrainpro.handoff.server.manager.HandoffServerManager;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/auth")
public class HandoffController {

  private final HandoffServerManager handoffServerManager;

  public HandoffController(HandoffServerManager handoffServerManager) {
    this.handoffServerManager = handoffServerManager;
  }

  /**
   * Internal. {@code HandoffSecurityConfig} admits only callers holding the internal API key.
   */
  @PostMapping("/pending/create")
  public PendingCreateResponse create(@RequestBody PendingCreateRequest request) {
    return call(() -> handoffServerManager.create(request));
  }

  @PostMapping("/pending/lookup")
  public PendingLookupResponse lookup(@RequestBody PendingLookupRequest request) {
    return call(() -> handoffServerManager.lookup(request));
  }

  @PostMapping("/pending/consume")
  public PendingConsumeResponse consume(@RequestBody PendingConsumeRequest request) {
    return call(() -> handoffServerManager.consume(request));
  }

  @PostMapping("/callback/complete")
  public CallbackCompleteResponse completeCallback(@RequestBody CallbackCompleteRequest request) {
    return call(() -> handoffServerManager.completeCallback(request));
  }

  private static <T> T call(Supplier<T> action) {
    try {
      return action.get();
    } catch (IllegalArgumentException e) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, e.getMessage());
    } catch (IllegalStateException e) {
      throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }
  }
}
