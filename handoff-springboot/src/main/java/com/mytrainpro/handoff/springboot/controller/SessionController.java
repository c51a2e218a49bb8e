package com.mytrainpro.handoff.springboot.controller;

import com.mytrainpro.handoff.model.session.SessionInfoResponse;
import com.mytrainpro.handoff.server.auth.AppSessionManager;
import com.mytrainpro.handoff.springboot.security.HandoffPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * The caller's own app session, identified by its bearer token.
 */
@RestController
@RequestMapping("/auth/session")
public class SessionController {

  private static final Logger log = LoggerFactory.getLogger(SessionController.class);

  private final AppSessionManager appSessionManager;

  public SessionController(AppSessionManager appSessionManager) {
    this.appSessionManager = appSessionManager;
  }

  @GetMapping
  public SessionInfoResponse current(@AuthenticationPrincipal HandoffPrincipal principal) {
    return new SessionInfoResponse(principal.userId(), principal.sessionId());
  }

  @PostMapping("/logout")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void logout(@AuthenticationPrincipal HandoffPrincipal principal) {
    log.debug("logout()");
    appSessionManager.revoke(principal.sessionId());
  }
}
