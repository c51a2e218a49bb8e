package com.mytrainpro.handoff.dropwizard.resource;

import com.mytrainpro.handoff.dropwizard.auth.HandoffPrincipal;
import com.mytrainpro.handoff.model.session.SessionInfoResponse;
import com.mytrainpro.handoff.server.auth.AppSessionManager;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Endpoints for the caller's own app session.
 * <ul>
 *   <li>{@code GET /auth/session}         - who the bearer token belongs to</li>
 *   <li>{@code POST /auth/session/logout} - revoke the bearer token's session</li>
 * </ul>
 */
@Path("/auth/session")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

  private static final Logger log = LoggerFactory.getLogger(SessionResource.class);

  private final AppSessionManager appSessionManager;

  public SessionResource(AppSessionManager appSessionManager) {
    this.appSessionManager = appSessionManager;
  }

  @GET
  public SessionInfoResponse current(@Auth HandoffPrincipal principal) {
    return new SessionInfoResponse(principal.userId(), principal.sessionId());
  }

  @POST
  @Path("/logout")
  public void logout(@Auth HandoffPrincipal principal) {
    log.debug("logout()");
    appSessionManager.revoke(principal.sessionId());
  }
}
