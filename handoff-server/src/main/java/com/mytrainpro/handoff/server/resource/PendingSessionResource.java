package com.mytrainpro.handoff.server.resource;

import com.mytrainpro.handoff.model.callback.CallbackCompleteRequest;
import com.mytrainpro.handoff.model.callback.CallbackCompleteResponse;
import com.mytrainpro.handoff.model.pending.PendingConsumeRequest;
import com.mytrainpro.handoff.model.pending.PendingConsumeResponse;
import com.mytrainpro.handoff.model.pending.PendingCreateRequest;
import com.mytrainpro.handoff.model.pending.PendingCreateResponse;
import com.mytrainpro.handoff.model.pending.PendingLookupRequest;
import com.mytrainpro.handoff.model.pending.PendingLookupResponse;
import com.mytrainpro.handoff.server.auth.InternalApiKey;
import com.mytrainpro.handoff.server.manager.HandoffServerManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the pending-session handoff.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/pending/create}    - internal: create a pending session for a user the
 *       caller already verified; requires the {@link InternalApiKey#HEADER} header</li>
 *   <li>{@code POST /auth/pending/lookup}    - find the device's live pending session</li>
 *   <li>{@code POST /auth/pending/consume}   - consume a handle and receive the app session</li>
 *   <li>{@code POST /auth/callback/complete} - verify the identity token and build the deep link</li>
 * </ul>
 * All logic lives in {@link HandoffServerManager}; this class only maps its exceptions.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PendingSessionResource {

  private static final Logger log = LoggerFactory.getLogger(PendingSessionResource.class);

  private final HandoffServerManager manager;
  private final InternalApiKey internalApiKey;

  public PendingSessionResource(HandoffServerManager manager, InternalApiKey internalApiKey) {
    log.info("PendingSessionResource({})", manager);
    this.manager = manager;
    this.internalApiKey = internalApiKey;
  }

  @POST
  @Path("/pending/create")
  public PendingCreateResponse create(@HeaderParam(InternalApiKey.HEADER) String key,
                                      PendingCreateRequest request) {
    return call(() -> {
      internalApiKey.require(key);
      return manager.create(request);
    });
  }

  @POST
  @Path("/pending/lookup")
  public PendingLookupResponse lookup(PendingLookupRequest request) {
    return call(() -> manager.lookup(request));
  }

  @POST
  @Path("/pending/consume")
  public PendingConsumeResponse consume(PendingConsumeRequest request) {
    return call(() -> manager.consume(request));
  }

  @POST
  @Path("/callback/complete")
  public CallbackCompleteResponse completeCallback(CallbackCompleteRequest request) {
    return call(() -> manager.completeCallback(request));
  }

  private static <T> T call(Supplier<T> action) {
    try {
      return action.get();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (SecurityException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    } catch (IllegalStateException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.SERVICE_UNAVAILABLE);
    }
  }
}
