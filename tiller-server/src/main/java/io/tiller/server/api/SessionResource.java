package io.tiller.server.api;

import io.tiller.core.router.ConsentLedger;
import io.tiller.core.router.ConsentRecord;
import io.tiller.core.router.SourceUsage;
import io.tiller.core.router.SourceUsageLog;
import io.tiller.core.suspend.SuspendState;
import io.tiller.core.suspend.SuspendStateRepository;
import io.tiller.server.validation.LogSanitizer;
import io.tiller.server.validation.ValidSessionId;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// Read access to the per-session state kept by the control plane.
///
/// Provides endpoints for:
/// - Inspecting and discarding a suspended clarification
/// - Listing the consent audit trail of a session
/// - Listing the source calls made for a session
///
/// Reads go straight to the durable tier; there is no request-local cache here.
@Path("/api/v1/sessions/{sessionId}")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);

    private final SuspendStateRepository suspendRepository;
    private final ConsentLedger consentLedger;
    private final SourceUsageLog usageLog;

    @Inject
    public SessionResource(
            SuspendStateRepository suspendRepository,
            ConsentLedger consentLedger,
            SourceUsageLog usageLog) {
        this.suspendRepository = suspendRepository;
        this.consentLedger = consentLedger;
        this.usageLog = usageLog;
    }

    /// Returns the active suspension of a session.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"sessionId": "s-1", "intent": "travel", "version": 2,
    ///  "outstandingFields": ["check_in"], "plan": [...]}
    /// ```
    ///
    /// @param sessionId conversation id, not null
    /// @return suspension view
    /// @throws NotFoundException if the session is not suspended
    @GET
    @Path("/suspension")
    public Response getSuspension(@PathParam("sessionId") @ValidSessionId String sessionId) {
        SuspendState state =
                suspendRepository
                        .find(sessionId)
                        .filter(SuspendState::isSuspended)
                        .orElseThrow(
                                () -> new NotFoundException("No suspension for session: " + sessionId));

        return Response.ok(
                        Map.of(
                                "sessionId", state.sessionId(),
                                "intent", state.intent(),
                                "version", state.version(),
                                "outstandingFields", state.outstandingFields(),
                                "filledFields", List.copyOf(state.fields().names()),
                                "plan", TurnResponse.steps(state.plan())))
                .build();
    }

    /// Discards the suspension of a session, if any.
    ///
    /// @param sessionId conversation id, not null
    /// @return 204 when a suspension was removed
    /// @throws NotFoundException if nothing was stored
    @DELETE
    @Path("/suspension")
    public Response deleteSuspension(@PathParam("sessionId") @ValidSessionId String sessionId) {
        if (!suspendRepository.delete(sessionId)) {
            throw new NotFoundException("No suspension for session: " + sessionId);
        }
        LOG.infov("Discarded suspension: session={0}", LogSanitizer.sanitize(sessionId));
        return Response.noContent().build();
    }

    @GET
    @Path("/consents")
    public List<ConsentRecord> listConsents(
            @PathParam("sessionId") @ValidSessionId String sessionId) {
        return consentLedger.findBySession(sessionId);
    }

    @GET
    @Path("/usage")
    public List<SourceUsage> listUsage(@PathParam("sessionId") @ValidSessionId String sessionId) {
        return usageLog.findBySession(sessionId);
    }
}
