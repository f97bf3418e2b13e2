package io.tiller.server.api;

import io.tiller.core.TillerEnvironment;
import io.tiller.core.plan.PlanningException;
import io.tiller.core.plan.QueryComplexity;
import io.tiller.core.slot.ConversationMessage;
import io.tiller.core.suspend.SuspendStateStore;
import io.tiller.core.turn.TurnOutcome;
import io.tiller.core.turn.TurnPipeline;
import io.tiller.core.turn.TurnRequest;
import io.tiller.server.validation.LogSanitizer;
import io.tiller.server.validation.ValidSessionId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST entry point for one conversational turn.
///
/// Intent classification and capability selection happen upstream; the caller
/// sends the classified intent with the user's message. Each request gets its own
/// {@link SuspendStateStore}, so the local tier never outlives the request.
///
/// @see TurnPipeline
@Path("/api/v1/sessions/{sessionId}/turns")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TurnResource {

    private static final Logger LOG = Logger.getLogger(TurnResource.class);

    private final TurnPipeline pipeline;
    private final TillerEnvironment environment;

    @Inject
    public TurnResource(TurnPipeline pipeline, TillerEnvironment environment) {
        this.pipeline = pipeline;
        this.environment = environment;
    }

    /// Processes a turn: resume or plan, clarify, execute.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/sessions/s-1/turns
    /// Content-Type: application/json
    ///
    /// {"intent": "travel", "utterance": "Hotels in Lisbon",
    ///  "selectedCapabilities": ["travel_search_hotels"]}
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"status": "CLARIFYING", "sessionId": "s-1", "missingFields": ["check_in"],
    ///  "questions": {"questions": [{"field": "check_in", "question": "When do you arrive?"}]}}
    /// ```
    ///
    /// A consent confirmation is a turn with `"action": "consent_confirm"` that
    /// resends the intent and selection of the turn that was halted.
    ///
    /// @param sessionId conversation id, not null
    /// @param body turn payload, not null
    /// @return turn outcome, never null
    @POST
    public Response handleTurn(
            @PathParam("sessionId") @ValidSessionId String sessionId,
            @Valid @NotNull TurnBody body) {

        LOG.infov(
                "Turn request: session={0}, intent={1}",
                LogSanitizer.sanitize(sessionId),
                LogSanitizer.sanitize(body.intent()));

        SuspendStateStore store = environment.newSuspendStore();
        try {
            TurnOutcome outcome = pipeline.handle(toTurnRequest(sessionId, body), store);
            LOG.infov(
                    "Turn finished: session={0}, status={1}",
                    LogSanitizer.sanitize(sessionId),
                    outcome.status());
            return Response.ok(TurnResponse.from(outcome)).build();
        } catch (PlanningException e) {
            LOG.warnv(
                    "Planning failed for session {0}: {1}",
                    LogSanitizer.sanitize(sessionId),
                    e.getMessage());
            throw new BadRequestException(e.getMessage());
        } finally {
            store.clear();
        }
    }

    static TurnRequest toTurnRequest(String sessionId, TurnBody body) {
        List<ConversationMessage> history =
                body.history() != null
                        ? body.history().stream()
                                .map(m -> new ConversationMessage(m.role(), m.content()))
                                .toList()
                        : List.of();
        return new TurnRequest(
                sessionId,
                body.actorId(),
                body.intent(),
                body.utterance(),
                history,
                body.selectedCapabilities() != null
                        ? new LinkedHashSet<>(body.selectedCapabilities())
                        : null,
                body.complexity(),
                body.fields(),
                body.action(),
                Boolean.TRUE.equals(body.extendedSearchEnabled()));
    }

    /// Request body for a turn.
    ///
    /// @param actorId user id, may be null
    /// @param intent classified intent, required
    /// @param utterance current user message, required
    /// @param history prior conversation, oldest first, may be null
    /// @param selectedCapabilities entry-point capabilities, may be null
    /// @param complexity complexity class for template lookup, may be null
    /// @param fields caller-supplied field values, may be null
    /// @param action client action id such as `consent_confirm`, may be null
    /// @param extendedSearchEnabled the user's standing opt-in, may be null
    public record TurnBody(
            @ValidSessionId String actorId,
            @NotBlank(message = "intent is required") String intent,
            @NotNull(message = "utterance is required") String utterance,
            List<@Valid MessageBody> history,
            List<String> selectedCapabilities,
            QueryComplexity complexity,
            Map<String, Object> fields,
            String action,
            Boolean extendedSearchEnabled) {}

    /// One prior conversation message.
    public record MessageBody(
            @NotNull(message = "role is required") ConversationMessage.Role role,
            @NotNull(message = "content is required") String content) {}
}
