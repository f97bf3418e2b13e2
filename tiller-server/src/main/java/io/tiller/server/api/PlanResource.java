package io.tiller.server.api;

import io.tiller.core.plan.DependencyPlanner;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanningException;
import io.tiller.core.plan.PlanningRequest;
import io.tiller.core.plan.QueryComplexity;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// Plans a capability selection without running it.
///
/// Lets clients preview the steps a turn would execute, including dependencies
/// and default capabilities pulled in by the planner.
@Path("/api/v1/plans")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PlanResource {

    private static final Logger LOG = Logger.getLogger(PlanResource.class);

    private final DependencyPlanner planner;

    @Inject
    public PlanResource(DependencyPlanner planner) {
        this.planner = planner;
    }

    /// Computes a plan.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/plans
    /// {"intent": "travel", "capabilities": ["travel_search_hotels"]}
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"steps": [{"id": "step_0", "capabilities": ["travel_search_hotels"], "parallel": false}]}
    /// ```
    ///
    /// @param body planning request, not null
    /// @return planned steps
    /// @throws BadRequestException if the selection has a dependency cycle or an
    /// invalid template
    @POST
    public Response plan(@Valid @NotNull PlanBody body) {
        try {
            ExecutionPlan plan =
                    planner.plan(
                            new PlanningRequest(
                                    body.intent(),
                                    new LinkedHashSet<>(body.capabilities()),
                                    body.complexity()));
            return Response.ok(Map.of("steps", TurnResponse.steps(plan))).build();
        } catch (PlanningException e) {
            LOG.warnv("Planning failed: {0}", e.getMessage());
            throw new BadRequestException(e.getMessage());
        }
    }

    /// Request body for a plan preview.
    ///
    /// @param intent classified intent, required
    /// @param capabilities selected capabilities, at least one
    /// @param complexity complexity class for template lookup, may be null
    public record PlanBody(
            @NotBlank(message = "intent is required") String intent,
            @NotEmpty(message = "capabilities must not be empty") List<String> capabilities,
            QueryComplexity complexity) {}
}
