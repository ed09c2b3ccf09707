package com.scheduler.lifecycle.rest;

import com.scheduler.lifecycle.health.HealthCheckRegistry;
import com.scheduler.lifecycle.health.HealthStatus;
import com.scheduler.lifecycle.health.OrchestrationHealthCheck;
import com.scheduler.lifecycle.rest.dto.ErrorResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.Duration;

/**
 * Health endpoints. UP maps to 200; DEGRADED and DOWN map to 503.
 */
@Path("/api/v1/health")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Health", description = "Component and orchestrator health")
public class HealthResource {

    private final HealthCheckRegistry registry;
    private final OrchestrationHealthCheck orchestrationHealthCheck;

    @Inject
    public HealthResource(HealthCheckRegistry registry, OrchestrationHealthCheck orchestrationHealthCheck) {
        this.registry = registry;
        this.orchestrationHealthCheck = orchestrationHealthCheck;
    }

    @GET
    @Operation(summary = "Overall health", description = "Aggregates every registered health check.")
    public Response getHealth() {
        return toResponse(registry.checkAll());
    }

    /**
     * GET /api/v1/health/orchestrator?maxHoursSinceLastRun=26
     */
    @GET
    @Path("/orchestrator")
    @Operation(summary = "Orchestrator health", description = "Healthy while a run is in progress or the last successful run is recent enough.")
    @APIResponse(responseCode = "200", description = "Orchestrator healthy")
    @APIResponse(responseCode = "503", description = "No recent successful run, or runs cannot be read")
    public Response getOrchestratorHealth(
            @Parameter(description = "Hours allowed since the last successful run")
            @QueryParam("maxHoursSinceLastRun") @DefaultValue("26") int maxHoursSinceLastRun) {
        if (maxHoursSinceLastRun <= 0) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("maxHoursSinceLastRun must be > 0",
                            "/api/v1/health/orchestrator"))
                    .build();
        }
        return toResponse(orchestrationHealthCheck.check(Duration.ofHours(maxHoursSinceLastRun)));
    }

    private Response toResponse(HealthStatus status) {
        Response.Status code = status.isUp() ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(code).entity(status).build();
    }
}
