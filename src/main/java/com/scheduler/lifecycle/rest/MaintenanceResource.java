package com.scheduler.lifecycle.rest;

import com.scheduler.lifecycle.maintenance.MaintenanceOrchestrator;
import com.scheduler.lifecycle.maintenance.MaintenanceResult;
import com.scheduler.lifecycle.rest.dto.ErrorResponse;
import com.scheduler.lifecycle.rest.dto.RetentionSettingsResponse;
import com.scheduler.lifecycle.retention.RetentionPolicyProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for on-demand maintenance.
 */
@Path("/api/v1/maintenance")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Maintenance", description = "Archival, archive purge and log cleanup")
public class MaintenanceResource {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceResource.class);

    private final MaintenanceOrchestrator orchestrator;
    private final RetentionPolicyProvider policyProvider;

    @Inject
    public MaintenanceResource(MaintenanceOrchestrator orchestrator, RetentionPolicyProvider policyProvider) {
        this.orchestrator = orchestrator;
        this.policyProvider = policyProvider;
    }

    /**
     * Runs archival, purge and log cleanup immediately.
     *
     * POST /api/v1/maintenance/run
     */
    @POST
    @Path("/run")
    @Operation(summary = "Run maintenance", description = "Archives aged records, purges expired archives and deletes old log files.")
    @APIResponse(responseCode = "200", description = "All maintenance steps succeeded")
    @APIResponse(responseCode = "500", description = "One or more steps failed, or maintenance is already running")
    public Response runMaintenance() {
        log.info("maintenance.requested source=api");
        MaintenanceResult result = orchestrator.runMaintenance();
        if (!result.success()) {
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(result).build();
        }
        return Response.ok(result).build();
    }

    /**
     * Returns the retention settings the next run would use.
     *
     * GET /api/v1/maintenance/config
     */
    @GET
    @Path("/config")
    @Operation(summary = "Get retention settings", description = "Returns the current retention and archival configuration.")
    public Response getConfig() {
        try {
            return Response.ok(RetentionSettingsResponse.from(policyProvider.current())).build();
        } catch (IllegalArgumentException e) {
            log.error("maintenance.config.invalid error={}", e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("Invalid retention configuration: " + e.getMessage(),
                            "/api/v1/maintenance/config"))
                    .build();
        }
    }
}
