package com.scheduler.lifecycle.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Scheduler Data Lifecycle API",
                version = "1.0.0",
                description = "Archival, archive purge and log cleanup for the scheduling platform, " +
                        "orchestrator health and execution concurrency dashboards. Built on FalkorDB."
        )
)
public class LifecycleApplication extends Application {
}
