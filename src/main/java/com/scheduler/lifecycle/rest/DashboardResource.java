package com.scheduler.lifecycle.rest;

import com.scheduler.lifecycle.analytics.ConcurrencyBucket;
import com.scheduler.lifecycle.analytics.ConcurrencySummary;
import com.scheduler.lifecycle.analytics.ConcurrencyWindowAnalyzer;
import com.scheduler.lifecycle.analytics.ExecutionIntervalSource;
import com.scheduler.lifecycle.core.model.ExecutionInterval;
import com.scheduler.lifecycle.rest.dto.ConcurrencyDashboardResponse;
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
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Execution concurrency figures for the dashboard.
 */
@Path("/api/v1/dashboard")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Dashboard", description = "Execution concurrency and duration trends")
public class DashboardResource {
    private static final Logger log = LoggerFactory.getLogger(DashboardResource.class);

    private static final String PATH = "/api/v1/dashboard/concurrency";

    static final int MAX_HOURS = 24 * 31;

    private final ExecutionIntervalSource intervalSource;
    private final ConcurrencyWindowAnalyzer analyzer;
    private final Clock clock;

    @Inject
    public DashboardResource(ExecutionIntervalSource intervalSource, ConcurrencyWindowAnalyzer analyzer) {
        this(intervalSource, analyzer, Clock.systemUTC());
    }

    public DashboardResource(ExecutionIntervalSource intervalSource, ConcurrencyWindowAnalyzer analyzer, Clock clock) {
        this.intervalSource = intervalSource;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    /**
     * GET /api/v1/dashboard/concurrency?hours=24&amp;bucketMinutes=60
     */
    @GET
    @Path("/concurrency")
    @Operation(summary = "Execution concurrency", description = "Peak concurrent executions and per-bucket execution counts, durations and peaks.")
    public Response getConcurrency(
            @QueryParam("hours") @DefaultValue("24") int hours,
            @QueryParam("bucketMinutes") @DefaultValue("60") int bucketMinutes) {
        String invalid = validateWindow(hours, bucketMinutes);
        if (invalid != null) {
            log.debug("dashboard.concurrency.rejected hours={} bucketMinutes={}", hours, bucketMinutes);
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(invalid, PATH))
                    .build();
        }
        try {
            Instant windowEnd = clock.instant();
            Instant windowStart = windowEnd.minus(Duration.ofHours(hours));
            List<ExecutionInterval> intervals = intervalSource.findSince(windowStart);

            ConcurrencySummary summary = analyzer.summarize(intervals, windowStart, windowEnd);
            List<ConcurrencyBucket> buckets = analyzer.buckets(intervals, windowStart, windowEnd,
                    Duration.ofMinutes(bucketMinutes));
            return Response.ok(new ConcurrencyDashboardResponse(summary, bucketMinutes, buckets)).build();
        } catch (RuntimeException e) {
            log.error("dashboard.concurrency.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(e.getMessage(), PATH))
                    .build();
        }
    }

    /**
     * Returns the reason the query window is rejected, or null when it is acceptable.
     */
    static String validateWindow(int hours, int bucketMinutes) {
        if (hours <= 0 || bucketMinutes <= 0) {
            return "hours and bucketMinutes must be > 0";
        }
        if (hours > MAX_HOURS) {
            return "hours must be <= " + MAX_HOURS;
        }
        long buckets = ConcurrencyWindowAnalyzer.bucketCount(Duration.ofHours(hours), Duration.ofMinutes(bucketMinutes));
        if (buckets > ConcurrencyWindowAnalyzer.MAX_BUCKETS) {
            return "hours=" + hours + " with bucketMinutes=" + bucketMinutes + " gives " + buckets
                    + " buckets; at most " + ConcurrencyWindowAnalyzer.MAX_BUCKETS + " are allowed";
        }
        return null;
    }
}
