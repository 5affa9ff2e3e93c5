package com.telemetry.pipeline.rest;

import com.telemetry.pipeline.core.model.LogLevel;
import com.telemetry.pipeline.core.model.Span;
import com.telemetry.pipeline.health.HealthCheckRegistry;
import com.telemetry.pipeline.health.HealthStatus;
import com.telemetry.pipeline.query.TelemetryQueryFacade;
import com.telemetry.pipeline.rest.dto.ErrorResponse;
import com.telemetry.pipeline.rest.dto.PerformanceResponse;
import com.telemetry.pipeline.rest.dto.SpanResponse;
import com.telemetry.pipeline.rest.dto.TraceResponse;
import com.telemetry.pipeline.storage.LogQuery;
import com.telemetry.pipeline.storage.MetricQuery;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * REST resource exposing the read side of the telemetry pipeline.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Trace and span lookup, slow and failed spans</li>
 *   <li>Per-operation performance statistics</li>
 *   <li>Tenant-scoped metric and log queries</li>
 *   <li>Pipeline health</li>
 * </ul>
 */
@Path("/api/v1/telemetry")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Telemetry", description = "Query traces, performance statistics, metrics and logs")
public class TelemetryResource {
    private static final Logger log = LoggerFactory.getLogger(TelemetryResource.class);
    private static final String BASE_PATH = "/api/v1/telemetry";

    private final TelemetryQueryFacade queryFacade;
    private final HealthCheckRegistry healthCheckRegistry;

    @Inject
    public TelemetryResource(TelemetryQueryFacade queryFacade, HealthCheckRegistry healthCheckRegistry) {
        this.queryFacade = queryFacade;
        this.healthCheckRegistry = healthCheckRegistry;
    }

    /**
     * GET /api/v1/telemetry/traces/slow
     */
    @GET
    @Path("/traces/slow")
    @Operation(summary = "List slow spans", description = "Spans lasting at least thresholdMs, slowest first.")
    @APIResponse(responseCode = "200", description = "Slow spans")
    @APIResponse(responseCode = "400", description = "Missing tenantId, invalid threshold or limit")
    public Response getSlowTraces(
            @Parameter(description = "Minimum duration in milliseconds") @QueryParam("thresholdMs") @DefaultValue("1000") double thresholdMs,
            @Parameter(description = "Maximum number of spans") @QueryParam("limit") @DefaultValue("10") int limit,
            @Parameter(description = "Tenant owning the spans", required = true) @QueryParam("tenantId") String tenantId) {
        return handle("/traces/slow", () -> {
            List<Span> spans = queryFacade.getSlowTraces(tenantId, thresholdMs, limit);
            return Response.ok(spans.stream().map(SpanResponse::from).toList()).build();
        });
    }

    /**
     * GET /api/v1/telemetry/traces/errors
     */
    @GET
    @Path("/traces/errors")
    @Operation(summary = "List failed spans", description = "Spans finished with status ERROR, most recent first.")
    @APIResponse(responseCode = "200", description = "Failed spans")
    @APIResponse(responseCode = "400", description = "Missing tenantId or invalid limit")
    public Response getErrorTraces(
            @QueryParam("limit") @DefaultValue("10") int limit,
            @Parameter(description = "Tenant owning the spans", required = true) @QueryParam("tenantId") String tenantId) {
        return handle("/traces/errors", () -> {
            List<Span> spans = queryFacade.getErrorTraces(tenantId, limit);
            return Response.ok(spans.stream().map(SpanResponse::from).toList()).build();
        });
    }

    /**
     * GET /api/v1/telemetry/traces/{traceId}
     */
    @GET
    @Path("/traces/{traceId}")
    @Operation(summary = "Get a trace", description = "All spans of a trace ordered by start time.")
    @APIResponse(responseCode = "200", description = "Trace found")
    @APIResponse(responseCode = "404", description = "Trace not found")
    public Response getTrace(@PathParam("traceId") String traceId) {
        String path = "/traces/" + traceId;
        return handle(path, () -> {
            List<Span> spans = queryFacade.getTrace(traceId);
            if (spans.isEmpty()) {
                return notFound("Trace not found: " + traceId, path);
            }
            return Response.ok(TraceResponse.from(traceId, spans)).build();
        });
    }

    /**
     * GET /api/v1/telemetry/traces/{traceId}/spans/{spanId}
     */
    @GET
    @Path("/traces/{traceId}/spans/{spanId}")
    @Operation(summary = "Get a span")
    @APIResponse(responseCode = "200", description = "Span found")
    @APIResponse(responseCode = "404", description = "Span not found")
    public Response getSpan(@PathParam("traceId") String traceId, @PathParam("spanId") String spanId) {
        String path = "/traces/" + traceId + "/spans/" + spanId;
        return handle(path, () -> queryFacade.getSpan(traceId, spanId)
                .map(span -> Response.ok(SpanResponse.from(span)).build())
                .orElseGet(() -> notFound("Span not found: " + spanId, path)));
    }

    /**
     * GET /api/v1/telemetry/performance
     */
    @GET
    @Path("/performance")
    @Operation(summary = "Performance statistics of every operation")
    public Response getAllPerformance() {
        return handle("/performance", () -> {
            Map<String, PerformanceResponse> result = new LinkedHashMap<>();
            queryFacade.getPerformance().forEach((op, rec) -> result.put(op, PerformanceResponse.from(rec)));
            return Response.ok(result).build();
        });
    }

    /**
     * GET /api/v1/telemetry/performance/{operation}
     */
    @GET
    @Path("/performance/{operation}")
    @Operation(summary = "Performance statistics of one operation")
    @APIResponse(responseCode = "404", description = "No statistics recorded for the operation")
    public Response getPerformance(@PathParam("operation") String operation) {
        String path = "/performance/" + operation;
        return handle(path, () -> queryFacade.getPerformance(operation)
                .map(rec -> Response.ok(PerformanceResponse.from(rec)).build())
                .orElseGet(() -> notFound("No performance data for operation: " + operation, path)));
    }

    /**
     * GET /api/v1/telemetry/metrics
     */
    @GET
    @Path("/metrics")
    @Operation(summary = "Query metrics of a tenant")
    @APIResponse(responseCode = "400", description = "Missing tenantId or invalid filter")
    public Response queryMetrics(
            @QueryParam("tenantId") String tenantId,
            @Parameter(description = "Comma-separated metric names") @QueryParam("names") String names,
            @Parameter(description = "ISO-8601 start time") @QueryParam("start") String start,
            @Parameter(description = "ISO-8601 end time") @QueryParam("end") String end,
            @QueryParam("limit") @DefaultValue("100") int limit,
            @Parameter(description = "Return summary statistics instead of samples") @QueryParam("stats") @DefaultValue("false") boolean stats) {
        return handle("/metrics", () -> {
            MetricQuery query = MetricQuery.builder(tenantId)
                    .metricNames(splitCsv(names))
                    .startTime(parseInstant(start, "start"))
                    .endTime(parseInstant(end, "end"))
                    .limit(limit)
                    .build();
            if (stats) {
                return Response.ok(queryFacade.getMetricStatistics(query)).build();
            }
            return Response.ok(queryFacade.queryMetrics(query)).build();
        });
    }

    /**
     * GET /api/v1/telemetry/logs
     */
    @GET
    @Path("/logs")
    @Operation(summary = "Query log entries of a tenant")
    @APIResponse(responseCode = "400", description = "Missing tenantId or invalid filter")
    public Response queryLogs(
            @QueryParam("tenantId") String tenantId,
            @Parameter(description = "Comma-separated levels") @QueryParam("levels") String levels,
            @QueryParam("service") String service,
            @QueryParam("start") String start,
            @QueryParam("end") String end,
            @QueryParam("limit") @DefaultValue("100") int limit) {
        return handle("/logs", () -> {
            Set<LogLevel> levelSet = splitCsv(levels).stream()
                    .map(LogLevel::fromString)
                    .collect(Collectors.toSet());
            LogQuery query = LogQuery.builder(tenantId)
                    .levels(levelSet)
                    .service(service)
                    .startTime(parseInstant(start, "start"))
                    .endTime(parseInstant(end, "end"))
                    .limit(limit)
                    .build();
            return Response.ok(queryFacade.queryLogs(query)).build();
        });
    }

    /**
     * GET /api/v1/telemetry/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Pipeline health", description = "Aggregate of the ingestion and trace storage checks.")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = healthCheckRegistry.checkAll();
        Response.Status code = status.isDown() ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(code).entity(status).build();
    }

    private Response handle(String path, Supplier<Response> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), BASE_PATH + path))
                    .build();
        } catch (Exception e) {
            log.error("telemetry.query.failed path={} error={}", path, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.",
                            BASE_PATH + path))
                    .build();
        }
    }

    private static Response notFound(String message, String path) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(ErrorResponse.notFound(message, BASE_PATH + path))
                .build();
    }

    static Set<String> splitCsv(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    static Instant parseInstant(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant, got '" + value + "'", e);
        }
    }
}
