package com.telemetry.pipeline.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata for the telemetry read API.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Telemetry Pipeline API",
                version = "1.0.0",
                description = "Read access to traces, spans, per-operation performance statistics, " +
                        "tenant-scoped metrics and logs, and pipeline health.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class TelemetryApplication extends Application {
}
