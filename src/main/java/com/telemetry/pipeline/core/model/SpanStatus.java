package com.telemetry.pipeline.core.model;

/**
 * Terminal outcome of a finished span.
 */
public enum SpanStatus {
    OK,
    ERROR
}
