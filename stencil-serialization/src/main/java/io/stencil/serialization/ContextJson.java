package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.pipeline.RenderReport;
import java.io.IOException;
import java.io.InputStream;

/// Utility class for moving render contexts and reports to and from JSON.
///
/// ### Usage
/// {@snippet :
/// // Load a context
/// Mapping context = ContextJson.mappingFromJson("{\"name\": \"World\"}");
///
/// // Render, then persist the report
/// String json = ContextJson.reportToJson(engine.render(units, context));
/// }
///
/// @implNote Thread-safe. A new ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see StencilJacksonModule for the registered type handlers
public final class ContextJson {

    private ContextJson() {}

    /// Parses any JSON document into a context value.
    ///
    /// @param json JSON text, not null
    /// @return the value, never null
    /// @throws IllegalArgumentException if the text is not valid JSON
    public static ContextValue fromJson(String json) {
        try {
            return createMapper().readValue(json, ContextValue.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse context: " + e.getMessage(), e);
        }
    }

    /// Parses a context from a stream, e.g. a data file on the classpath.
    ///
    /// @param in UTF-8 JSON, not null; not closed
    /// @return the value, never null
    /// @throws IOException if the stream cannot be read or is not valid JSON
    public static ContextValue fromJson(InputStream in) throws IOException {
        return createMapper().readValue(in, ContextValue.class);
    }

    /// Parses a JSON object into a mapping, the usual root of a render context.
    ///
    /// @param json JSON object text, not null
    /// @return the mapping, never null
    /// @throws IllegalArgumentException if the text is not a JSON object
    public static Mapping mappingFromJson(String json) {
        ContextValue value = fromJson(json);
        if (value instanceof Mapping mapping) {
            return mapping;
        }
        throw new IllegalArgumentException(
                "Context root must be a JSON object, got " + value.getClass().getSimpleName());
    }

    /// Writes a context value as pretty-printed JSON.
    ///
    /// @param value the value, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ContextValue value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize context: " + e.getMessage(), e);
        }
    }

    /// Writes a render report as pretty-printed JSON, timestamps as ISO-8601.
    ///
    /// @param report the report, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String reportToJson(RenderReport report) {
        try {
            return createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    /// Reads a render report written by {@link #reportToJson(RenderReport)}.
    ///
    /// @param json JSON text, not null
    /// @return the report, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static RenderReport reportFromJson(String json) {
        try {
            return createMapper().readValue(json, RenderReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize report: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Stencil types.
    ///
    /// Registers:
    /// - `StencilJacksonModule` for context values and report records
    /// - `JavaTimeModule` for the report's `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StencilJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
