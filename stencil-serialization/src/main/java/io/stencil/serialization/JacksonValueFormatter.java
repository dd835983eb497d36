package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.render.ValueFormatter;

/// {@link ValueFormatter} that writes structured values with Jackson.
///
/// Scalars keep their display form; sequences and mappings are written as compact JSON by the
/// given mapper, so a caller can plug in its own mapper features.
///
/// @implNote Thread-safe once constructed. The mapper must not be reconfigured afterwards.
public class JacksonValueFormatter implements ValueFormatter {

    private final ObjectMapper mapper;

    public JacksonValueFormatter() {
        this(ContextJson.createMapper().disable(SerializationFeature.INDENT_OUTPUT));
    }

    /// Creates a formatter using the given mapper.
    ///
    /// @param mapper mapper with {@link StencilJacksonModule} registered, not null
    public JacksonValueFormatter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String format(ContextValue value) {
        if (value instanceof Scalar scalar) {
            return scalar.asText();
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to format value: " + e.getMessage(), e);
        }
    }
}
