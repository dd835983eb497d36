package io.stencil.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import io.stencil.core.StencilConfig;
import io.stencil.core.StencilEngine;
import io.stencil.core.StencilFactory;
import io.stencil.core.context.ContextValue.Scalar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonValueFormatterTest {

    private final JacksonValueFormatter formatter = new JacksonValueFormatter();

    @Test
    void shouldFormatScalarsByDisplayForm() {
        assertThat(formatter.format(Scalar.of("plain"))).isEqualTo("plain");
        assertThat(formatter.format(Scalar.of(2.0))).isEqualTo("2");
    }

    @Test
    void shouldWriteStructuredValuesAsCompactJson() {
        assertThat(formatter.format(ContextJson.fromJson("{\"a\": [1, \"b\"]}")))
                .isEqualTo("{\"a\":[1,\"b\"]}");
    }

    @Test
    void shouldPlugIntoEngineConfiguration() {
        StencilConfig config = StencilConfig.builder().valueFormatter(formatter).build();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tags", List.of("x", "y"));

        try (StencilEngine engine = StencilFactory.createEngine(config)) {
            assertThat(engine.renderText("tags={{tags}}", data)).isEqualTo("tags=[\"x\",\"y\"]");
        }
    }
}
