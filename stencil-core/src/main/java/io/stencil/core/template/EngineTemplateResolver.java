package io.stencil.core.template;

import io.stencil.core.StencilEngine;
import java.util.Map;

/// Template resolver backed by a {@link StencilEngine}, with the engine's modules and policy.
public class EngineTemplateResolver implements TemplateResolver {

    private final StencilEngine engine;

    public EngineTemplateResolver(StencilEngine engine) {
        this.engine = engine;
    }

    @Override
    public String resolve(String template, Map<String, Object> context) {
        if (template == null) {
            return "";
        }
        return engine.renderText(template, context != null ? context : Map.of());
    }
}
