package io.stencil.core.template;

import java.util.Map;

/// Resolves a template string against plain Java data.
public interface TemplateResolver {
    String resolve(String template, Map<String, Object> context);
}
