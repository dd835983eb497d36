package io.stencil.core.module;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Base class for modules whose render phase replaces their own `{% tag data %}` markers.
///
/// Subclasses implement {@link #renderTag(String, String, int, ModuleContext)}; each tag
/// occurrence in the text is replaced with the returned string. Text outside tags is left
/// untouched.
public abstract class AbstractTagModule implements TemplateModule {

    private final ModuleDescriptor descriptor;

    protected AbstractTagModule(ModuleDescriptor descriptor) {
        if (descriptor.tags().isEmpty()) {
            throw new IllegalArgumentException(
                    "Tag module '" + descriptor.name() + "' must declare at least one tag");
        }
        this.descriptor = descriptor;
    }

    @Override
    public ModuleDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public String render(String text, ModuleContext context) throws Exception {
        String current = text;
        for (String tag : descriptor.tags()) {
            current = replaceTags(current, tag, context);
        }
        return current;
    }

    /// Produces the replacement for one tag occurrence.
    ///
    /// @param tag tag name that matched, not null
    /// @param data trimmed tag data, empty if the tag carries none
    /// @param position offset of the tag in the text being rendered
    /// @param context module context, not null
    /// @return replacement text, not null
    /// @throws Exception if the tag cannot be rendered
    protected abstract String renderTag(String tag, String data, int position, ModuleContext context)
            throws Exception;

    private String replaceTags(String text, String tag, ModuleContext context) throws Exception {
        Pattern pattern = ModuleTags.pattern(tag);
        Matcher matcher = pattern.matcher(text);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String data = matcher.group(1) != null ? matcher.group(1).trim() : "";
            String replacement = renderTag(tag, data, matcher.start(), context);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }
}
