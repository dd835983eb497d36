package io.stencil.core.module;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/// Patterns matching module tags of the form `{% name data %}`.
///
/// The data part is optional and ends at the first `%}`, as in the tokenizer, so it may
/// contain `%` and line breaks. A tag name only matches as a whole word, so `image` does not
/// match `{% images x %}`.
public final class ModuleTags {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private ModuleTags() {}

    /// Returns the pattern for one tag name. Group 1 captures the raw data, or is null when the
    /// tag carries none.
    ///
    /// @param tag tag name, not null
    /// @return compiled pattern, cached, never null
    public static Pattern pattern(String tag) {
        return PATTERNS.computeIfAbsent(
                tag,
                t ->
                        Pattern.compile(
                                "\\{%\\s*" + Pattern.quote(t) + "(?:\\s+(.*?))?\\s*%}",
                                Pattern.DOTALL));
    }

    /// Returns whether the text contains at least one tag with the given name.
    public static boolean contains(String text, String tag) {
        return pattern(tag).matcher(text).find();
    }
}
