package io.stencil.core.render;

import java.util.Objects;
import java.util.function.Supplier;

/// Policy knobs for the {@link Renderer}.
///
/// @param strict raise instead of substituting when a placeholder path or loop target is bad
/// @param nullGetter supplies the text used for missing and null values, not null
/// @param valueFormatter formats resolved values, not null
public record RenderOptions(
        boolean strict, Supplier<String> nullGetter, ValueFormatter valueFormatter) {

    /// Lenient rendering, empty string for missing values, built-in formatting.
    public static final RenderOptions DEFAULTS =
            new RenderOptions(false, () -> "", DefaultValueFormatter.INSTANCE);

    public RenderOptions {
        Objects.requireNonNull(nullGetter, "nullGetter must not be null");
        Objects.requireNonNull(valueFormatter, "valueFormatter must not be null");
    }

    public RenderOptions withStrict(boolean value) {
        return new RenderOptions(value, nullGetter, valueFormatter);
    }

    /// Returns the null getter's text, treating a null result as empty.
    public String nullText() {
        String text = nullGetter.get();
        return text != null ? text : "";
    }
}
