package io.stencil.core.pipeline;

import java.util.Objects;

/// One independently renderable piece of a document, e.g. the XML of a single slide.
///
/// @param id unique id within one render invocation, not null
/// @param fileType container format hint such as `docx`, may be null
/// @param rawText template text, not null
public record ContentUnit(String id, String fileType, String rawText) {

    public ContentUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
    }

    /// Creates a unit without a file type.
    public static ContentUnit of(String id, String rawText) {
        return new ContentUnit(id, null, rawText);
    }
}
