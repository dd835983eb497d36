package io.stencil.core.module;

/// The points in a content unit's processing at which a module may act.
///
/// ```
/// raw text
///    │ PREPARSE          (text -> text)
///    │ tokenize
///    │ TOKEN_TRANSFORM   (tokens -> tokens)
///    │ build tree + core render
///    │ RENDER            (text -> text, module tags replaced)
///    │ POSTRENDER        (text -> text)
///    V
/// rendered text
/// ```
public enum ModulePhase {
    PREPARSE("preparse"),
    TOKEN_TRANSFORM("tokenTransform"),
    RENDER("render"),
    POSTRENDER("postrender");

    private final String label;

    ModulePhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
