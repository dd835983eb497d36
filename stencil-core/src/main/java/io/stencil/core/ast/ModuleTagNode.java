package io.stencil.core.ast;

/// Module tag `{% name data %}`, left untouched by the core renderer for the owning module.
///
/// @param position source offset
/// @param raw original tag text, not null
/// @param name module tag name, not null
/// @param data remaining tag data, trimmed, not null (may be empty)
public record ModuleTagNode(int position, String raw, String name, String data)
        implements AstNode {

    @Override
    public String source() {
        return raw;
    }
}
