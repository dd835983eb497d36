package io.stencil.core.ast;

/// Value substitution `{{ path }}`.
///
/// @param position source offset
/// @param raw original tag text, not null
/// @param path context path, trimmed, not null
public record PlaceholderNode(int position, String raw, String path) implements AstNode {

    @Override
    public String source() {
        return raw;
    }
}
