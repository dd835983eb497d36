package io.stencil.core.ast;

/// Substitution `{{? path }}` that asks for its enclosing block to be removed when the value
/// is missing or empty.
///
/// @param position source offset
/// @param raw original tag text, not null
/// @param path context path, trimmed, not null
public record ParagraphPlaceholderNode(int position, String raw, String path) implements AstNode {

    @Override
    public String source() {
        return raw;
    }
}
