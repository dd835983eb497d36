package io.stencil.core.ast;

/// Literal template text, emitted verbatim.
///
/// @param position source offset
/// @param text the literal text, not null
public record TextNode(int position, String text) implements AstNode {

    @Override
    public String source() {
        return text;
    }
}
