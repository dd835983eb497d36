package io.stencil.core.ast;

import java.util.List;

/// Loop block. The body is built once and evaluated once per element of the collection.
///
/// @param position source offset of the opening tag
/// @param openTag original `{% loop ... %}` text, not null
/// @param variable name the current element is bound to, not null
/// @param collectionPath context path of the sequence to iterate, not null
/// @param body nested nodes, immutable, not null
/// @param closeTag original `{% endloop %}` text, not null
public record LoopNode(
        int position,
        String openTag,
        String variable,
        String collectionPath,
        List<AstNode> body,
        String closeTag)
        implements AstNode {

    public LoopNode {
        body = List.copyOf(body);
    }

    @Override
    public String source() {
        return openTag + AstNode.source(body) + closeTag;
    }
}
