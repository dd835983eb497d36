package io.stencil.core.ast;

import java.util.List;

/// Conditional block with an optional else branch.
///
/// @param position source offset of the opening tag
/// @param openTag original `{% if ... %}` text, not null
/// @param expression condition expression, trimmed, not null
/// @param thenBody nodes rendered when the condition holds, immutable, not null
/// @param elseTag original `{% else %}` text, null when there is no else branch
/// @param elseBody nodes rendered otherwise, immutable, not null (may be empty)
/// @param closeTag original `{% endif %}` text, not null
public record ConditionalNode(
        int position,
        String openTag,
        String expression,
        List<AstNode> thenBody,
        String elseTag,
        List<AstNode> elseBody,
        String closeTag)
        implements AstNode {

    public ConditionalNode {
        thenBody = List.copyOf(thenBody);
        elseBody = List.copyOf(elseBody);
    }

    public boolean hasElse() {
        return elseTag != null;
    }

    @Override
    public String source() {
        StringBuilder out = new StringBuilder(openTag).append(AstNode.source(thenBody));
        if (elseTag != null) {
            out.append(elseTag).append(AstNode.source(elseBody));
        }
        return out.append(closeTag).toString();
    }
}
