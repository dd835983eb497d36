package io.stencil.core.ast;

import java.util.List;

/// A node of the template syntax tree produced by {@link TreeBuilder}.
///
/// ### Permitted Subtypes
/// - {@link TextNode} - literal text
/// - {@link PlaceholderNode} - `{{ path }}`
/// - {@link ParagraphPlaceholderNode} - `{{? path }}`
/// - {@link RawSpliceNode} - `{@ path }`
/// - {@link LoopNode} - `{% loop var in path %}...{% endloop %}`
/// - {@link ConditionalNode} - `{% if expr %}...[{% else %}...]{% endif %}`
/// - {@link ModuleTagNode} - `{% name data %}`
///
/// Every node remembers its source position and the exact text of its tags, so that
/// {@link #source()} reproduces the template fragment it was built from.
public sealed interface AstNode
        permits TextNode,
                PlaceholderNode,
                ParagraphPlaceholderNode,
                RawSpliceNode,
                LoopNode,
                ConditionalNode,
                ModuleTagNode {

    /// Offset of the node's first character in the template text.
    int position();

    /// Reconstructs the template text this node was built from.
    ///
    /// @return original source fragment, never null
    String source();

    /// Reconstructs the template text of a node list.
    ///
    /// @param nodes nodes in document order, not null
    /// @return concatenated source, never null
    static String source(List<AstNode> nodes) {
        StringBuilder out = new StringBuilder();
        for (AstNode node : nodes) {
            out.append(node.source());
        }
        return out.toString();
    }
}
