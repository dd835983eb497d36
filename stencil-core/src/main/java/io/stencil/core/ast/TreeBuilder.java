package io.stencil.core.ast;

import io.stencil.core.exception.TemplateSyntaxException;
import io.stencil.core.token.Token;
import io.stencil.core.token.TokenKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Builds a nested syntax tree from a token stream.
///
/// Keeps an explicit stack of open blocks. A block end always closes the innermost open
/// block, so `endloop` and `endif` can never be attributed to the wrong opener, and every
/// loop and conditional body is built exactly once.
///
/// ### Syntax errors
/// - `else`, `endloop` or `endif` with no open block, or with a different block on top
/// - a second `else` in the same conditional
/// - a loop header not of the form `VAR in PATH`
/// - an `if` without a condition
/// - a block still open at end of input (reported at its opening tag)
///
/// @implNote Stateless and thread-safe.
public final class TreeBuilder {

    private enum BlockType {
        LOOP,
        CONDITIONAL
    }

    /// An open block and the node lists collected for it so far.
    private static final class Frame {
        private final BlockType type;
        private final Token opener;
        private final List<AstNode> body = new ArrayList<>();
        private final List<AstNode> elseBody = new ArrayList<>();
        private Token elseToken;

        private Frame(BlockType type, Token opener) {
            this.type = type;
            this.opener = opener;
        }

        private List<AstNode> current() {
            return elseToken == null ? body : elseBody;
        }

        private AstNode close(Token closer) {
            if (type == BlockType.LOOP) {
                return new LoopNode(
                        opener.start(),
                        opener.raw(),
                        opener.variable(),
                        opener.collectionPath(),
                        body,
                        closer.raw());
            }
            return new ConditionalNode(
                    opener.start(),
                    opener.raw(),
                    opener.expression(),
                    body,
                    elseToken != null ? elseToken.raw() : null,
                    elseBody,
                    closer.raw());
        }
    }

    /// Builds the tree for the given tokens.
    ///
    /// @param tokens tokens in source order, not null
    /// @return top-level nodes, immutable, never null
    /// @throws TemplateSyntaxException if the block structure is malformed
    public List<AstNode> build(List<Token> tokens) {
        List<AstNode> root = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (Token token : tokens) {
            List<AstNode> target = stack.isEmpty() ? root : stack.peek().current();
            switch (token.kind()) {
                case TEXT -> target.add(new TextNode(token.start(), token.raw()));
                case PLACEHOLDER ->
                        target.add(new PlaceholderNode(token.start(), token.raw(), token.path()));
                case PARAGRAPH_PLACEHOLDER ->
                        target.add(
                                new ParagraphPlaceholderNode(
                                        token.start(), token.raw(), token.path()));
                case RAW_SPLICE ->
                        target.add(new RawSpliceNode(token.start(), token.raw(), token.path()));
                case MODULE_TAG ->
                        target.add(
                                new ModuleTagNode(
                                        token.start(),
                                        token.raw(),
                                        token.moduleName(),
                                        token.data() != null ? token.data() : ""));
                case LOOP_START -> {
                    if (token.variable() == null) {
                        throw new TemplateSyntaxException(
                                "Malformed loop tag " + token.raw() + ", expected 'loop VAR in PATH'",
                                token.start());
                    }
                    stack.push(new Frame(BlockType.LOOP, token));
                }
                case COND_IF -> {
                    if (token.expression() == null || token.expression().isEmpty()) {
                        throw new TemplateSyntaxException(
                                "Conditional tag without condition: " + token.raw(), token.start());
                    }
                    stack.push(new Frame(BlockType.CONDITIONAL, token));
                }
                case COND_ELSE -> {
                    Frame top = expectTop(stack, BlockType.CONDITIONAL, token);
                    if (top.elseToken != null) {
                        throw new TemplateSyntaxException(
                                "Duplicate else in conditional opened at position "
                                        + top.opener.start(),
                                token.start());
                    }
                    top.elseToken = token;
                }
                case LOOP_END, COND_END -> {
                    BlockType expected =
                            token.kind() == TokenKind.LOOP_END
                                    ? BlockType.LOOP
                                    : BlockType.CONDITIONAL;
                    Frame top = expectTop(stack, expected, token);
                    stack.pop();
                    List<AstNode> parent = stack.isEmpty() ? root : stack.peek().current();
                    parent.add(top.close(token));
                }
            }
        }

        if (!stack.isEmpty()) {
            Frame unterminated = stack.peek();
            throw new TemplateSyntaxException(
                    "Unterminated block " + unterminated.opener.raw(),
                    unterminated.opener.start());
        }
        return List.copyOf(root);
    }

    private static Frame expectTop(Deque<Frame> stack, BlockType expected, Token token) {
        Frame top = stack.peek();
        if (top == null) {
            throw new TemplateSyntaxException(
                    "Unexpected " + token.raw() + " without an open " + describe(expected),
                    token.start());
        }
        if (top.type != expected) {
            throw new TemplateSyntaxException(
                    "Unexpected "
                            + token.raw()
                            + " inside "
                            + describe(top.type)
                            + " opened at position "
                            + top.opener.start(),
                    token.start());
        }
        return top;
    }

    private static String describe(BlockType type) {
        return type == BlockType.LOOP ? "loop" : "conditional";
    }
}
