package io.stencil.core.lint;

import io.stencil.core.ast.AstNode;
import io.stencil.core.ast.ConditionalNode;
import io.stencil.core.ast.LoopNode;
import io.stencil.core.ast.ModuleTagNode;
import io.stencil.core.ast.PlaceholderNode;
import io.stencil.core.ast.TreeBuilder;
import io.stencil.core.context.ContextResolver;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Sequence;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.Severity;
import io.stencil.core.exception.TemplateSyntaxException;
import io.stencil.core.token.Token;
import io.stencil.core.token.TokenKind;
import io.stencil.core.token.Tokenizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Checks a template against a context without rendering it.
///
/// Reports, with template positions:
/// - opening delimiters that are never closed (SYNTAX, FATAL)
/// - unbalanced or malformed blocks (SYNTAX, FATAL)
/// - placeholders whose path is missing from the context (RESOLUTION, RECOVERABLE)
/// - loops over missing or non-sequence values (TYPE, RECOVERABLE)
/// - module tags whose data path is missing from the context (MODULE, RECOVERABLE)
///
/// Paths rooted at a variable of an enclosing loop, or at a `$` binding, are not checked.
/// Paragraph placeholders and raw splices are never reported: a missing value is a valid
/// outcome for both.
///
/// @implNote Stateless and thread-safe.
public final class TemplateLinter {

    private static final String[] OPENERS = {"{@", "{{", "{%"};

    private final Tokenizer tokenizer = new Tokenizer();
    private final TreeBuilder treeBuilder = new TreeBuilder();

    /// Lints one template.
    ///
    /// @param text template text, not null
    /// @param context data to check paths against, not null
    /// @return findings in document order, never null (may be empty)
    public List<ErrorRecord> lint(String text, ContextValue context) {
        List<ErrorRecord> records = new ArrayList<>();
        List<Token> tokens = tokenizer.tokenize(text);

        for (Token token : tokens) {
            if (token.kind() == TokenKind.TEXT && startsWithOpener(token.raw())) {
                records.add(
                        new ErrorRecord(
                                ErrorKind.SYNTAX,
                                "Unclosed tag '" + token.raw().substring(0, 2) + "'",
                                null,
                                token.start(),
                                Severity.FATAL));
            }
        }

        List<AstNode> nodes;
        try {
            nodes = treeBuilder.build(tokens);
        } catch (TemplateSyntaxException e) {
            records.add(e.toRecord(null, Severity.FATAL));
            return records;
        }

        walk(nodes, context, new HashSet<>(), records);
        return records;
    }

    private void walk(
            List<AstNode> nodes, ContextValue context, Set<String> bound, List<ErrorRecord> out) {
        for (AstNode node : nodes) {
            if (node instanceof PlaceholderNode placeholder) {
                if (isMissing(placeholder.path(), context, bound)) {
                    out.add(
                            ErrorRecord.recoverable(
                                    ErrorKind.RESOLUTION,
                                    "Missing data for placeholder: " + placeholder.path(),
                                    null,
                                    placeholder.position()));
                }
            } else if (node instanceof LoopNode loop) {
                checkLoop(loop, context, bound, out);
                Set<String> inner = new HashSet<>(bound);
                inner.add(loop.variable());
                walk(loop.body(), context, inner, out);
            } else if (node instanceof ConditionalNode conditional) {
                walk(conditional.thenBody(), context, bound, out);
                walk(conditional.elseBody(), context, bound, out);
            } else if (node instanceof ModuleTagNode tag) {
                String data = tag.data();
                if (!data.isEmpty()
                        && data.chars().noneMatch(Character::isWhitespace)
                        && isMissing(data, context, bound)) {
                    out.add(
                            ErrorRecord.recoverable(
                                    ErrorKind.MODULE,
                                    "Missing data for module tag " + tag.name() + ": " + data,
                                    null,
                                    tag.position()));
                }
            }
        }
    }

    private static void checkLoop(
            LoopNode loop, ContextValue context, Set<String> bound, List<ErrorRecord> out) {
        String path = loop.collectionPath();
        if (isBound(path, bound)) {
            return;
        }
        Optional<ContextValue> value = ContextResolver.resolve(context, path);
        if (value.isEmpty()) {
            out.add(
                    ErrorRecord.recoverable(
                            ErrorKind.TYPE,
                            "Missing loop collection: " + path,
                            null,
                            loop.position()));
        } else if (!(value.get() instanceof Sequence)) {
            out.add(
                    ErrorRecord.recoverable(
                            ErrorKind.TYPE,
                            "Loop collection is not a sequence: " + path,
                            null,
                            loop.position()));
        }
    }

    private static boolean isMissing(String path, ContextValue context, Set<String> bound) {
        return !isBound(path, bound) && !ContextResolver.exists(context, path);
    }

    private static boolean isBound(String path, Set<String> bound) {
        int dot = path.indexOf('.');
        String root = dot < 0 ? path : path.substring(0, dot);
        return root.startsWith("$") || bound.contains(root);
    }

    private static boolean startsWithOpener(String raw) {
        for (String opener : OPENERS) {
            if (raw.startsWith(opener)) {
                return true;
            }
        }
        return false;
    }
}
