package io.stencil.core.render;

import io.stencil.core.ast.AstNode;
import io.stencil.core.ast.ConditionalNode;
import io.stencil.core.ast.LoopNode;
import io.stencil.core.ast.ModuleTagNode;
import io.stencil.core.ast.ParagraphPlaceholderNode;
import io.stencil.core.ast.PlaceholderNode;
import io.stencil.core.ast.RawSpliceNode;
import io.stencil.core.ast.TextNode;
import io.stencil.core.context.ContextResolver;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.context.ContextValue.Sequence;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.ErrorSink;
import io.stencil.core.exception.ContextTypeException;
import io.stencil.core.exception.ResolutionException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Evaluates a syntax tree against a context.
///
/// ### Node semantics
/// - **Text**: copied verbatim.
/// - **Placeholder**: the resolved value formatted by the {@link ValueFormatter}. A missing
///   path produces the null getter's text and a recoverable `RESOLUTION` record, or a
///   {@link ResolutionException} in strict mode.
/// - **Paragraph placeholder**: a missing, null or empty value (empty string, sequence or
///   mapping) produces no text and a
///   {@link HintKind#REMOVE_ENCLOSING_BLOCK} hint; otherwise behaves like a placeholder.
/// - **Raw splice**: the value's display form, unescaped. Missing values produce no text and
///   never fail.
/// - **Loop**: the body is rendered once per element of the resolved sequence, in a scope
///   where the loop variable, `$index`, `$first`, `$last` and `$length` shadow outer names.
///   A target that is not a sequence is a `TYPE` error (recorded, or a
///   {@link ContextTypeException} in strict mode) and produces no text.
/// - **Conditional**: see {@link ConditionEvaluator}.
/// - **Module tag**: copied as its original tag text for the module pipeline to handle.
///
/// @implNote Not thread-safe: a renderer accumulates hints while rendering. Create one per
/// render call. Syntax trees and contexts are only read, so they can be shared.
public final class Renderer {

    public static final String INDEX = "$index";
    public static final String FIRST = "$first";
    public static final String LAST = "$last";
    public static final String LENGTH = "$length";

    private final RenderOptions options;
    private final ErrorSink errors;
    private final ConditionEvaluator conditions;
    private final List<StructuralHint> hints = new ArrayList<>();

    /// Creates a renderer.
    ///
    /// @param options rendering policy, not null
    /// @param errors sink for recoverable diagnostics, not null
    public Renderer(RenderOptions options, ErrorSink errors) {
        this.options = options;
        this.errors = errors;
        this.conditions = new ConditionEvaluator(errors);
    }

    /// Renders the nodes against the context.
    ///
    /// @param nodes syntax tree, not null
    /// @param context root scope, not null
    /// @return rendered text and the hints produced by this call, never null
    /// @throws ResolutionException in strict mode for a missing placeholder path
    /// @throws ContextTypeException in strict mode for a loop target that is not a sequence
    public RenderResult render(List<AstNode> nodes, ContextValue context) {
        int before = hints.size();
        StringBuilder out = new StringBuilder();
        renderNodes(nodes, context, out);
        return new RenderResult(out.toString(), hints.subList(before, hints.size()));
    }

    private void renderNodes(List<AstNode> nodes, ContextValue scope, StringBuilder out) {
        for (AstNode node : nodes) {
            renderNode(node, scope, out);
        }
    }

    private void renderNode(AstNode node, ContextValue scope, StringBuilder out) {
        if (node instanceof TextNode text) {
            out.append(text.text());
        } else if (node instanceof PlaceholderNode placeholder) {
            renderPlaceholder(placeholder, scope, out);
        } else if (node instanceof ParagraphPlaceholderNode paragraph) {
            renderParagraphPlaceholder(paragraph, scope, out);
        } else if (node instanceof RawSpliceNode splice) {
            ContextResolver.resolve(scope, splice.path())
                    .filter(value -> !(value instanceof Scalar scalar && scalar.isNull()))
                    .ifPresent(value -> out.append(options.valueFormatter().format(value)));
        } else if (node instanceof LoopNode loop) {
            renderLoop(loop, scope, out);
        } else if (node instanceof ConditionalNode conditional) {
            boolean taken =
                    conditions.evaluate(conditional.expression(), scope, conditional.position());
            renderNodes(taken ? conditional.thenBody() : conditional.elseBody(), scope, out);
        } else if (node instanceof ModuleTagNode moduleTag) {
            out.append(moduleTag.raw());
        }
    }

    private void renderPlaceholder(PlaceholderNode node, ContextValue scope, StringBuilder out) {
        Optional<ContextValue> value = ContextResolver.resolve(scope, node.path());
        if (value.isEmpty()) {
            if (options.strict()) {
                throw new ResolutionException(node.path(), node.position());
            }
            errors.add(
                    ErrorRecord.recoverable(
                            ErrorKind.RESOLUTION,
                            "Missing data for placeholder: " + node.path(),
                            null,
                            node.position()));
            out.append(options.nullText());
            return;
        }
        out.append(format(value.get()));
    }

    private void renderParagraphPlaceholder(
            ParagraphPlaceholderNode node, ContextValue scope, StringBuilder out) {
        Optional<ContextValue> value = ContextResolver.resolve(scope, node.path());
        if (value.isEmpty() || value.get().isEmpty()) {
            hints.add(StructuralHint.removeEnclosingBlock(node.position(), node.path()));
            return;
        }
        out.append(format(value.get()));
    }

    private void renderLoop(LoopNode loop, ContextValue scope, StringBuilder out) {
        Optional<ContextValue> target = ContextResolver.resolve(scope, loop.collectionPath());
        if (target.isEmpty() || !(target.get() instanceof Sequence sequence)) {
            String message =
                    target.isEmpty()
                            ? "Loop collection not found: " + loop.collectionPath()
                            : "Loop collection is not a sequence: " + loop.collectionPath();
            if (options.strict()) {
                throw new ContextTypeException(message, loop.position());
            }
            errors.add(
                    ErrorRecord.recoverable(ErrorKind.TYPE, message, null, loop.position()));
            return;
        }

        int length = sequence.size();
        for (int i = 0; i < length; i++) {
            Map<String, ContextValue> bindings = new HashMap<>();
            bindings.put(loop.variable(), sequence.get(i));
            bindings.put(INDEX, Scalar.of(i));
            bindings.put(FIRST, Scalar.of(i == 0));
            bindings.put(LAST, Scalar.of(i == length - 1));
            bindings.put(LENGTH, Scalar.of(length));
            renderNodes(loop.body(), derive(scope, bindings), out);
        }
    }

    private static ContextValue derive(ContextValue scope, Map<String, ContextValue> bindings) {
        if (scope instanceof Mapping mapping) {
            return mapping.shadow(bindings);
        }
        return Mapping.of(bindings);
    }

    private String format(ContextValue value) {
        if (value instanceof Scalar scalar && scalar.isNull()) {
            return options.nullText();
        }
        return options.valueFormatter().format(value);
    }
}
