package io.stencil.core.pipeline;

import io.stencil.core.ast.AstNode;
import io.stencil.core.ast.TreeBuilder;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.ErrorSink;
import io.stencil.core.error.Severity;
import io.stencil.core.exception.ModuleExecutionException;
import io.stencil.core.exception.StencilException;
import io.stencil.core.exception.TemplateSyntaxException;
import io.stencil.core.module.ModuleContext;
import io.stencil.core.module.ModulePhase;
import io.stencil.core.module.TemplateModule;
import io.stencil.core.render.RenderOptions;
import io.stencil.core.render.RenderResult;
import io.stencil.core.render.Renderer;
import io.stencil.core.token.Token;
import io.stencil.core.token.Tokenizer;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/// Takes one content unit through preparse, tokenize, token transform, tree build, core
/// render, module render and postrender.
///
/// ### Contracts
/// - **Postcondition**: returns a {@link RenderedUnit} for every failure the policy absorbs;
///   throws {@link CancellationException} only when the invocation is cancelled
/// - **Invariant**: module applicability is checked before every phase, against the text as
///   it stands at that point, so a tag introduced by an earlier module or by rendered data
///   still reaches the module that handles it
///
/// @implNote Stateless and thread-safe. One instance serves every worker of a pipeline.
final class UnitProcessor {

    private static final Logger logger = Logger.getLogger(UnitProcessor.class.getName());

    private final Tokenizer tokenizer = new Tokenizer();
    private final TreeBuilder treeBuilder = new TreeBuilder();
    private final RenderOptions options;
    private final FailureScope failureScope;

    UnitProcessor(RenderOptions options, FailureScope failureScope) {
        this.options = options;
        this.failureScope = failureScope;
    }

    RenderedUnit process(
            ContentUnit unit, RenderInvocation invocation, List<TemplateModule> modules) {
        checkCancelled(invocation);
        logger.fine("Processing unit " + unit.id());

        ErrorSink errors = invocation.errors().forUnit(unit.id());
        ModuleContext context =
                new ModuleContext(
                        invocation.context(),
                        unit.fileType(),
                        unit.id(),
                        options,
                        errors,
                        invocation.assetIds(),
                        invocation.assets());
        try {
            String text =
                    runTextPhase(
                            ModulePhase.PREPARSE, modules, unit.rawText(), context, invocation, true);

            List<Token> tokens = tokenizer.tokenize(text);
            tokens = runTokenPhase(modules, tokens, context, invocation, true);

            List<AstNode> nodes;
            try {
                nodes = treeBuilder.build(tokens);
            } catch (TemplateSyntaxException e) {
                return syntaxFailure(unit, e, invocation);
            }

            checkCancelled(invocation);
            RenderResult result = new Renderer(options, errors).render(nodes, invocation.context());

            text =
                    runTextPhase(
                            ModulePhase.RENDER, modules, result.text(), context, invocation, true);
            text = runTextPhase(ModulePhase.POSTRENDER, modules, text, context, invocation, true);
            return RenderedUnit.rendered(unit, text, result.hints());
        } catch (StencilException e) {
            return fatal(unit, e.toRecord(unit.id(), Severity.FATAL), invocation, failureScope);
        }
    }

    /// Runs every phase of a single module on a unit, without the core render.
    RenderedUnit processWithModule(
            ContentUnit unit, RenderInvocation invocation, TemplateModule module) {
        ErrorSink errors = invocation.errors().forUnit(unit.id());
        ModuleContext context =
                new ModuleContext(
                        invocation.context(),
                        unit.fileType(),
                        unit.id(),
                        options,
                        errors,
                        invocation.assetIds(),
                        invocation.assets());
        List<TemplateModule> only = List.of(module);
        try {
            String text =
                    runTextPhase(
                            ModulePhase.PREPARSE, only, unit.rawText(), context, invocation, false);
            List<Token> tokens =
                    runTokenPhase(only, tokenizer.tokenize(text), context, invocation, false);
            text = Token.source(tokens);
            text = runTextPhase(ModulePhase.RENDER, only, text, context, invocation, false);
            text = runTextPhase(ModulePhase.POSTRENDER, only, text, context, invocation, false);
            return RenderedUnit.rendered(unit, text, List.of());
        } catch (StencilException e) {
            return fatal(unit, e.toRecord(unit.id(), Severity.FATAL), invocation, failureScope);
        }
    }

    private String runTextPhase(
            ModulePhase phase,
            List<TemplateModule> modules,
            String text,
            ModuleContext context,
            RenderInvocation invocation,
            boolean checkApplicability) {
        String current = text;
        for (TemplateModule module : modules) {
            if (!module.descriptor().handles(phase)
                    || (checkApplicability
                            && !module.shouldProcess(current, context.fileType()))) {
                continue;
            }
            checkCancelled(invocation);
            try {
                String output =
                        switch (phase) {
                            case PREPARSE -> module.preparse(current, context);
                            case RENDER -> module.render(current, context);
                            case POSTRENDER -> module.postrender(current, context);
                            case TOKEN_TRANSFORM -> current;
                        };
                if (output == null) {
                    throw new IllegalStateException("phase returned null");
                }
                current = output;
            } catch (Exception e) {
                moduleFailure(module, phase, e, context, invocation);
            }
        }
        return current;
    }

    private List<Token> runTokenPhase(
            List<TemplateModule> modules,
            List<Token> tokens,
            ModuleContext context,
            RenderInvocation invocation,
            boolean checkApplicability) {
        List<Token> current = tokens;
        for (TemplateModule module : modules) {
            if (!module.descriptor().handles(ModulePhase.TOKEN_TRANSFORM)
                    || (checkApplicability
                            && !module.shouldProcess(
                                    Token.source(current), context.fileType()))) {
                continue;
            }
            checkCancelled(invocation);
            try {
                List<Token> output = module.transformTokens(current, context);
                if (output == null) {
                    throw new IllegalStateException("phase returned null");
                }
                current = List.copyOf(output);
            } catch (Exception e) {
                moduleFailure(module, ModulePhase.TOKEN_TRANSFORM, e, context, invocation);
            }
        }
        return current;
    }

    // Lenient: record and keep the pre-phase value. Strict: escalate as a fatal MODULE error.
    private void moduleFailure(
            TemplateModule module,
            ModulePhase phase,
            Exception cause,
            ModuleContext context,
            RenderInvocation invocation) {
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        checkCancelled(invocation);
        ModuleExecutionException failure = new ModuleExecutionException(module.name(), phase, cause);
        if (options.strict()) {
            throw failure;
        }
        logger.warning("Unit " + context.unitId() + ": " + failure.getMessage());
        context.errors().add(failure.toRecord(null, Severity.RECOVERABLE));
    }

    private RenderedUnit syntaxFailure(
            ContentUnit unit, TemplateSyntaxException e, RenderInvocation invocation) {
        ErrorRecord record = e.toRecord(unit.id(), Severity.FATAL);
        if (options.strict()) {
            return fatal(unit, record, invocation, FailureScope.INVOCATION);
        }
        logger.warning("Unit " + unit.id() + " passed through unrendered: " + e.getMessage());
        invocation.errors().add(record);
        return RenderedUnit.passedThrough(unit);
    }

    private static RenderedUnit fatal(
            ContentUnit unit, ErrorRecord record, RenderInvocation invocation, FailureScope scope) {
        logger.warning("Unit " + unit.id() + " aborted: " + record.message());
        invocation.errors().add(record);
        invocation.markAborted(unit.id());
        if (scope == FailureScope.INVOCATION) {
            invocation.abort(record);
        }
        return RenderedUnit.aborted(unit);
    }

    private static void checkCancelled(RenderInvocation invocation) {
        if (invocation.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Render invocation cancelled");
        }
    }
}
