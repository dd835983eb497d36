package io.stencil.core.pipeline;

import io.stencil.core.asset.AssetSink;
import io.stencil.core.context.ContextValue;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.exception.ModuleNotFoundException;
import io.stencil.core.exception.RenderAbortedException;
import io.stencil.core.exception.StencilException;
import io.stencil.core.module.ModuleRegistry;
import io.stencil.core.module.TemplateModule;
import io.stencil.core.render.RenderOptions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Renders a list of content units through the registered modules.
///
/// Each unit is submitted to the {@link ExecutorService} as its own task; results are
/// collected in input order. Units never share text, tokens or trees; they share the
/// read-only context, the invocation's error collector and its asset id allocator.
///
/// ### Contracts
/// - **Precondition**: unit ids are unique within one call
/// - **Postcondition**: the report lists every unit in input order with its status
/// - **Invariant**: the module list is snapshotted when the call starts
///
/// ### Failure handling
/// - Lenient: every failure is recorded and absorbed; a unit with a syntax error passes
///   through with its raw text
/// - Strict with {@link FailureScope#UNIT}: the failing unit is reported as
///   {@link UnitStatus#ABORTED}, the others still render
/// - Strict with {@link FailureScope#INVOCATION}, and any strict syntax error: remaining units
///   are cancelled and {@link RenderAbortedException} carries the partial report
/// - A unit exceeding the unit timeout is cancelled and recorded as a FATAL MODULE error for
///   that unit only
///
/// @implNote The ExecutorService is NOT shut down by this pipeline; its owner manages the
/// lifecycle. The unit timeout is measured from the moment the pipeline starts waiting for
/// the unit, so a unit queued behind others gets at least the configured time.
///
/// @see UnitProcessor for the per-unit steps
public final class ModulePipeline {

    private static final Logger logger = Logger.getLogger(ModulePipeline.class.getName());

    private final ModuleRegistry registry;
    private final ExecutorService executor;
    private final UnitProcessor processor;
    private final Duration unitTimeout;

    /// Creates a pipeline.
    ///
    /// @param registry modules to run, not null
    /// @param executor executor running the units, not null
    /// @param options rendering policy, not null
    /// @param failureScope reach of strict-mode failures, not null
    /// @param unitTimeout per-unit time limit, null for none
    public ModulePipeline(
            ModuleRegistry registry,
            ExecutorService executor,
            RenderOptions options,
            FailureScope failureScope,
            Duration unitTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.processor =
                new UnitProcessor(
                        Objects.requireNonNull(options, "options must not be null"),
                        Objects.requireNonNull(failureScope, "failureScope must not be null"));
        this.unitTimeout = unitTimeout;
    }

    public RenderReport run(List<ContentUnit> units, ContextValue context) {
        return run(units, context, AssetSink.unsupported(), CancellationSignal.none());
    }

    /// Renders every unit.
    ///
    /// @param units units to render, not null (may be empty)
    /// @param context data snapshot shared by every unit, not null
    /// @param assets handle for embedding binary assets, not null
    /// @param cancellation external cancellation signal, not null
    /// @return report with one entry per unit, never null
    /// @throws RenderAbortedException if a strict failure aborts the invocation
    /// @throws IllegalArgumentException if two units share an id
    /// @throws StencilException with kind CANCELLED if the calling thread is interrupted
    public RenderReport run(
            List<ContentUnit> units,
            ContextValue context,
            AssetSink assets,
            CancellationSignal cancellation) {
        requireUniqueIds(units);
        Instant startedAt = Instant.now();
        List<TemplateModule> modules = registry.modules();
        RenderInvocation invocation = new RenderInvocation(context, assets);

        logger.info("Rendering " + units.size() + " units with " + modules.size() + " modules");

        Runnable onCancel = invocation::cancel;
        cancellation.onCancel(onCancel);
        try {
            List<Future<RenderedUnit>> futures = new ArrayList<>(units.size());
            for (ContentUnit unit : units) {
                Future<RenderedUnit> future =
                        executor.submit(() -> processor.process(unit, invocation, modules));
                invocation.track(future);
                futures.add(future);
            }

            List<RenderedUnit> results = new ArrayList<>(units.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(units.get(i), futures.get(i), invocation));
            }
            return finish(results, invocation, startedAt);
        } finally {
            cancellation.removeListener(onCancel);
        }
    }

    /// Runs every phase of one module on one unit, skipping the core tokenize/render steps.
    ///
    /// Runs on the calling thread. The module's applicability check is bypassed.
    ///
    /// @param moduleName registered module name, not null
    /// @param unit the unit, not null
    /// @param context data snapshot, not null
    /// @param assets handle for embedding binary assets, not null
    /// @return report for the single unit, never null
    /// @throws ModuleNotFoundException if no module has that name
    /// @throws RenderAbortedException if a strict failure aborts the invocation
    public RenderReport runModule(
            String moduleName, ContentUnit unit, ContextValue context, AssetSink assets)
            throws ModuleNotFoundException {
        TemplateModule module = registry.getModuleOrThrow(moduleName);
        Instant startedAt = Instant.now();
        RenderInvocation invocation = new RenderInvocation(context, assets);
        logger.fine("Running module " + moduleName + " on unit " + unit.id());
        RenderedUnit result = processor.processWithModule(unit, invocation, module);
        return finish(List.of(result), invocation, startedAt);
    }

    private RenderedUnit collect(
            ContentUnit unit, Future<RenderedUnit> future, RenderInvocation invocation) {
        try {
            return unitTimeout == null
                    ? future.get()
                    : future.get(unitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warning("Unit timed out after " + unitTimeout + ": " + unit.id());
            future.cancel(true);
            invocation
                    .errors()
                    .add(
                            ErrorRecord.fatal(
                                    ErrorKind.MODULE,
                                    "Unit timed out after " + unitTimeout.toMillis() + " ms",
                                    unit.id(),
                                    null));
            return RenderedUnit.cancelled(unit);
        } catch (CancellationException e) {
            return abandoned(unit, invocation);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                return abandoned(unit, invocation);
            }
            // Anything else escaped the processor's own error handling
            logger.warning(
                    "Unit failed with exception: " + unit.id() + " - " + e.getCause().getMessage());
            invocation
                    .errors()
                    .add(
                            ErrorRecord.fatal(
                                    ErrorKind.MODULE,
                                    "Unit failed: " + e.getCause(),
                                    unit.id(),
                                    null));
            return RenderedUnit.aborted(unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            invocation.cancel();
            throw new StencilException(ErrorKind.CANCELLED, "Render interrupted", null, e);
        }
    }

    private static RenderedUnit abandoned(ContentUnit unit, RenderInvocation invocation) {
        if (invocation.isAborted(unit.id())) {
            return RenderedUnit.aborted(unit);
        }
        invocation
                .errors()
                .add(
                        ErrorRecord.recoverable(
                                ErrorKind.CANCELLED,
                                "Unit abandoned after cancellation",
                                unit.id(),
                                null));
        return RenderedUnit.cancelled(unit);
    }

    private static RenderReport finish(
            List<RenderedUnit> results, RenderInvocation invocation, Instant startedAt) {
        RenderReport report =
                new RenderReport(results, invocation.errors().all(), startedAt, Instant.now());
        ErrorRecord abort = invocation.abortRecord();
        if (abort != null) {
            logger.warning("Render aborted: " + abort.message());
            throw new RenderAbortedException(abort, report);
        }
        logger.info(
                "Rendered "
                        + report.outputs().size()
                        + "/"
                        + results.size()
                        + " units with "
                        + report.errors().size()
                        + " errors in "
                        + report.duration().toMillis()
                        + " ms");
        return report;
    }

    private static void requireUniqueIds(List<ContentUnit> units) {
        Set<String> seen = new HashSet<>();
        for (ContentUnit unit : units) {
            if (!seen.add(unit.id())) {
                throw new IllegalArgumentException("Duplicate content unit id: " + unit.id());
            }
        }
    }
}
