package io.stencil.core;

import io.stencil.core.asset.AssetSink;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValues;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.exception.ModuleNotFoundException;
import io.stencil.core.exception.RenderAbortedException;
import io.stencil.core.lint.TemplateLinter;
import io.stencil.core.module.ModuleRegistry;
import io.stencil.core.module.TemplateModule;
import io.stencil.core.pipeline.CancellationSignal;
import io.stencil.core.pipeline.ContentUnit;
import io.stencil.core.pipeline.ModulePipeline;
import io.stencil.core.pipeline.RenderReport;
import io.stencil.core.template.EngineTemplateResolver;
import io.stencil.core.template.TemplateResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Entry point for rendering: a configured module registry, pipeline and worker pool.
///
/// Created by {@link StencilFactory}. One engine serves any number of render invocations,
/// sequential or concurrent; each invocation gets its own error collector and asset id
/// allocator.
///
/// ### Contracts
/// - **Invariant**: registry changes must not overlap an in-flight render
///
/// @implNote Closing the engine shuts down the worker pool when the engine created it.
/// An executor supplied through {@link StencilFactory.Builder#executorService(ExecutorService)}
/// is left to its owner.
public final class StencilEngine implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(StencilEngine.class.getName());

    static final String TEXT_UNIT_ID = "text";

    private final StencilConfig config;
    private final ModuleRegistry moduleRegistry;
    private final ModulePipeline pipeline;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final TemplateLinter linter = new TemplateLinter();

    StencilEngine(
            StencilConfig config,
            ModuleRegistry moduleRegistry,
            ExecutorService executorService,
            boolean ownsExecutor) {
        this.config = config;
        this.moduleRegistry = moduleRegistry;
        this.executorService = executorService;
        this.ownsExecutor = ownsExecutor;
        this.pipeline =
                new ModulePipeline(
                        moduleRegistry,
                        executorService,
                        config.toRenderOptions(),
                        config.getFailureScope(),
                        config.getUnitTimeout());
    }

    public StencilConfig getConfig() {
        return config;
    }

    public ModuleRegistry getModuleRegistry() {
        return moduleRegistry;
    }

    public ModulePipeline getPipeline() {
        return pipeline;
    }

    /// Registers a module.
    ///
    /// @param module the module, not null
    /// @return this engine for chaining
    /// @throws IllegalArgumentException if the module name is taken
    public StencilEngine register(TemplateModule module) {
        moduleRegistry.register(module);
        return this;
    }

    public RenderReport render(List<ContentUnit> units, ContextValue context) {
        return pipeline.run(units, context);
    }

    public RenderReport render(List<ContentUnit> units, ContextValue context, AssetSink assets) {
        return pipeline.run(units, context, assets, CancellationSignal.none());
    }

    /// Renders content units.
    ///
    /// @param units units to render, not null
    /// @param context data snapshot, not null
    /// @param assets asset embedding handle, not null
    /// @param cancellation external cancellation, not null
    /// @return the report, never null
    /// @throws RenderAbortedException if a strict failure aborts the invocation
    public RenderReport render(
            List<ContentUnit> units,
            ContextValue context,
            AssetSink assets,
            CancellationSignal cancellation) {
        return pipeline.run(units, context, assets, cancellation);
    }

    /// Renders a single template string.
    ///
    /// @param text template, not null
    /// @param context data snapshot, not null
    /// @return rendered text; in lenient mode, the raw text if it does not parse
    /// @throws RenderAbortedException if the unit produced no output
    public String renderText(String text, ContextValue context) {
        RenderReport report = pipeline.run(List.of(ContentUnit.of(TEXT_UNIT_ID, text)), context);
        return report.text(TEXT_UNIT_ID)
                .orElseThrow(() -> new RenderAbortedException(firstFailure(report), report));
    }

    /// Renders a single template string against plain Java data.
    ///
    /// @param text template, not null
    /// @param context data as maps, collections and scalars, not null
    /// @return rendered text
    /// @throws IllegalArgumentException if the data contains unsupported types
    public String renderText(String text, Map<String, ?> context) {
        return renderText(text, ContextValues.mapping(context));
    }

    /// Runs all phases of one module on one unit without the core render.
    ///
    /// @see ModulePipeline#runModule(String, ContentUnit, ContextValue, AssetSink)
    public RenderReport runModule(
            String moduleName, ContentUnit unit, ContextValue context, AssetSink assets)
            throws ModuleNotFoundException {
        return pipeline.runModule(moduleName, unit, context, assets);
    }

    /// Checks units for syntax problems and missing data without rendering.
    ///
    /// Runs the template linter and the `validate` hook of every module that would process
    /// the unit. Records carry the unit id.
    ///
    /// @param units units to check, not null
    /// @param context data to check paths against, not null
    /// @return findings, unit by unit in input order, never null
    public List<ErrorRecord> validate(List<ContentUnit> units, ContextValue context) {
        List<ErrorRecord> records = new ArrayList<>();
        List<TemplateModule> modules = moduleRegistry.modules();
        for (ContentUnit unit : units) {
            for (ErrorRecord record : linter.lint(unit.rawText(), context)) {
                records.add(record.withContentUnitId(unit.id()));
            }
            for (TemplateModule module : modules) {
                if (module.shouldProcess(unit.rawText(), unit.fileType())) {
                    for (ErrorRecord record : module.validate(unit.rawText())) {
                        records.add(record.withContentUnitId(unit.id()));
                    }
                }
            }
        }
        logger.fine("Validated " + units.size() + " units: " + records.size() + " findings");
        return records;
    }

    /// Returns a resolver rendering strings through this engine.
    public TemplateResolver getTemplateResolver() {
        return new EngineTemplateResolver(this);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executorService.shutdown();
        }
    }

    private static ErrorRecord firstFailure(RenderReport report) {
        return report.errors().stream()
                .filter(ErrorRecord::isFatal)
                .findFirst()
                .orElseGet(() -> report.errors().get(report.errors().size() - 1));
    }
}
