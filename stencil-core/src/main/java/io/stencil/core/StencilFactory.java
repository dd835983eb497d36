package io.stencil.core;

import io.stencil.core.asset.AssetFetcher;
import io.stencil.core.asset.ImageModule;
import io.stencil.core.module.DefaultModuleRegistry;
import io.stencil.core.module.ModuleRegistry;
import io.stencil.core.module.TemplateModule;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for creating fully wired {@link StencilEngine} instances.
///
/// ### Usage
/// ```java
/// try (StencilEngine engine = StencilFactory.builder()
///         .config(StencilConfig.builder().strict(true).build())
///         .imageModule(url -> download(url))
///         .build()) {
///     RenderReport report = engine.render(units, context, assetSink);
/// }
/// ```
///
/// @see StencilConfig for configuration options
/// @see StencilEngine for the created engine
public final class StencilFactory {

    private StencilFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an engine with default configuration and no modules.
    public static StencilEngine createEngine() {
        return createEngine(new StencilConfig());
    }

    /// Creates an engine with the given configuration and no modules.
    ///
    /// @param config configuration, not null
    /// @return new engine owning a fixed worker pool, never null
    public static StencilEngine createEngine(StencilConfig config) {
        return builder().config(config).build();
    }

    /// Creates an engine configured from properties.
    ///
    /// @param properties see {@link StencilConfig#fromProperties(Properties)}
    /// @return new engine, never null
    /// @throws IllegalArgumentException if a property value is invalid
    public static StencilEngine createEngine(Properties properties) {
        return createEngine(StencilConfig.fromProperties(properties));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for engines with custom modules, registry or executor.
    public static class Builder {
        private StencilConfig config = new StencilConfig();
        private ModuleRegistry moduleRegistry;
        private ExecutorService executorService;
        private final List<TemplateModule> modules = new ArrayList<>();

        public Builder config(StencilConfig config) {
            this.config = config;
            return this;
        }

        public Builder moduleRegistry(ModuleRegistry moduleRegistry) {
            this.moduleRegistry = moduleRegistry;
            return this;
        }

        /// Uses an externally managed executor; the engine will not shut it down.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder module(TemplateModule module) {
            this.modules.add(module);
            return this;
        }

        /// Adds the built-in {@link ImageModule}.
        ///
        /// @param fetcher source of image bytes, not null
        /// @return this builder for chaining
        public Builder imageModule(AssetFetcher fetcher) {
            return module(new ImageModule(fetcher));
        }

        public StencilEngine build() {
            boolean ownsExecutor = executorService == null;
            ExecutorService executor =
                    ownsExecutor
                            ? Executors.newFixedThreadPool(config.getConcurrency())
                            : executorService;
            ModuleRegistry registry =
                    moduleRegistry != null ? moduleRegistry : new DefaultModuleRegistry();
            for (TemplateModule module : modules) {
                registry.register(module);
            }
            return new StencilEngine(config, registry, executor, ownsExecutor);
        }
    }
}
