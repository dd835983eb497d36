package io.stencil.core.module;

import io.stencil.core.error.ErrorRecord;
import io.stencil.core.token.Token;
import java.util.List;

/// A pluggable transformation taking part in the {@link io.stencil.core.pipeline.ModulePipeline}.
///
/// Every phase defaults to identity, so a module only overrides the phases it needs. Phases
/// may throw any exception: the pipeline records it against the module and, in lenient
/// mode, continues with the text from before the phase.
///
/// ### Contracts
/// - **Invariant**: {@link #descriptor()} returns the same value for the module's lifetime
/// - **Invariant**: phases must not keep per-invocation state in fields; use the
///   {@link ModuleContext} (asset ids in particular come from
///   {@link ModuleContext#assetIds()})
///
/// @implNote Implementations must be thread-safe: content units are processed concurrently
/// and share module instances.
///
/// @see AbstractTagModule for modules that replace their own `{% tag data %}` markers
public interface TemplateModule {

    /// Returns the module's static metadata.
    ///
    /// @return descriptor, never null
    ModuleDescriptor descriptor();

    /// Rewrites the raw unit text before it is tokenized.
    default String preparse(String text, ModuleContext context) throws Exception {
        return text;
    }

    /// Rewrites the token stream before the syntax tree is built.
    default List<Token> transformTokens(List<Token> tokens, ModuleContext context)
            throws Exception {
        return tokens;
    }

    /// Replaces the module's own tags in the core-rendered text.
    default String render(String text, ModuleContext context) throws Exception {
        return text;
    }

    /// Makes final changes after all modules have rendered.
    default String postrender(String text, ModuleContext context) throws Exception {
        return text;
    }

    /// Decides whether the module applies to a unit.
    ///
    /// By default: the file type is supported, and the module either declares no tags or at
    /// least one of its tags occurs in the text.
    ///
    /// @param text current unit text, not null
    /// @param fileType unit file type, may be null
    /// @return `true` to run the module's phases on the unit
    default boolean shouldProcess(String text, String fileType) {
        ModuleDescriptor descriptor = descriptor();
        if (!descriptor.supports(fileType)) {
            return false;
        }
        if (descriptor.tags().isEmpty()) {
            return true;
        }
        for (String tag : descriptor.tags()) {
            if (ModuleTags.contains(text, tag)) {
                return true;
            }
        }
        return false;
    }

    /// Checks module-specific syntax without rendering.
    ///
    /// @param text unit text, not null
    /// @return diagnostics with template positions, never null (may be empty)
    default List<ErrorRecord> validate(String text) {
        return List.of();
    }

    /// Convenience accessor for the descriptor name.
    default String name() {
        return descriptor().name();
    }
}
