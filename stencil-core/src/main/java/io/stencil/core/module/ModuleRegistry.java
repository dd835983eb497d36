package io.stencil.core.module;

import io.stencil.core.exception.ModuleNotFoundException;
import java.util.List;
import java.util.Optional;

/// Registry of the {@link TemplateModule}s taking part in rendering.
///
/// ### Contracts
/// - **Precondition**: module names are unique; registering a taken name is rejected
/// - **Postcondition**: {@link #modules()} lists modules by ascending priority, ties in
///   registration order
/// - **Invariant**: a render invocation works on the snapshot taken when it starts; later
///   registrations only affect later invocations
///
/// @implNote Implementations must be thread-safe.
///
/// @see DefaultModuleRegistry for the standard implementation
public interface ModuleRegistry {

    /// Adds a module.
    ///
    /// @apiNote **Side effects**:
    /// - Modifies the registry
    /// - Logs registration at INFO level
    ///
    /// @param module the module, not null
    /// @throws IllegalArgumentException if a module with the same name is registered
    void register(TemplateModule module);

    /// Removes a module by name.
    ///
    /// @param name module name, not null
    /// @return `true` if a module was removed
    boolean unregister(String name);

    /// Looks a module up by name.
    ///
    /// @param name module name, not null
    /// @return the module, or empty if none is registered under that name
    Optional<TemplateModule> getModule(String name);

    /// Looks a module up by name or fails.
    ///
    /// @param name module name, not null
    /// @return the module, never null
    /// @throws ModuleNotFoundException if none is registered under that name
    TemplateModule getModuleOrThrow(String name) throws ModuleNotFoundException;

    boolean hasModule(String name);

    /// Returns the registered modules in execution order.
    ///
    /// @return immutable snapshot, never null (may be empty)
    List<TemplateModule> modules();
}
