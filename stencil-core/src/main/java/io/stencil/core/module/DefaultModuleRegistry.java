package io.stencil.core.module;

import io.stencil.core.exception.ModuleNotFoundException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Default implementation of {@link ModuleRegistry}.
///
/// Keeps modules in registration order and publishes a sorted, immutable snapshot after every
/// change, so readers never lock and never see a partially updated order.
///
/// @implNote Thread-safe. Mutators synchronize on the registry; {@link #modules()} reads a
/// volatile snapshot.
public class DefaultModuleRegistry implements ModuleRegistry {

    private static final Logger logger = Logger.getLogger(DefaultModuleRegistry.class.getName());

    private static final Comparator<TemplateModule> BY_PRIORITY =
            Comparator.comparingInt(module -> module.descriptor().priority());

    private final Map<String, TemplateModule> modules = new LinkedHashMap<>();
    private volatile List<TemplateModule> ordered = List.of();

    @Override
    public synchronized void register(TemplateModule module) {
        Objects.requireNonNull(module, "module must not be null");
        String name = module.descriptor().name();
        if (modules.containsKey(name)) {
            throw new IllegalArgumentException("Module already registered: " + name);
        }
        modules.put(name, module);
        publish();
        logger.info(
                "Registered module: " + name + " with priority " + module.descriptor().priority());
    }

    @Override
    public synchronized boolean unregister(String name) {
        TemplateModule removed = modules.remove(name);
        if (removed != null) {
            publish();
            logger.info("Unregistered module: " + name);
            return true;
        }
        return false;
    }

    @Override
    public Optional<TemplateModule> getModule(String name) {
        for (TemplateModule module : ordered) {
            if (module.descriptor().name().equals(name)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }

    @Override
    public TemplateModule getModuleOrThrow(String name) throws ModuleNotFoundException {
        return getModule(name)
                .orElseThrow(() -> new ModuleNotFoundException("Module not found: " + name));
    }

    @Override
    public boolean hasModule(String name) {
        return getModule(name).isPresent();
    }

    @Override
    public List<TemplateModule> modules() {
        return ordered;
    }

    /// Removes all modules.
    ///
    /// @apiNote **Side effects**:
    /// - Clears the registry
    /// - Logs count of removed modules at INFO level
    public synchronized void clear() {
        int count = modules.size();
        modules.clear();
        publish();
        logger.info("Cleared " + count + " modules from registry");
    }

    public int size() {
        return ordered.size();
    }

    // List.sort is stable, so equal priorities keep registration order
    private void publish() {
        List<TemplateModule> snapshot = new ArrayList<>(modules.values());
        snapshot.sort(BY_PRIORITY);
        ordered = List.copyOf(snapshot);
    }
}
