package io.stencil.core.module;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Static metadata of a {@link TemplateModule}.
///
/// ### Contracts
/// - **Invariant**: `name` is unique within one {@link ModuleRegistry}
/// - An empty `tags` set means the module applies to every content unit of a supported type
/// - An empty `supportedFileTypes` set means every file type is supported
/// - Lower `priority` runs earlier; ties run in registration order
///
/// @param name unique module name, not blank
/// @param tags module tag names the module handles, in declaration order, immutable, not
///     null
/// @param supportedFileTypes file types the module processes, immutable, not null
/// @param priority execution order key
/// @param phases phases the pipeline invokes, immutable, not null
public record ModuleDescriptor(
        String name,
        Set<String> tags,
        Set<String> supportedFileTypes,
        int priority,
        Set<ModulePhase> phases) {

    public static final int DEFAULT_PRIORITY = 100;

    public ModuleDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Module name must not be blank");
        }
        tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        supportedFileTypes = Collections.unmodifiableSet(new LinkedHashSet<>(supportedFileTypes));
        phases =
                phases.isEmpty()
                        ? Set.of()
                        : Collections.unmodifiableSet(EnumSet.copyOf(phases));
    }

    /// Returns whether the module processes units of the given file type.
    ///
    /// @param fileType unit file type, may be null
    /// @return `true` if the type is supported or the module supports every type
    public boolean supports(String fileType) {
        return supportedFileTypes.isEmpty() || supportedFileTypes.contains(fileType);
    }

    /// Returns whether the pipeline should invoke the given phase.
    public boolean handles(ModulePhase phase) {
        return phases.contains(phase);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<String> supportedFileTypes = new LinkedHashSet<>();
        private final Set<ModulePhase> phases = EnumSet.allOf(ModulePhase.class);
        private int priority = DEFAULT_PRIORITY;

        private Builder(String name) {
            this.name = name;
        }

        public Builder tags(String... values) {
            tags.addAll(Arrays.asList(values));
            return this;
        }

        public Builder supportedFileTypes(String... values) {
            supportedFileTypes.addAll(Arrays.asList(values));
            return this;
        }

        public Builder priority(int value) {
            this.priority = value;
            return this;
        }

        /// Restricts the phases the pipeline invokes. All phases are invoked by default.
        public Builder phases(ModulePhase first, ModulePhase... rest) {
            phases.clear();
            phases.add(first);
            phases.addAll(Arrays.asList(rest));
            return this;
        }

        public ModuleDescriptor build() {
            return new ModuleDescriptor(name, tags, supportedFileTypes, priority, phases);
        }
    }
}
