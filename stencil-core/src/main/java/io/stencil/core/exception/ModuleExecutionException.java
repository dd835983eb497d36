package io.stencil.core.exception;

import io.stencil.core.error.ErrorKind;
import io.stencil.core.module.ModulePhase;
import java.io.Serial;

/// Wraps a failure thrown by one phase of a template module.
public class ModuleExecutionException extends StencilException {
    @Serial private static final long serialVersionUID = 2290458217633509164L;

    private final String moduleName;
    private final ModulePhase phase;

    public ModuleExecutionException(String moduleName, ModulePhase phase, Throwable cause) {
        super(
                ErrorKind.MODULE,
                "Module " + moduleName + " failed in " + phase.label() + ": " + describe(cause),
                null,
                cause);
        this.moduleName = moduleName;
        this.phase = phase;
    }

    public String getModuleName() {
        return moduleName;
    }

    public ModulePhase getPhase() {
        return phase;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
