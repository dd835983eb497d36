package io.stencil.core.exception;

import java.io.Serial;

public class ModuleNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -8154920356170441277L;

    public ModuleNotFoundException(String message) {
        super(message);
    }
}
