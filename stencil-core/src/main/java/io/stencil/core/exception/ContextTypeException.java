package io.stencil.core.exception;

import io.stencil.core.error.ErrorKind;
import java.io.Serial;

/// Raised in strict mode when a context value has the wrong shape, such as a loop target that
/// is not a sequence.
public class ContextTypeException extends StencilException {
    @Serial private static final long serialVersionUID = -1757120410826735509L;

    public ContextTypeException(String message, Integer position) {
        super(ErrorKind.TYPE, message, position);
    }
}
