package io.stencil.core.exception;

import io.stencil.core.error.ErrorKind;
import java.io.Serial;

/// Raised in strict mode when a placeholder path does not resolve against the context.
public class ResolutionException extends StencilException {
    @Serial private static final long serialVersionUID = 6609214735209881045L;

    private final String path;

    public ResolutionException(String path, Integer position) {
        super(ErrorKind.RESOLUTION, "Missing data for placeholder: " + path, position);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
