package io.stencil.core.exception;

import io.stencil.core.error.ErrorKind;
import java.io.Serial;

/// Raised by the tree builder for unbalanced or malformed block tags.
public class TemplateSyntaxException extends StencilException {
    @Serial private static final long serialVersionUID = -3021740886914460583L;

    public TemplateSyntaxException(String message, int position) {
        super(ErrorKind.SYNTAX, message + " at position " + position, position);
    }
}
