package io.stencil.core.token;

/// Kinds of token emitted by the {@link Tokenizer}.
public enum TokenKind {
    TEXT,
    PLACEHOLDER,
    PARAGRAPH_PLACEHOLDER,
    RAW_SPLICE,
    LOOP_START,
    LOOP_END,
    COND_IF,
    COND_ELSE,
    COND_END,
    MODULE_TAG;

    /// Returns whether this kind opens or closes a block (loop or conditional).
    public boolean isBlockBoundary() {
        return this == LOOP_START
                || this == LOOP_END
                || this == COND_IF
                || this == COND_ELSE
                || this == COND_END;
    }
}
