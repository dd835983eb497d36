package io.stencil.core.token;

import java.util.List;
import java.util.Objects;

/// One contiguous span of template text.
///
/// The payload lives in two slots whose meaning depends on the kind:
///
/// | kind | `value` | `argument` |
/// |------|---------|------------|
/// | `PLACEHOLDER`, `PARAGRAPH_PLACEHOLDER`, `RAW_SPLICE` | path | - |
/// | `LOOP_START` | loop variable | collection path |
/// | `COND_IF` | expression | - |
/// | `MODULE_TAG` | module name | tag data |
/// | `TEXT` and block ends | - | - |
///
/// A `LOOP_START` whose header is not of the form `VAR in PATH` has a null `value` and the
/// raw header in `argument`; the tree builder rejects it.
///
/// ### Contracts
/// - **Invariant**: `raw.length() == end - start`
/// - **Invariant**: the raw spans of a tokenizer result concatenate to the input
///
/// @param kind token kind, not null
/// @param start offset of the first character in the source text
/// @param end offset one past the last character
/// @param raw exact source text of the span, not null
/// @param value primary payload, may be null
/// @param argument secondary payload, may be null
public record Token(
        TokenKind kind, int start, int end, String raw, String value, String argument) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }

    public static Token text(int start, String raw) {
        return new Token(TokenKind.TEXT, start, start + raw.length(), raw, null, null);
    }

    public static Token withPath(TokenKind kind, int start, String raw, String path) {
        return new Token(kind, start, start + raw.length(), raw, path, null);
    }

    public static Token loopStart(int start, String raw, String variable, String collectionPath) {
        return new Token(
                TokenKind.LOOP_START, start, start + raw.length(), raw, variable, collectionPath);
    }

    public static Token condIf(int start, String raw, String expression) {
        return new Token(TokenKind.COND_IF, start, start + raw.length(), raw, expression, null);
    }

    public static Token blockEnd(TokenKind kind, int start, String raw) {
        return new Token(kind, start, start + raw.length(), raw, null, null);
    }

    public static Token moduleTag(int start, String raw, String name, String data) {
        return new Token(TokenKind.MODULE_TAG, start, start + raw.length(), raw, name, data);
    }

    /// Concatenates the raw spans of the given tokens.
    ///
    /// @param tokens tokens in order, not null
    /// @return reconstructed text, never null
    public static String source(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.raw());
        }
        return sb.toString();
    }

    /// Path of a placeholder, paragraph placeholder or raw splice.
    public String path() {
        return value;
    }

    /// Loop variable name of a `LOOP_START`, null if the header was malformed.
    public String variable() {
        return value;
    }

    /// Collection path of a `LOOP_START`, or the raw header if it was malformed.
    public String collectionPath() {
        return argument;
    }

    /// Expression of a `COND_IF`.
    public String expression() {
        return value;
    }

    /// Module name of a `MODULE_TAG`.
    public String moduleName() {
        return value;
    }

    /// Tag data of a `MODULE_TAG`, empty when the tag has none.
    public String data() {
        return argument;
    }
}
