package io.stencil.core.token;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Splits template text into a gap-free stream of {@link Token}s.
///
/// Recognizes five tag syntaxes, tried at every cursor position in this order:
/// 1. raw splice `{@ path }` (closed by a single `}`)
/// 2. paragraph placeholder `{{? path }}`
/// 3. block tag `{% ... %}`: `loop`, `endloop`, `if`, `else`, `endif`, or a module tag
/// 4. placeholder `{{ path }}`
///
/// Text between tags becomes `TEXT` tokens. An opening delimiter with no closing delimiter
/// anywhere after it turns the remainder of the input into a single `TEXT` token.
///
/// ### Contracts
/// - **Postcondition**: never throws; the raw spans of the result concatenate to the input
/// - **Postcondition**: paths, expressions and module data are trimmed
///
/// @implNote Stateless and thread-safe.
public final class Tokenizer {

    static final String RAW_SPLICE_OPEN = "{@";
    static final String RAW_SPLICE_CLOSE = "}";
    static final String PARAGRAPH_OPEN = "{{?";
    static final String PLACEHOLDER_OPEN = "{{";
    static final String PLACEHOLDER_CLOSE = "}}";
    static final String BLOCK_OPEN = "{%";
    static final String BLOCK_CLOSE = "%}";

    public static final String LOOP = "loop";
    public static final String END_LOOP = "endloop";
    public static final String IF = "if";
    public static final String ELSE = "else";
    public static final String END_IF = "endif";

    private static final Pattern LOOP_HEADER =
            Pattern.compile("^(\\S+)\\s+in\\s+(.+)$", Pattern.DOTALL);

    private enum Syntax {
        RAW_SPLICE(RAW_SPLICE_OPEN, RAW_SPLICE_CLOSE),
        PARAGRAPH(PARAGRAPH_OPEN, PLACEHOLDER_CLOSE),
        BLOCK(BLOCK_OPEN, BLOCK_CLOSE),
        PLACEHOLDER(PLACEHOLDER_OPEN, PLACEHOLDER_CLOSE);

        private final String open;
        private final String close;

        Syntax(String open, String close) {
            this.open = open;
            this.close = close;
        }
    }

    /// Tokenizes the given text.
    ///
    /// @param text template text, may be null (treated as empty)
    /// @return ordered tokens, never null; empty for empty input
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }

        int cursor = 0;
        int length = text.length();
        while (cursor < length) {
            Syntax syntax = openingAt(text, cursor);
            if (syntax != null) {
                int close = text.indexOf(syntax.close, cursor + syntax.open.length());
                if (close < 0) {
                    // Unclosed tag: the rest of the input is plain text
                    tokens.add(Token.text(cursor, text.substring(cursor)));
                    break;
                }
                int end = close + syntax.close.length();
                String raw = text.substring(cursor, end);
                String inner = text.substring(cursor + syntax.open.length(), close).trim();
                tokens.add(toToken(syntax, cursor, raw, inner));
                cursor = end;
                continue;
            }

            int next = nextOpening(text, cursor + 1);
            int stop = next < 0 ? length : next;
            tokens.add(Token.text(cursor, text.substring(cursor, stop)));
            cursor = stop;
        }
        return tokens;
    }

    /// Returns the index of the next position at or after `from` where any tag may open.
    ///
    /// @param text text to scan, not null
    /// @param from first index to consider
    /// @return index of the next opening delimiter, or -1 if there is none
    static int nextOpening(String text, int from) {
        int best = -1;
        for (String open : new String[] {RAW_SPLICE_OPEN, BLOCK_OPEN, PLACEHOLDER_OPEN}) {
            int index = text.indexOf(open, from);
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
            }
        }
        return best;
    }

    private Syntax openingAt(String text, int cursor) {
        for (Syntax syntax : Syntax.values()) {
            if (text.startsWith(syntax.open, cursor)) {
                return syntax;
            }
        }
        return null;
    }

    private Token toToken(Syntax syntax, int start, String raw, String inner) {
        return switch (syntax) {
            case RAW_SPLICE -> Token.withPath(TokenKind.RAW_SPLICE, start, raw, inner);
            case PARAGRAPH -> Token.withPath(TokenKind.PARAGRAPH_PLACEHOLDER, start, raw, inner);
            case PLACEHOLDER -> Token.withPath(TokenKind.PLACEHOLDER, start, raw, inner);
            case BLOCK -> blockToken(start, raw, inner);
        };
    }

    private Token blockToken(int start, String raw, String inner) {
        int split = firstWhitespace(inner);
        String keyword = split < 0 ? inner : inner.substring(0, split);
        String rest = split < 0 ? "" : inner.substring(split).trim();

        return switch (keyword) {
            case LOOP -> loopToken(start, raw, rest);
            case END_LOOP -> Token.blockEnd(TokenKind.LOOP_END, start, raw);
            case IF -> Token.condIf(start, raw, rest);
            case ELSE -> Token.blockEnd(TokenKind.COND_ELSE, start, raw);
            case END_IF -> Token.blockEnd(TokenKind.COND_END, start, raw);
            default -> Token.moduleTag(start, raw, keyword, rest);
        };
    }

    private Token loopToken(int start, String raw, String header) {
        Matcher matcher = LOOP_HEADER.matcher(header);
        if (matcher.matches()) {
            return Token.loopStart(start, raw, matcher.group(1), matcher.group(2).trim());
        }
        return Token.loopStart(start, raw, null, header);
    }

    private static int firstWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
