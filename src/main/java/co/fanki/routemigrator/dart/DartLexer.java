package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.Token.TokenType;
import co.fanki.routemigrator.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Dart source into tokens.
 *
 * <p>The lexer is tolerant: it never fails, unterminated strings and
 * comments simply run to the end of the region. Comments and whitespace
 * are dropped. A string literal, interpolations included, is a single
 * {@link TokenType#STRING} token; {@link StringLiteralDecoder} splits it
 * later.</p>
 *
 * <p>Angle brackets are always single-character tokens so that nested
 * type arguments such as {@code Map<String, List<int>>} close one level
 * at a time.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DartLexer {

    /** Multi-character operators, longest first. */
    private static final String[] OPERATORS = {
        "...?", "...", "??=", "~/=",
        "..", "?.", "??", "=>", "==", "!=", "<=", ">=", "&&", "||",
        "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "~/"
    };

    private final String source;
    private final int limit;
    private int pos;

    private DartLexer(final String theSource, final int start,
            final int theLimit) {
        this.source = theSource;
        this.pos = start;
        this.limit = theLimit;
    }

    /**
     * Tokenizes a whole source buffer.
     *
     * @param source the Dart source
     * @return the tokens, terminated by an EOF token
     */
    public static List<Token> tokenize(final String source) {
        Preconditions.requireNonNull(source, "Source is required");
        return tokenize(source, 0, source.length());
    }

    /**
     * Tokenizes a region of a source buffer, keeping absolute offsets.
     *
     * @param source the Dart source
     * @param start the region start, inclusive
     * @param end the region end, exclusive
     * @return the tokens, terminated by an EOF token
     */
    public static List<Token> tokenize(final String source, final int start,
            final int end) {
        Preconditions.requireSpanWithin(start, end - start, source.length());
        return new DartLexer(source, start, end).run();
    }

    private List<Token> run() {
        final List<Token> tokens = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= limit) {
                tokens.add(new Token(TokenType.EOF, "", limit, limit));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        final int start = pos;
        final char c = source.charAt(pos);

        if ((c == 'r' || c == 'R') && pos + 1 < limit
                && isQuote(source.charAt(pos + 1))) {
            pos = skipString(pos + 1, true);
            return token(TokenType.STRING, start);
        }
        if (isQuote(c)) {
            pos = skipString(pos, false);
            return token(TokenType.STRING, start);
        }
        if (isIdentifierStart(c)) {
            while (pos < limit && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return token(TokenType.IDENTIFIER, start);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < limit
                && Character.isDigit(source.charAt(pos + 1)))) {
            readNumber();
            return token(TokenType.NUMBER, start);
        }
        for (final String operator : OPERATORS) {
            if (source.startsWith(operator, pos)
                    && pos + operator.length() <= limit) {
                pos += operator.length();
                return token(TokenType.PUNCTUATION, start);
            }
        }
        pos++;
        return token(TokenType.PUNCTUATION, start);
    }

    private Token token(final TokenType type, final int start) {
        return new Token(type, source.substring(start, pos), start, pos);
    }

    private void readNumber() {
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            pos += 2;
            while (pos < limit && Character.digit(source.charAt(pos), 16) >= 0) {
                pos++;
            }
            return;
        }
        while (pos < limit && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < limit && source.charAt(pos) == '.'
                && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < limit && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < limit && (source.charAt(pos) == 'e'
                || source.charAt(pos) == 'E')) {
            int k = pos + 1;
            if (k < limit && (source.charAt(k) == '+'
                    || source.charAt(k) == '-')) {
                k++;
            }
            if (k < limit && Character.isDigit(source.charAt(k))) {
                pos = k;
                while (pos < limit && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
        }
    }

    private void skipTrivia() {
        while (pos < limit) {
            final char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (source.startsWith("//", pos)) {
                while (pos < limit && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (source.startsWith("/*", pos)) {
                skipBlockComment();
            } else if (pos == 0 && source.startsWith("#!", pos)) {
                while (pos < limit && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        int depth = 0;
        while (pos < limit) {
            if (source.startsWith("/*", pos)) {
                depth++;
                pos += 2;
            } else if (source.startsWith("*/", pos)) {
                depth--;
                pos += 2;
                if (depth == 0) {
                    return;
                }
            } else {
                pos++;
            }
        }
    }

    /**
     * Skips a string literal starting at the opening quote.
     *
     * @param quoteStart the position of the opening quote
     * @param raw whether the literal is raw (no escapes or interpolation)
     * @return the position just after the closing quote
     */
    private int skipString(final int quoteStart, final boolean raw) {
        return skipString(source, quoteStart, raw, limit);
    }

    /**
     * Skips a string literal in a buffer, honouring escapes and nested
     * interpolations.
     *
     * @param text the buffer
     * @param quoteStart the position of the opening quote
     * @param raw whether the literal is raw
     * @param limit the end of the region to scan
     * @return the position just after the closing quote, or the limit
     */
    static int skipString(final String text, final int quoteStart,
            final boolean raw, final int limit) {
        final char quote = text.charAt(quoteStart);
        final boolean triple = text.startsWith(
                String.valueOf(quote).repeat(3), quoteStart);
        final String closing = triple
                ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        int i = quoteStart + closing.length();
        while (i < limit) {
            final char c = text.charAt(i);
            if (!raw && c == '\\') {
                i += 2;
            } else if (!raw && c == '$' && i + 1 < limit
                    && text.charAt(i + 1) == '{') {
                i = skipInterpolation(text, i + 2, limit);
            } else if (text.startsWith(closing, i)) {
                return i + closing.length();
            } else if (!triple && c == '\n') {
                return i;
            } else {
                i++;
            }
        }
        return limit;
    }

    /**
     * Skips the body of a {@code ${...}} interpolation.
     *
     * @param text the buffer
     * @param bodyStart the position after the opening brace
     * @param limit the end of the region to scan
     * @return the position just after the closing brace, or the limit
     */
    static int skipInterpolation(final String text, final int bodyStart,
            final int limit) {
        int depth = 1;
        int i = bodyStart;
        while (i < limit) {
            final char c = text.charAt(i);
            if (isQuote(c)) {
                i = skipString(text, i, false, limit);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        return limit;
    }

    /**
     * Finds the bracket that closes the one at {@code openIndex}.
     *
     * <p>Brackets inside string literals and comments are ignored.</p>
     *
     * @param text the Dart source
     * @param openIndex the position of an opening {@code (}, {@code [}
     *      or {@code {}
     * @return the position of the matching closing bracket, or -1 if the
     *      text ends first
     */
    public static int matchingBracket(final String text,
            final int openIndex) {
        Preconditions.requireSpanWithin(openIndex, 1, text.length());
        int depth = 0;
        int i = openIndex;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (isQuote(c)) {
                final boolean raw = i > 0
                        && (text.charAt(i - 1) == 'r' || text.charAt(i - 1) == 'R')
                        && (i < 2 || !isIdentifierPart(text.charAt(i - 2)));
                i = skipString(text, i, raw, text.length());
                continue;
            }
            if (text.startsWith("//", i)) {
                final int newline = text.indexOf('\n', i);
                i = newline < 0 ? text.length() : newline + 1;
                continue;
            }
            if (text.startsWith("/*", i)) {
                final DartLexer lexer = new DartLexer(text, i, text.length());
                lexer.skipBlockComment();
                i = lexer.pos;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    static boolean isQuote(final char c) {
        return c == '\'' || c == '"';
    }

    static boolean isIdentifierStart(final char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

}
