package co.fanki.routemigrator.dart;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a string literal token into decoded text and interpolation
 * segments.
 *
 * <p>Escape sequences are decoded in non-raw strings. Interpolations are
 * returned as source spans ({@code $name} spans the name, {@code ${expr}}
 * spans the inner expression) so that the parser can parse them with
 * their absolute offsets.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class StringLiteralDecoder {

    private StringLiteralDecoder() {
    }

    /**
     * A piece of a string literal.
     *
     * @param text the decoded text, or null for an interpolation
     * @param start the start of the interpolated expression
     * @param end the end of the interpolated expression
     */
    record Segment(String text, int start, int end) {

        boolean isInterpolation() {
            return text == null;
        }
    }

    /**
     * Decodes one string literal token.
     *
     * @param source the buffer the token was read from
     * @param token the STRING token
     * @return the segments in source order
     */
    static List<Segment> decode(final String source, final Token token) {
        int i = token.offset();
        final boolean raw = source.charAt(i) == 'r'
                || source.charAt(i) == 'R';
        if (raw) {
            i++;
        }
        final char quote = source.charAt(i);
        final String tripleQuote = String.valueOf(quote).repeat(3);
        final boolean triple = source.startsWith(tripleQuote, i)
                && i + 3 <= token.end();
        final String closing = triple ? tripleQuote : String.valueOf(quote);
        final int contentStart = i + closing.length();
        int contentEnd = token.end();
        if (contentEnd - closing.length() >= contentStart
                && source.startsWith(closing, contentEnd - closing.length())) {
            contentEnd -= closing.length();
        }

        final List<Segment> segments = new ArrayList<>();
        final StringBuilder text = new StringBuilder();
        int k = contentStart;
        while (k < contentEnd) {
            final char c = source.charAt(k);
            if (!raw && c == '\\' && k + 1 < contentEnd) {
                k = decodeEscape(source, k + 1, contentEnd, text);
            } else if (!raw && c == '$' && k + 1 < contentEnd
                    && source.charAt(k + 1) == '{') {
                flush(text, segments);
                final int close = DartLexer.skipInterpolation(
                        source, k + 2, contentEnd);
                final int exprEnd = source.charAt(close - 1) == '}'
                        ? close - 1 : close;
                segments.add(new Segment(null, k + 2, exprEnd));
                k = close;
            } else if (!raw && c == '$' && k + 1 < contentEnd
                    && DartLexer.isIdentifierStart(source.charAt(k + 1))
                    && source.charAt(k + 1) != '$') {
                flush(text, segments);
                int nameEnd = k + 1;
                while (nameEnd < contentEnd
                        && source.charAt(nameEnd) != '$'
                        && DartLexer.isIdentifierPart(
                                source.charAt(nameEnd))) {
                    nameEnd++;
                }
                segments.add(new Segment(null, k + 1, nameEnd));
                k = nameEnd;
            } else {
                text.append(c);
                k++;
            }
        }
        flush(text, segments);
        return segments;
    }

    private static void flush(final StringBuilder text,
            final List<Segment> segments) {
        if (text.length() > 0) {
            segments.add(new Segment(text.toString(), -1, -1));
            text.setLength(0);
        }
    }

    /**
     * Decodes the escape sequence whose code starts at {@code k}.
     *
     * @return the position after the escape sequence
     */
    private static int decodeEscape(final String source, final int k,
            final int limit, final StringBuilder out) {
        final char c = source.charAt(k);
        switch (c) {
            case 'n':
                out.append('\n');
                return k + 1;
            case 'r':
                out.append('\r');
                return k + 1;
            case 't':
                out.append('\t');
                return k + 1;
            case 'b':
                out.append('\b');
                return k + 1;
            case 'f':
                out.append('\f');
                return k + 1;
            case 'v':
                out.append('\u000B');
                return k + 1;
            case 'x':
                return hex(source, k + 1, Math.min(k + 3, limit), out);
            case 'u':
                if (k + 1 < limit && source.charAt(k + 1) == '{') {
                    final int close = source.indexOf('}', k + 2);
                    if (close > 0 && close < limit) {
                        hex(source, k + 2, close, out);
                        return close + 1;
                    }
                    return k + 1;
                }
                return hex(source, k + 1, Math.min(k + 5, limit), out);
            default:
                out.append(c);
                return k + 1;
        }
    }

    private static int hex(final String source, final int start,
            final int end, final StringBuilder out) {
        try {
            out.appendCodePoint(Integer.parseInt(
                    source.substring(start, end), 16));
        } catch (IllegalArgumentException e) {
            out.append(source, start, end);
        }
        return end;
    }

}
