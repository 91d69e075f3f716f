package co.fanki.routemigrator.dart;

/**
 * A lexical token of Dart source.
 *
 * <p>Offsets are absolute positions (UTF-16 code units) in the source
 * buffer the token was read from, so a token lexed from inside a string
 * interpolation still points into the enclosing file.</p>
 *
 * @param type the token category
 * @param text the exact source text of the token
 * @param offset the start offset, inclusive
 * @param end the end offset, exclusive
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Token(TokenType type, String text, int offset, int end) {

    /**
     * Checks whether this token is punctuation with the given text.
     *
     * @param punctuation the punctuation to compare against
     * @return true if the token is that punctuation
     */
    public boolean is(final String punctuation) {
        return type == TokenType.PUNCTUATION && text.equals(punctuation);
    }

    /**
     * Checks whether this token is the given identifier or keyword.
     *
     * @param word the word to compare against
     * @return true if the token is an identifier with that text
     */
    public boolean isWord(final String word) {
        return type == TokenType.IDENTIFIER && text.equals(word);
    }

    /** Token categories produced by {@link DartLexer}. */
    public enum TokenType {
        /** Identifiers and keywords. */
        IDENTIFIER,
        /** A complete string literal, quotes and prefix included. */
        STRING,
        /** Numeric literal. */
        NUMBER,
        /** Operators, brackets and separators. */
        PUNCTUATION,
        /** End of input marker. */
        EOF
    }

}
