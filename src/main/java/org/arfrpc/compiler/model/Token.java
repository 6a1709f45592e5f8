package org.arfrpc.compiler.model;

/**
 * A single lexical token.
 *
 * @param type     The token kind.
 * @param text     The raw source text of the token.
 * @param value    The decoded literal value: the unescaped {@link String} for string literals,
 *                 a {@link Long} for number literals, {@code null} otherwise.
 * @param line     The 1-based line of the first character.
 * @param column   The 1-based column of the first character.
 * @param fileName The file this token was read from.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    /**
     * Returns the position of the first character of this token.
     */
    public SourcePosition position() {
        return new SourcePosition(fileName, line, column);
    }

    /**
     * Checks whether this token is an identifier spelled exactly as {@code keyword}.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equals(keyword);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
