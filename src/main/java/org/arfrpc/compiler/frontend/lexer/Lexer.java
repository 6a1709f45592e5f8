package org.arfrpc.compiler.frontend.lexer;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts raw IDL source text into a flat list of {@link Token}s.
 *
 * <p>The lexer has no knowledge of the grammar. It never stops on invalid input: an
 * unrecognized character is reported as a {@link Diagnostic.Kind#SYNTAX} error and skipped,
 * so the parser still receives a useful token stream. Whitespace is discarded; comments are
 * kept as {@link TokenType#COMMENT} tokens because the parser attaches them to declarations
 * as documentation. The stream always ends with a synthetic {@link TokenType#EOF} token.</p>
 */
public class Lexer {

    private static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.ofEntries(
            Map.entry('=', TokenType.EQUAL),
            Map.entry(';', TokenType.SEMICOLON),
            Map.entry('(', TokenType.LEFT_PAREN),
            Map.entry(')', TokenType.RIGHT_PAREN),
            Map.entry('{', TokenType.LEFT_BRACE),
            Map.entry('}', TokenType.RIGHT_BRACE),
            Map.entry('<', TokenType.LEFT_ANGLE),
            Map.entry('>', TokenType.RIGHT_ANGLE),
            Map.entry(',', TokenType.COMMA),
            Map.entry('@', TokenType.AT),
            Map.entry('.', TokenType.DOT)
    );

    private final String source;
    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();

    private int current = 0;
    private int line = 1;
    private int column = 1;

    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a lexer for one source unit.
     *
     * @param source      The source text.
     * @param fileName    The logical file name stamped on every token.
     * @param diagnostics The engine receiving syntax errors.
     */
    public Lexer(String source, String fileName, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     *
     * @return The tokens in source order, terminated by an EOF token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            mark();
            scanToken();
        }
        mark();
        tokens.add(new Token(TokenType.EOF, "", null, line, column, fileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> {
                // whitespace carries no meaning
            }
            case '#' -> comment();
            case '"', '\'' -> string(c);
            case '-' -> {
                if (peek() == '>') {
                    advance();
                    addToken(TokenType.ARROW, null);
                } else {
                    reportError("Unexpected '-', expected '->'");
                }
            }
            default -> {
                TokenType simple = SINGLE_CHAR_TOKENS.get(c);
                if (simple != null) {
                    addToken(simple, null);
                } else if (isDigit(c)) {
                    number(c);
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                        advance();
                    }
                    reportError("Unexpected character '" + printable(source.substring(start, current)) + "'");
                }
            }
        }
    }

    private void comment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        String body = source.substring(start + 1, current);
        if (body.endsWith("\r")) {
            body = body.substring(0, body.length() - 1);
        }
        addToken(TokenType.COMMENT, body.strip());
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        boolean terminated = false;
        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                terminated = true;
                break;
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    break;
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '\\' -> value.append('\\');
                    default -> {
                        if (escaped != quote) {
                            value.append('\\');
                        }
                        value.append(escaped);
                    }
                }
                continue;
            }
            if (c == '\n') {
                diagnostics.reportError(Diagnostic.Kind.SYNTAX, "Invalid line break in string",
                        fileName, line - 1, startColumn);
            }
            value.append(c);
        }
        if (!terminated) {
            reportError("Unterminated string literal");
        }
        addToken(TokenType.STRING, value.toString());
    }

    private void number(char first) {
        boolean hex = first == '0' && (peek() == 'x' || peek() == 'X');
        if (hex) {
            advance();
            while (isHexDigit(peek())) {
                advance();
            }
        } else {
            while (isDigit(peek())) {
                advance();
            }
        }

        // A number glued to letters ("12ab", "0xZZ") is one malformed literal, not two tokens.
        boolean malformed = false;
        while (isIdentifierPart(peek())) {
            advance();
            malformed = true;
        }
        String text = source.substring(start, current);
        if (hex && text.length() == 2) {
            malformed = true;
        }
        if (malformed) {
            reportError("Malformed numeric literal '" + text + "'");
            addToken(TokenType.NUMBER, null);
            return;
        }

        Long value;
        try {
            value = hex ? Long.parseLong(text.substring(2), 16) : Long.parseLong(text);
        } catch (NumberFormatException e) {
            reportError("Numeric literal '" + text + "' is out of range");
            value = null;
        }
        addToken(TokenType.NUMBER, value);
    }

    private void identifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        addToken(TokenType.IDENTIFIER, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, fileName));
    }

    private void reportError(String message) {
        diagnostics.reportError(Diagnostic.Kind.SYNTAX, message, fileName, startLine, startColumn);
    }

    private void mark() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static String printable(String text) {
        if (text.length() == 1 && Character.isISOControl(text.charAt(0))) {
            return String.format("\\u%04x", (int) text.charAt(0));
        }
        return text;
    }
}
