package org.arfrpc.compiler.frontend.lexer;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the lexer: token kinds, literal values, positions and recovery from bad input.
 */
@Tag("unit")
class LexerTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private List<Token> scan(String source) {
        return new Lexer(source, "test.arf", diagnostics).scanTokens();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void scansFieldDeclaration() {
        List<Token> tokens = scan("name string = 1;");

        assertThat(types(tokens)).containsExactly(
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EQUAL,
                TokenType.NUMBER, TokenType.SEMICOLON, TokenType.EOF);
        assertThat(tokens.get(0).text()).isEqualTo("name");
        assertThat(tokens.get(3).value()).isEqualTo(1L);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void scansPunctuationAndArrow() {
        List<Token> tokens = scan("(){}<>,@.= ; ->");

        assertThat(types(tokens)).containsExactly(
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE,
                TokenType.LEFT_ANGLE, TokenType.RIGHT_ANGLE, TokenType.COMMA, TokenType.AT, TokenType.DOT,
                TokenType.EQUAL, TokenType.SEMICOLON, TokenType.ARROW, TokenType.EOF);
    }

    @Test
    void tracksLinesAndColumns() {
        List<Token> tokens = scan("struct S {\n  a int32 = 0;\n}");

        Token field = tokens.get(3);
        assertThat(field.text()).isEqualTo("a");
        assertThat(field.line()).isEqualTo(2);
        assertThat(field.column()).isEqualTo(3);
        assertThat(field.fileName()).isEqualTo("test.arf");

        Token eof = tokens.get(tokens.size() - 1);
        assertThat(eof.type()).isEqualTo(TokenType.EOF);
        assertThat(eof.line()).isEqualTo(3);
        assertThat(eof.column()).isEqualTo(2);
    }

    @Test
    void parsesHexadecimalNumbers() {
        List<Token> tokens = scan("0x1F 0XfF 42");

        assertThat(tokens.get(0).value()).isEqualTo(31L);
        assertThat(tokens.get(1).value()).isEqualTo(255L);
        assertThat(tokens.get(2).value()).isEqualTo(42L);
    }

    @Test
    void reportsMalformedNumberAsSingleToken() {
        List<Token> tokens = scan("12ab;");

        assertThat(types(tokens)).containsExactly(TokenType.NUMBER, TokenType.SEMICOLON, TokenType.EOF);
        assertThat(tokens.get(0).value()).isNull();
        assertThat(diagnostics.summary()).contains("Malformed numeric literal '12ab'");
    }

    @Test
    void reportsNumberOutOfRange() {
        List<Token> tokens = scan("99999999999999999999");

        assertThat(tokens.get(0).value()).isNull();
        assertThat(diagnostics.summary()).contains("out of range");
    }

    @Test
    void unescapesStrings() {
        List<Token> tokens = scan("\"a\\\"b\\n\" 'it\\'s'");

        assertThat(tokens.get(0).value()).isEqualTo("a\"b\n");
        assertThat(tokens.get(1).value()).isEqualTo("it's");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void unterminatedStringConsumesToEndOfInput() {
        List<Token> tokens = scan("import \"other");

        assertThat(types(tokens)).containsExactly(TokenType.IDENTIFIER, TokenType.STRING, TokenType.EOF);
        assertThat(tokens.get(1).value()).isEqualTo("other");
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("Unterminated string literal");
    }

    @Test
    void keepsCommentsWithoutHashOrLineBreak() {
        List<Token> tokens = scan("# Documented thing\nstruct S {}");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(0).value()).isEqualTo("Documented thing");
        assertThat(tokens.get(1).line()).isEqualTo(2);
    }

    @Test
    void skipsUnknownCharactersAndKeepsGoing() {
        List<Token> tokens = scan("a $ b ! c");

        assertThat(tokens).extracting(Token::text).containsExactly("a", "b", "c", "");
        assertThat(diagnostics.getDiagnostics()).hasSize(2);
        assertThat(diagnostics.getDiagnostics().get(0).kind()).isEqualTo(Diagnostic.Kind.SYNTAX);
        assertThat(diagnostics.getDiagnostics().get(0).render()).isEqualTo("test.arf:1:3: Unexpected character '$'");
    }

    @Test
    void loneDashIsAnError() {
        scan("a - b");

        assertThat(diagnostics.summary()).contains("Unexpected '-', expected '->'");
    }

    @Test
    void emptyInputYieldsOnlyEof() {
        List<Token> tokens = scan("");

        assertThat(types(tokens)).containsExactly(TokenType.EOF);
        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(0).column()).isEqualTo(1);
    }
}
