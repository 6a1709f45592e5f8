package org.arfrpc.compiler.frontend.parser.features.annotation;

import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AnnotationNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the annotations that may prefix any declaration.
 *
 * <p>Syntax: {@code @name} or {@code @name(arg, ...)} where each argument is a string or
 * number literal.</p>
 */
public final class AnnotationParser {

    private AnnotationParser() {
        // Utility class
    }

    /**
     * Parses every annotation at the current position.
     *
     * @param context The parsing context.
     * @return The annotations in source order, empty if none.
     */
    public static List<AnnotationNode> parseAnnotations(ParsingContext context) {
        List<AnnotationNode> annotations = new ArrayList<>();
        while (context.check(TokenType.AT)) {
            Token at = context.advance();
            Token name = context.consume(TokenType.IDENTIFIER, "Expected an annotation name after '@'");
            if (name == null) {
                continue;
            }
            List<Token> arguments = new ArrayList<>();
            if (context.match(TokenType.LEFT_PAREN)) {
                parseArguments(context, at, arguments);
                context.consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments of annotation '@" + name.text() + "'");
            }
            annotations.add(new AnnotationNode(name, arguments));
        }
        return annotations;
    }

    private static void parseArguments(ParsingContext context, Token at, List<Token> arguments) {
        if (context.check(TokenType.RIGHT_PAREN)) {
            return;
        }
        do {
            if (context.check(TokenType.STRING) || context.check(TokenType.NUMBER)) {
                arguments.add(context.advance());
            } else {
                context.error(context.peek(), "Annotation arguments must be string or number literals");
                while (!context.isAtEnd() && !context.check(TokenType.RIGHT_PAREN) && context.peek().line() == at.line()) {
                    context.advance();
                }
                return;
            }
        } while (context.match(TokenType.COMMA));
    }
}
