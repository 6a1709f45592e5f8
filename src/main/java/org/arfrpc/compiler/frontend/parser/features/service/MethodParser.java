package org.arfrpc.compiler.frontend.parser.features.service;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodParamNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodReturnNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.frontend.parser.features.types.TypeParser;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a method signature: {@code Name(Param, ...) [-> Type | -> (Type, ...)];}.
 *
 * <p>A parameter is {@code name Type}, a bare {@code Type}, or {@code stream Type}. An
 * identifier directly followed by another identifier is a name; anything else starts the
 * type. Returns use the same rule.</p>
 */
public final class MethodParser {

    private MethodParser() {
        // Utility class
    }

    /**
     * @param context The parsing context, positioned at the method name.
     * @param header  The method's annotations, documentation and owning service.
     * @return The method, or null after reporting an error.
     */
    public static MethodNode parse(ParsingContext context, DeclarationHeader header) {
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a method name but found '" + context.peek().text() + "'");
        if (name == null) return null;
        NodeId id = context.nextId();

        if (context.consume(TokenType.LEFT_PAREN, "Expected '(' after method name '" + name.text() + "'") == null) {
            return null;
        }
        List<MethodParamNode> params = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                Token start = context.peek();
                Token paramName = parseElementName(context);
                TypeNode type = TypeParser.parseSignatureType(context);
                if (type == null) return null;
                params.add(new MethodParamNode(paramName, type, start.position()));
            } while (context.match(TokenType.COMMA));
        }
        if (context.consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters of method '" + name.text() + "'") == null) {
            return null;
        }

        List<MethodReturnNode> returns = new ArrayList<>();
        if (context.match(TokenType.ARROW)) {
            if (context.match(TokenType.LEFT_PAREN)) {
                do {
                    MethodReturnNode ret = parseReturn(context);
                    if (ret == null) return null;
                    returns.add(ret);
                } while (context.match(TokenType.COMMA));
                if (context.consume(TokenType.RIGHT_PAREN, "Expected ')' after return types of method '" + name.text() + "'") == null) {
                    return null;
                }
            } else {
                MethodReturnNode ret = parseReturn(context);
                if (ret == null) return null;
                returns.add(ret);
            }
        }

        context.consume(TokenType.SEMICOLON, "Expected ';' after method '" + name.text() + "'");
        return new MethodNode(id, header.parentId(), name, params, returns, header.annotations(), header.documentation());
    }

    private static MethodReturnNode parseReturn(ParsingContext context) {
        Token start = context.peek();
        Token returnName = parseElementName(context);
        TypeNode type = TypeParser.parseSignatureType(context);
        return type == null ? null : new MethodReturnNode(returnName, type, start.position());
    }

    private static Token parseElementName(ParsingContext context) {
        if (context.check(TokenType.IDENTIFIER)
                && !context.checkKeyword(Keywords.STREAM)
                && context.peekAhead(1).type() == TokenType.IDENTIFIER) {
            return context.advance();
        }
        return null;
    }
}
