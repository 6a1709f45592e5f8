package org.arfrpc.compiler.frontend.parser.features.service;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.IDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses one {@code service Name { method* }} block. Blocks sharing a name are merged by
 * the caller.
 */
public class ServiceDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context, DeclarationHeader header) {
        context.advance(); // consume 'service'
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a service name after 'service'");
        if (name == null) return null;
        if (context.consume(TokenType.LEFT_BRACE, "Expected '{' after service name '" + name.text() + "'") == null) {
            return null;
        }

        NodeId id = context.nextId();
        List<MethodNode> methods = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            DeclarationHeader member = context.parseHeader(id);
            if (context.check(TokenType.RIGHT_BRACE) || context.isAtEnd()) {
                if (member.hasAnnotations()) {
                    context.error(context.peek(), "Expected a method after annotations");
                }
                break;
            }
            if (context.atDeclarationKeyword()) {
                Token keyword = context.peek();
                context.error(keyword, "'" + keyword.text() + "' is not allowed inside service '" + name.text() + "'");
                context.parseDeclaration(member);
                continue;
            }
            MethodNode method = MethodParser.parse(context, member);
            if (method == null) {
                context.synchronize();
            } else {
                methods.add(method);
            }
        }

        context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close service '" + name.text() + "'");
        return new ServiceNode(id, name, methods, header.annotations(), header.documentation());
    }
}
