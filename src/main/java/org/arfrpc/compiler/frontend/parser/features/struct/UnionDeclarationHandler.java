package org.arfrpc.compiler.frontend.parser.features.struct;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.IDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.UnionFieldNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code union name { field* }}. Members must be plain fields.
 */
public class UnionDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context, DeclarationHeader header) {
        context.advance(); // consume 'union'
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a union name after 'union'");
        if (name == null) return null;
        if (context.consume(TokenType.LEFT_BRACE, "Expected '{' after union name '" + name.text() + "'") == null) {
            return null;
        }

        List<PlainFieldNode> members = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            DeclarationHeader member = context.parseHeader(header.parentId());
            if (context.check(TokenType.RIGHT_BRACE) || context.isAtEnd()) {
                if (member.hasAnnotations()) {
                    context.error(context.peek(), "Expected a field after annotations");
                }
                break;
            }
            if (context.atDeclarationKeyword()) {
                Token keyword = context.peek();
                context.error(keyword, "Only fields are allowed inside union '" + name.text() + "', found '" + keyword.text() + "'");
                context.parseDeclaration(member);
                continue;
            }
            PlainFieldNode field = FieldParser.parse(context, member);
            if (field == null) {
                context.synchronize();
            } else {
                members.add(field);
            }
        }

        context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close union '" + name.text() + "'");
        return new UnionFieldNode(name, members, header.annotations(), header.documentation());
    }
}
