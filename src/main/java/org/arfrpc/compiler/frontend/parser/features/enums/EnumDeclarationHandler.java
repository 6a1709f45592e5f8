package org.arfrpc.compiler.frontend.parser.features.enums;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.IDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumOptionNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.frontend.parser.features.NumericLiterals;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code enum Name { OPTION = value; ... }}.
 *
 * <p>Declarations inside an enum body are errors; they are parsed and discarded.</p>
 */
public class EnumDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context, DeclarationHeader header) {
        context.advance(); // consume 'enum'
        Token name = context.consume(TokenType.IDENTIFIER, "Expected an enum name after 'enum'");
        if (name == null) return null;
        if (context.consume(TokenType.LEFT_BRACE, "Expected '{' after enum name '" + name.text() + "'") == null) {
            return null;
        }

        NodeId id = context.nextId();
        List<EnumOptionNode> options = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            DeclarationHeader member = context.parseHeader(id);
            if (context.check(TokenType.RIGHT_BRACE) || context.isAtEnd()) {
                if (member.hasAnnotations()) {
                    context.error(context.peek(), "Expected an enum option after annotations");
                }
                break;
            }
            if (context.atDeclarationKeyword()) {
                Token keyword = context.peek();
                context.error(keyword, "'" + keyword.text() + "' is not allowed inside enum '" + name.text() + "'");
                context.parseDeclaration(member);
                continue;
            }
            EnumOptionNode option = parseOption(context, member);
            if (option == null) {
                context.synchronize();
            } else {
                options.add(option);
            }
        }

        context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close enum '" + name.text() + "'");
        return new EnumNode(id, header.parentId(), name, options, header.annotations(), header.documentation());
    }

    private EnumOptionNode parseOption(ParsingContext context, DeclarationHeader header) {
        Token name = context.consume(TokenType.IDENTIFIER, "Expected an enum option name but found '" + context.peek().text() + "'");
        if (name == null) return null;
        if (Keywords.isReserved(name.text())) {
            context.error(name, "'" + name.text() + "' is a reserved word and cannot be used as an enum option name");
        }
        if (context.consume(TokenType.EQUAL, "Expected '=' after enum option '" + name.text() + "'") == null) {
            return null;
        }
        Integer value = NumericLiterals.int32(context, "enum option value");
        if (value == null) return null;
        context.consume(TokenType.SEMICOLON, "Expected ';' after enum option '" + name.text() + "'");
        return new EnumOptionNode(name, value, header.annotations(), header.documentation());
    }
}
