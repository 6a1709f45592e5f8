package org.arfrpc.compiler.frontend.parser.features.struct;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.IDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.FieldNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.parser.ast.UnionFieldNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code struct Name { ... }}.
 *
 * <p>The body holds fields, unions, nested structs and nested enums. Any other declaration
 * keyword is reported and the declaration is parsed and discarded so that errors inside it
 * are still collected.</p>
 */
public class StructDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context, DeclarationHeader header) {
        context.advance(); // consume 'struct'
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a struct name after 'struct'");
        if (name == null) return null;
        if (context.consume(TokenType.LEFT_BRACE, "Expected '{' after struct name '" + name.text() + "'") == null) {
            return null;
        }

        NodeId id = context.nextId();
        List<FieldNode> fields = new ArrayList<>();
        List<StructNode> structs = new ArrayList<>();
        List<EnumNode> enums = new ArrayList<>();

        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            DeclarationHeader member = context.parseHeader(id);
            if (context.check(TokenType.RIGHT_BRACE) || context.isAtEnd()) {
                if (member.hasAnnotations()) {
                    context.error(context.peek(), "Expected a declaration after annotations");
                }
                break;
            }

            if (context.atDeclarationKeyword()) {
                Token keyword = context.peek();
                boolean allowed = keyword.isKeyword(Keywords.STRUCT)
                        || keyword.isKeyword(Keywords.ENUM)
                        || keyword.isKeyword(Keywords.UNION);
                if (!allowed) {
                    context.error(keyword, "'" + keyword.text() + "' is not allowed inside struct '" + name.text() + "'");
                }
                AstNode node = context.parseDeclaration(member);
                if (!allowed) {
                    continue;
                }
                if (node instanceof StructNode nested) {
                    structs.add(nested);
                } else if (node instanceof EnumNode nested) {
                    enums.add(nested);
                } else if (node instanceof UnionFieldNode union) {
                    fields.add(union);
                }
                continue;
            }

            PlainFieldNode field = FieldParser.parse(context, member);
            if (field == null) {
                context.synchronize();
            } else {
                fields.add(field);
            }
        }

        context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close struct '" + name.text() + "'");
        return new StructNode(id, header.parentId(), name, fields, structs, enums,
                header.annotations(), header.documentation());
    }
}
