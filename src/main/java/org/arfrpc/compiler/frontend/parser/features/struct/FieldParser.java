package org.arfrpc.compiler.frontend.parser.features.struct;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.frontend.parser.features.NumericLiterals;
import org.arfrpc.compiler.frontend.parser.features.types.TypeParser;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

/**
 * Parses a plain field: {@code name Type = index;}.
 */
public final class FieldParser {

    private FieldParser() {
        // Utility class
    }

    /**
     * @param context The parsing context, positioned at the field name.
     * @param header  The field's annotations and documentation.
     * @return The field, or null after reporting an error.
     */
    public static PlainFieldNode parse(ParsingContext context, DeclarationHeader header) {
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a field name but found '" + context.peek().text() + "'");
        if (name == null) return null;
        if (Keywords.isReserved(name.text())) {
            context.error(name, "'" + name.text() + "' is a reserved word and cannot be used as a field name");
        }

        TypeNode type = TypeParser.parseType(context);
        if (type == null) return null;

        if (context.consume(TokenType.EQUAL, "Expected '=' and an index after field '" + name.text() + "'") == null) {
            return null;
        }
        Integer index = NumericLiterals.int32(context, "field index");
        if (index == null) return null;

        context.consume(TokenType.SEMICOLON, "Expected ';' after field '" + name.text() + "'");
        return new PlainFieldNode(name, type, index, header.annotations(), header.documentation());
    }
}
