package org.arfrpc.compiler.frontend.parser.features.types;

import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.types.ArrayTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.MapTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.OptionalTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveType;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.QualifiedUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.SimpleUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses type expressions.
 *
 * <pre>
 * Type          := 'map' '<' Type ',' Type '>'
 *                | 'array' '<' Type '>'
 *                | 'optional' '<' Type '>'
 *                | Primitive
 *                | Ident ('.' Ident)*
 * SignatureType := 'stream'? Type
 * </pre>
 */
public final class TypeParser {

    private static final Set<String> NON_TYPE_KEYWORDS = Set.of(
            Keywords.PACKAGE, Keywords.IMPORT, Keywords.AS, Keywords.STRUCT,
            Keywords.ENUM, Keywords.UNION, Keywords.SERVICE);

    private TypeParser() {
        // Utility class
    }

    /**
     * Parses a method parameter or return type, which may carry a {@code stream} prefix.
     *
     * @param context The parsing context.
     * @return The type, or null after reporting an error.
     */
    public static TypeNode parseSignatureType(ParsingContext context) {
        if (context.checkKeyword(Keywords.STREAM)) {
            Token stream = context.advance();
            TypeNode inner = parseType(context);
            return inner == null ? null : new StreamingTypeNode(inner, stream.position());
        }
        return parseType(context);
    }

    /**
     * Parses a field or nested type.
     *
     * @param context The parsing context.
     * @return The type, or null after reporting an error.
     */
    public static TypeNode parseType(ParsingContext context) {
        Token head = context.consume(TokenType.IDENTIFIER, "Expected a type but found '" + context.peek().text() + "'");
        if (head == null) return null;
        String text = head.text();

        switch (text) {
            case Keywords.MAP -> {
                return parseMap(context, head);
            }
            case Keywords.ARRAY -> {
                TypeNode element = parseSingleArgument(context, head);
                return element == null ? null : new ArrayTypeNode(element, head.position());
            }
            case Keywords.OPTIONAL -> {
                TypeNode inner = parseSingleArgument(context, head);
                return inner == null ? null : new OptionalTypeNode(inner, head.position());
            }
            case Keywords.STREAM -> {
                context.error(head, "'stream' can only prefix a method parameter or return type");
                return null;
            }
            default -> {
                // fall through to primitives and user types
            }
        }

        if (NON_TYPE_KEYWORDS.contains(text)) {
            context.error(head, "Expected a type but found keyword '" + text + "'");
            return null;
        }

        Optional<PrimitiveType> primitive = PrimitiveType.fromKeyword(text);
        if (primitive.isPresent()) {
            return new PrimitiveTypeNode(primitive.get(), head.position());
        }

        List<String> components = new ArrayList<>();
        components.add(text);
        while (context.match(TokenType.DOT)) {
            Token next = context.consume(TokenType.IDENTIFIER,
                    "Expected a name after '.' in type '" + String.join(".", components) + "'");
            if (next == null) return null;
            components.add(next.text());
        }
        if (components.size() == 1) {
            return new SimpleUserTypeNode(context.nextId(), text, head.position());
        }
        return new QualifiedUserTypeNode(context.nextId(), List.copyOf(components), head.position());
    }

    private static TypeNode parseMap(ParsingContext context, Token head) {
        if (context.consume(TokenType.LEFT_ANGLE, "Expected '<' after 'map'") == null) return null;
        TypeNode key = parseType(context);
        if (key == null) return null;
        if (context.consume(TokenType.COMMA, "Expected ',' between map key and value types") == null) return null;
        TypeNode value = parseType(context);
        if (value == null) return null;
        if (context.consume(TokenType.RIGHT_ANGLE, "Expected '>' to close map type") == null) return null;
        return new MapTypeNode(key, value, head.position());
    }

    private static TypeNode parseSingleArgument(ParsingContext context, Token head) {
        if (context.consume(TokenType.LEFT_ANGLE, "Expected '<' after '" + head.text() + "'") == null) return null;
        TypeNode inner = parseType(context);
        if (inner == null) return null;
        if (context.consume(TokenType.RIGHT_ANGLE, "Expected '>' to close " + head.text() + " type") == null) return null;
        return inner;
    }
}
