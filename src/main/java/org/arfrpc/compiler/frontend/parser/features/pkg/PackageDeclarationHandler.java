package org.arfrpc.compiler.frontend.parser.features.pkg;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.IDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.NamingConventions;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.PackageNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code package a.b.c;}. Every component must be snake_case.
 */
public class PackageDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context, DeclarationHeader header) {
        Token keyword = context.advance(); // consume 'package'

        List<Token> components = new ArrayList<>();
        Token first = context.consume(TokenType.IDENTIFIER, "Expected a package name after 'package'");
        if (first == null) return null;
        components.add(first);
        while (context.match(TokenType.DOT)) {
            Token next = context.consume(TokenType.IDENTIFIER, "Expected a package name component after '.'");
            if (next == null) return null;
            components.add(next);
        }

        for (Token component : components) {
            if (Keywords.isReserved(component.text())) {
                context.error(component, "'" + component.text() + "' is a reserved word and cannot be used in a package name");
            } else if (!NamingConventions.isSnakeCase(component.text())) {
                context.error(component, "Package name component '" + component.text() + "' must be snake_case");
            }
        }

        context.consume(TokenType.SEMICOLON, "Expected ';' after package declaration");
        return new PackageNode(keyword, components.stream().map(Token::text).toList());
    }
}
