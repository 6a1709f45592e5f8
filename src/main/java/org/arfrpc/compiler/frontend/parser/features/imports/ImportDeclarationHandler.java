package org.arfrpc.compiler.frontend.parser.features.imports;

import org.arfrpc.compiler.frontend.parser.DeclarationHeader;
import org.arfrpc.compiler.frontend.parser.IDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.NamingConventions;
import org.arfrpc.compiler.frontend.parser.ParsingContext;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

/**
 * Parses the {@code import} declaration.
 *
 * <p>Syntax: {@code import "path" [as alias];}
 *
 * <p>This handler produces an {@link ImportNode} AST node. Loading the imported file is
 * handled by the DependencyScanner.
 */
public class ImportDeclarationHandler implements IDeclarationHandler {

    @Override
    public AstNode parse(ParsingContext context, DeclarationHeader header) {
        Token keyword = context.advance(); // consume 'import'

        Token pathToken = context.consume(TokenType.STRING, "Expected a file path in quotes after 'import'");
        if (pathToken == null) return null;
        if (((String) pathToken.value()).isBlank()) {
            context.error(pathToken, "Import path must not be empty");
        }

        Token aliasToken = null;
        if (context.checkKeyword(Keywords.AS)) {
            context.advance(); // consume 'as'
            aliasToken = context.consume(TokenType.IDENTIFIER, "Expected an alias name after 'as'");
            if (aliasToken == null) return null;
            if (Keywords.isReserved(aliasToken.text())) {
                context.error(aliasToken, "'" + aliasToken.text() + "' is a reserved word and cannot be used as an import alias");
            } else if (!NamingConventions.isSnakeCase(aliasToken.text())) {
                context.error(aliasToken, "Import alias '" + aliasToken.text() + "' must be snake_case");
            }
        }

        context.consume(TokenType.SEMICOLON, "Expected ';' after import declaration");
        return new ImportNode(keyword, pathToken, aliasToken);
    }
}
