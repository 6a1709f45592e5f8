package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.frontend.parser.ast.AstNode;

/**
 * Handler interface for keyword-introduced declarations.
 * Handlers consume the keyword and the declaration's tokens and produce AST nodes.
 */
public interface IDeclarationHandler {

    /**
     * Parses the declaration starting at the current token (its keyword).
     *
     * @param context The parsing context providing access to the token stream.
     * @param header  The annotations and documentation already read for this declaration.
     * @return An AST node representing this declaration, or {@code null} if the header
     *         was too malformed to produce one.
     */
    AstNode parse(ParsingContext context, DeclarationHeader header);
}
