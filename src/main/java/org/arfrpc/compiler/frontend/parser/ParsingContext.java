package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

/**
 * Provides declaration handlers with access to the token stream.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the current token is the identifier {@code keyword} without consuming it.
     * @param keyword The keyword spelling.
     * @return true if the current token spells the keyword.
     */
    boolean checkKeyword(String keyword);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns a token further ahead without consuming anything.
     * @param offset 0 for the current token, 1 for the one after it, and so on.
     * @return The token, or the EOF token when the offset runs past the end.
     */
    Token peekAhead(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports a parse error at the current token.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token, or null if the type did not match.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Reports a parse error at the given token.
     * @param token The offending token.
     * @param message The message.
     */
    void error(Token token, String message);

    /**
     * Skips tokens after a parse error: up to and including the next {@code ;}, up to the
     * end of the current line, or up to (not including) a closing {@code }}.
     */
    void synchronize();

    /**
     * Reads the documentation comments and annotations that prefix a declaration.
     * @param parentId The enclosing declaration, or {@code null} at file level.
     * @return The header for the declaration that follows.
     */
    DeclarationHeader parseHeader(NodeId parentId);

    /**
     * Checks whether the current token starts a keyword-introduced declaration.
     * @return true if a registered handler exists for the current token.
     */
    boolean atDeclarationKeyword();

    /**
     * Parses the keyword-introduced declaration at the current token with its handler.
     * Synchronizes when the handler fails.
     * @param header The already parsed header.
     * @return The node, or null if parsing failed.
     */
    AstNode parseDeclaration(DeclarationHeader header);

    /**
     * @return A fresh node identity.
     */
    NodeId nextId();

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
