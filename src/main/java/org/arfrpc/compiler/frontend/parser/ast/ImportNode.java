package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.Optional;

/**
 * AST node for {@code import "path" [as alias];}.
 *
 * @param keyword The {@code import} keyword token.
 * @param path    The string literal token holding the import path.
 * @param alias   The explicit alias token, or {@code null} when the alias is synthesized
 *                from the imported package.
 */
public record ImportNode(Token keyword, Token path, Token alias) implements AstNode, SourceLocatable {

    /**
     * @return The import literal as written, without quotes.
     */
    public String pathValue() {
        return (String) path.value();
    }

    public Optional<Token> explicitAlias() {
        return Optional.ofNullable(alias);
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }
}
