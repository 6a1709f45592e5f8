package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

/**
 * A method output. Outputs follow the same naming rules as inputs.
 *
 * @param name     The output name, or {@code null} when unnamed.
 * @param type     The returned type; a {@link StreamingTypeNode} for streaming outputs.
 * @param position The position of the output's first token.
 */
public record MethodReturnNode(Token name, TypeNode type, SourcePosition position) implements SourceLocatable {

    public boolean named() {
        return name != null;
    }

    public boolean stream() {
        return type instanceof StreamingTypeNode;
    }
}
