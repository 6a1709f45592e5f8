package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

/**
 * A method input: {@code name Type}, bare {@code Type}, or {@code stream Type}.
 *
 * @param name     The parameter name, or {@code null} when unnamed.
 * @param type     The parameter type; a {@link StreamingTypeNode} for streaming inputs.
 * @param position The position of the parameter's first token.
 */
public record MethodParamNode(Token name, TypeNode type, SourcePosition position) implements SourceLocatable {

    public boolean named() {
        return name != null;
    }

    public boolean stream() {
        return type instanceof StreamingTypeNode;
    }
}
