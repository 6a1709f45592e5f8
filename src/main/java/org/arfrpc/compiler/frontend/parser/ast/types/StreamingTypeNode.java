package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.model.SourcePosition;

/**
 * {@code stream T}. Only produced for method parameters and returns.
 */
public record StreamingTypeNode(TypeNode inner, SourcePosition position) implements TypeNode {

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitStreaming(this);
    }

    @Override
    public String describe() {
        return "stream " + inner.describe();
    }
}
