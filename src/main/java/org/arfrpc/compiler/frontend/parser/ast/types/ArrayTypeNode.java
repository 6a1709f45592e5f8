package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.model.SourcePosition;

/**
 * {@code array<T>}.
 */
public record ArrayTypeNode(TypeNode element, SourcePosition position) implements TypeNode {

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String describe() {
        return "array<" + element.describe() + ">";
    }
}
