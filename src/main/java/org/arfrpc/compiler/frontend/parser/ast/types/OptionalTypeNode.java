package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.model.SourcePosition;

/**
 * {@code optional<T>}.
 */
public record OptionalTypeNode(TypeNode inner, SourcePosition position) implements TypeNode {

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitOptional(this);
    }

    @Override
    public String describe() {
        return "optional<" + inner.describe() + ">";
    }
}
