package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.model.SourcePosition;

public record PrimitiveTypeNode(PrimitiveType primitive, SourcePosition position) implements TypeNode {

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public String describe() {
        return primitive.keyword();
    }
}
