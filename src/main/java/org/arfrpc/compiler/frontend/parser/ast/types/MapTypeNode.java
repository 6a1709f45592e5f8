package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.model.SourcePosition;

/**
 * {@code map<K, V>}. Key legality is checked after resolution.
 */
public record MapTypeNode(TypeNode key, TypeNode value, SourcePosition position) implements TypeNode {

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitMap(this);
    }

    @Override
    public String describe() {
        return "map<" + key.describe() + ", " + value.describe() + ">";
    }
}
