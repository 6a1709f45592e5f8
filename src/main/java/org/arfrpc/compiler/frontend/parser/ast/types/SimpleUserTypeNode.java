package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.model.SourcePosition;

import java.util.List;

/**
 * An undotted user type reference such as {@code Foo}.
 */
public record SimpleUserTypeNode(NodeId id, String name, SourcePosition position) implements UserTypeNode {

    @Override
    public List<String> components() {
        return List.of(name);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitSimpleUserType(this);
    }
}
