package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.model.SourcePosition;

import java.util.List;

/**
 * A dotted user type reference such as {@code common.Money} or {@code Outer.Inner}.
 */
public record QualifiedUserTypeNode(NodeId id, List<String> components, SourcePosition position) implements UserTypeNode {

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitQualifiedUserType(this);
    }
}
