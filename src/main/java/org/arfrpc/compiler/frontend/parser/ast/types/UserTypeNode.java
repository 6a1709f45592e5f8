package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.frontend.parser.ast.NodeId;

import java.util.List;

/**
 * A reference to a user-declared struct or enum. References are identified by
 * {@link #id()}; the resolver records the target in a side table keyed by that id.
 */
public sealed interface UserTypeNode extends TypeNode permits SimpleUserTypeNode, QualifiedUserTypeNode {

    NodeId id();

    /**
     * @return The dotted name components as written.
     */
    List<String> components();

    /**
     * @return The name as written.
     */
    default String name() {
        return String.join(".", components());
    }

    @Override
    default String describe() {
        return name();
    }
}
