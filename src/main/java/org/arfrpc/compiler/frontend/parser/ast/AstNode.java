package org.arfrpc.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Base type of every node in the abstract syntax tree.
 */
public interface AstNode {

    /**
     * Returns the child nodes that the semantic analyzer descends into.
     * Leaf nodes keep the default empty list.
     *
     * @return The children in source order.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
