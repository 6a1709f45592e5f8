package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;

/**
 * Capability interface for AST nodes that originate from a specific source location.
 * Used for diagnostics and by the semantic analyzer to switch the current module when
 * traversal crosses into another file.
 */
public interface SourceLocatable {

    /**
     * Returns the position of the node's defining token.
     *
     * @return The position, never null.
     */
    SourcePosition position();

    /**
     * Returns the file path of the source file this node originated from.
     */
    default String getSourceFileName() {
        return position().fileName();
    }
}
