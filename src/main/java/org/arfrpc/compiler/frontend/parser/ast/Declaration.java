package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.List;

/**
 * A named declaration that owns an identity: struct, enum, service or method.
 */
public interface Declaration extends AstNode, SourceLocatable {

    /**
     * @return The identity of this declaration.
     */
    NodeId id();

    /**
     * @return The identity of the enclosing declaration, or {@code null} at file level.
     */
    NodeId parentId();

    /**
     * @return The name token.
     */
    Token name();

    List<AnnotationNode> annotations();

    /**
     * @return The comment lines immediately preceding the declaration.
     */
    List<String> documentation();

    @Override
    default SourcePosition position() {
        return name().position();
    }
}
