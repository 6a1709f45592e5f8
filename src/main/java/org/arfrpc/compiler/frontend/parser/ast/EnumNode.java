package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code enum Name { A = 0; ... }} declaration.
 *
 * @param id            The enum identity.
 * @param parentId      The enclosing struct, or {@code null} at file level.
 * @param name          The name token.
 * @param options       The options, in source order.
 * @param annotations   Annotations preceding the enum.
 * @param documentation Comment lines preceding the enum.
 */
public record EnumNode(
        NodeId id,
        NodeId parentId,
        Token name,
        List<EnumOptionNode> options,
        List<AnnotationNode> annotations,
        List<String> documentation
) implements Declaration {

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(options);
    }
}
