package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code union Name { ... }} group inside a struct. Exactly one member is present at
 * runtime. Members are plain fields; unions never nest.
 *
 * @param name          The union name token.
 * @param members       The alternative fields, in order.
 * @param annotations   Annotations preceding the union.
 * @param documentation Comment lines preceding the union.
 */
public record UnionFieldNode(
        Token name,
        List<PlainFieldNode> members,
        List<AnnotationNode> annotations,
        List<String> documentation
) implements FieldNode {

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(members);
    }
}
