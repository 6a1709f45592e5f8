package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.List;

/**
 * A struct member: either a {@link PlainFieldNode} or a {@link UnionFieldNode}.
 */
public sealed interface FieldNode extends AstNode, SourceLocatable permits PlainFieldNode, UnionFieldNode {

    Token name();

    List<AnnotationNode> annotations();

    List<String> documentation();

    @Override
    default SourcePosition position() {
        return name().position();
    }
}
