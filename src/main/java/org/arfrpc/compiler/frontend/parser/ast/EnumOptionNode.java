package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.List;

/**
 * One {@code NAME = value;} entry of an enum. Values may repeat to express aliases.
 */
public record EnumOptionNode(
        Token name,
        int value,
        List<AnnotationNode> annotations,
        List<String> documentation
) implements AstNode, SourceLocatable {

    @Override
    public SourcePosition position() {
        return name.position();
    }
}
