package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.model.Token;

import java.util.List;

/**
 * A field {@code name Type = index;}.
 *
 * @param name          The field name token.
 * @param type          The declared type.
 * @param index         The wire index.
 * @param annotations   Annotations preceding the field.
 * @param documentation Comment lines preceding the field.
 */
public record PlainFieldNode(
        Token name,
        TypeNode type,
        int index,
        List<AnnotationNode> annotations,
        List<String> documentation
) implements FieldNode {
}
