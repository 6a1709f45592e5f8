package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.frontend.parser.ast.AnnotationNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;

import java.util.List;

/**
 * What precedes a declaration: its enclosing declaration, annotations and documentation.
 *
 * @param parentId      The enclosing declaration, or {@code null} at file level.
 * @param annotations   The annotations written before the declaration.
 * @param documentation The comment lines immediately above the declaration.
 */
public record DeclarationHeader(NodeId parentId, List<AnnotationNode> annotations, List<String> documentation) {

    public DeclarationHeader {
        annotations = List.copyOf(annotations);
        documentation = List.copyOf(documentation);
    }

    public boolean hasAnnotations() {
        return !annotations.isEmpty();
    }
}
