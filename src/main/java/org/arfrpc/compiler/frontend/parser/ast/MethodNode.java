package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.Token;

import java.util.List;

/**
 * A service method {@code Name(params) -> returns;}.
 *
 * @param id            The method identity.
 * @param parentId      The owning service.
 * @param name          The name token.
 * @param params        The inputs, in order.
 * @param returns       The outputs, in order; empty when the method has no arrow clause.
 * @param annotations   Annotations preceding the method.
 * @param documentation Comment lines preceding the method.
 */
public record MethodNode(
        NodeId id,
        NodeId parentId,
        Token name,
        List<MethodParamNode> params,
        List<MethodReturnNode> returns,
        List<AnnotationNode> annotations,
        List<String> documentation
) implements Declaration {

    /**
     * Returns a copy owned by another service, used when reopened blocks are merged.
     */
    public MethodNode withParentId(NodeId newParent) {
        return new MethodNode(id, newParent, name, params, returns, annotations, documentation);
    }
}
