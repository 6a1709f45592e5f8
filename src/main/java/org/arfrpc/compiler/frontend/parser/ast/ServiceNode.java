package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code service Name { ... }} declaration.
 *
 * <p>A service may be declared by several textual blocks ("reopened"). The parser merges
 * blocks of one file into a single node by appending methods; blocks from other files are
 * merged when the package tree is built. Every block's position is kept for diagnostics.</p>
 */
public final class ServiceNode implements Declaration {

    private final NodeId id;
    private final Token name;
    private final List<MethodNode> methods = new ArrayList<>();
    private final List<AnnotationNode> annotations = new ArrayList<>();
    private final List<String> documentation;
    private final List<SourcePosition> blocks = new ArrayList<>();

    public ServiceNode(NodeId id, Token name, List<MethodNode> methods,
                       List<AnnotationNode> annotations, List<String> documentation) {
        this.id = id;
        this.name = name;
        this.documentation = List.copyOf(documentation);
        this.blocks.add(name.position());
        this.methods.addAll(methods);
        this.annotations.addAll(annotations);
    }

    /**
     * Creates an empty service with this one's identity and documentation, into which
     * blocks can be merged without touching this node.
     */
    public ServiceNode copy() {
        ServiceNode copy = new ServiceNode(id, name, List.of(), List.of(), documentation);
        copy.blocks.clear();
        copy.reopen(this);
        return copy;
    }

    /**
     * Appends every block of {@code other} to this service. The appended methods are
     * re-parented to this service.
     *
     * @param other Another declaration of the same service.
     */
    public void reopen(ServiceNode other) {
        blocks.addAll(other.blocks);
        for (MethodNode method : other.methods) {
            methods.add(method.withParentId(id));
        }
        annotations.addAll(other.annotations);
    }

    @Override
    public NodeId id() {
        return id;
    }

    @Override
    public NodeId parentId() {
        return null;
    }

    @Override
    public Token name() {
        return name;
    }

    /**
     * @return Every method of every block, in declaration order, including repeated
     *         declarations of the same method.
     */
    public List<MethodNode> methods() {
        return Collections.unmodifiableList(methods);
    }

    /**
     * @return One method per name, the first declaration winning.
     */
    public List<MethodNode> distinctMethods() {
        Map<String, MethodNode> byName = new LinkedHashMap<>();
        for (MethodNode method : methods) {
            byName.putIfAbsent(method.name().text(), method);
        }
        return List.copyOf(byName.values());
    }

    @Override
    public List<AnnotationNode> annotations() {
        return Collections.unmodifiableList(annotations);
    }

    @Override
    public List<String> documentation() {
        return documentation;
    }

    /**
     * @return The position of every block that declared this service.
     */
    public List<SourcePosition> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(methods);
    }

    @Override
    public String toString() {
        return "ServiceNode[" + name.text() + ", methods=" + methods.size() + ", blocks=" + blocks.size() + "]";
    }
}
