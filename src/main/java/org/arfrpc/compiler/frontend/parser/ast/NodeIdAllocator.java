package org.arfrpc.compiler.frontend.parser.ast;

/**
 * Hands out sequential {@link NodeId}s. One allocator is shared by every file parsed in a
 * compilation so ids never collide across files.
 */
public final class NodeIdAllocator {

    private int next = 1;

    public NodeId next() {
        return new NodeId(next++);
    }
}
