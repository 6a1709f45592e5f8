package org.arfrpc.compiler.frontend.parser.ast;

/**
 * Identity of a declaration or type reference, unique within one compilation.
 * Parent links and type-resolution results are stored as {@code NodeId}s, never as
 * object references, so the tree itself stays immutable after parsing.
 *
 * @param value The numeric id.
 */
public record NodeId(int value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
