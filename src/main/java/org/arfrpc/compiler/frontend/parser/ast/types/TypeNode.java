package org.arfrpc.compiler.frontend.parser.ast.types;

import org.arfrpc.compiler.frontend.parser.ast.SourceLocatable;

/**
 * A type expression. The variant set is closed; callers that must handle every variant
 * go through {@link #accept(TypeVisitor)} so a new variant is a compile error everywhere.
 */
public sealed interface TypeNode extends SourceLocatable
        permits PrimitiveTypeNode, ArrayTypeNode, MapTypeNode, OptionalTypeNode, StreamingTypeNode, UserTypeNode {

    <R> R accept(TypeVisitor<R> visitor);

    /**
     * @return The type as it would be written in source, e.g. {@code map<string, Foo>}.
     */
    String describe();
}
