package org.arfrpc.compiler.frontend.parser.ast.types;

/**
 * Exhaustive handling of {@link TypeNode} variants.
 *
 * @param <R> The result type.
 */
public interface TypeVisitor<R> {

    R visitPrimitive(PrimitiveTypeNode type);

    R visitArray(ArrayTypeNode type);

    R visitMap(MapTypeNode type);

    R visitOptional(OptionalTypeNode type);

    R visitStreaming(StreamingTypeNode type);

    R visitSimpleUserType(SimpleUserTypeNode type);

    R visitQualifiedUserType(QualifiedUserTypeNode type);
}
