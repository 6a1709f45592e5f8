package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.types.ArrayTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.MapTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.OptionalTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveType;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.QualifiedUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.SimpleUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeVisitor;
import org.arfrpc.compiler.frontend.parser.ast.types.UserTypeNode;
import org.arfrpc.compiler.frontend.semantics.Symbol;
import org.arfrpc.compiler.frontend.semantics.TypeResolver;

import java.util.Optional;

/**
 * Resolves every user type inside a type expression and checks map keys.
 *
 * <p>A map key may be a primitive other than {@code bytes}, an enum, or (when enabled) a
 * struct. Optional, array and map keys are never legal, whatever they contain.</p>
 */
final class TypeReferenceWalker implements TypeVisitor<Void> {

    private final TypeResolver resolver;
    private final boolean allowStructKeys;
    private final DiagnosticsEngine diagnostics;

    TypeReferenceWalker(TypeResolver resolver, boolean allowStructKeys, DiagnosticsEngine diagnostics) {
        this.resolver = resolver;
        this.allowStructKeys = allowStructKeys;
        this.diagnostics = diagnostics;
    }

    void walk(TypeNode type) {
        type.accept(this);
    }

    @Override
    public Void visitPrimitive(PrimitiveTypeNode type) {
        return null;
    }

    @Override
    public Void visitArray(ArrayTypeNode type) {
        walk(type.element());
        return null;
    }

    @Override
    public Void visitMap(MapTypeNode type) {
        TypeNode key = type.key();
        if (!isLegalKey(key)) {
            diagnostics.reportError(Diagnostic.Kind.RESOLUTION,
                    "Cannot use " + key.describe() + " as a map key", type.position());
        }
        walk(type.value());
        return null;
    }

    @Override
    public Void visitOptional(OptionalTypeNode type) {
        walk(type.inner());
        return null;
    }

    @Override
    public Void visitStreaming(StreamingTypeNode type) {
        walk(type.inner());
        return null;
    }

    @Override
    public Void visitSimpleUserType(SimpleUserTypeNode type) {
        resolver.resolve(type, diagnostics);
        return null;
    }

    @Override
    public Void visitQualifiedUserType(QualifiedUserTypeNode type) {
        resolver.resolve(type, diagnostics);
        return null;
    }

    /**
     * Resolves the key and decides whether it may be used as a map key.
     */
    private boolean isLegalKey(TypeNode key) {
        if (key instanceof UserTypeNode user) {
            // an unresolved key has already been reported
            Optional<Symbol> target = resolver.resolve(user, diagnostics);
            return target.isEmpty() || target.get().type() == Symbol.Type.ENUM || allowStructKeys;
        }
        walk(key);
        if (key instanceof PrimitiveTypeNode primitive) {
            return primitive.primitive() != PrimitiveType.BYTES;
        }
        return false;
    }
}
