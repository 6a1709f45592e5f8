package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodParamNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodReturnNode;
import org.arfrpc.compiler.frontend.parser.ast.types.ArrayTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.MapTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.OptionalTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.QualifiedUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.SimpleUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeVisitor;
import org.arfrpc.compiler.frontend.parser.ast.types.UserTypeNode;

import java.util.StringJoiner;

/**
 * Renders types and method signatures in a canonical form in which user types appear by
 * their resolved fully qualified name. Two declarations with equal signatures are
 * interchangeable however their types were spelled.
 */
public final class TypeSignature implements TypeVisitor<String> {

    private final SymbolTable symbolTable;

    public TypeSignature(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    public String of(TypeNode type) {
        return type.accept(this);
    }

    /**
     * @return e.g. {@code (req p.Req, stream p.Chunk) -> (p.Resp)}.
     */
    public String of(MethodNode method) {
        StringJoiner params = new StringJoiner(", ", "(", ")");
        for (MethodParamNode param : method.params()) {
            params.add(param.named() ? param.name().text() + " " + of(param.type()) : of(param.type()));
        }
        StringJoiner returns = new StringJoiner(", ", "(", ")");
        for (MethodReturnNode ret : method.returns()) {
            returns.add(ret.named() ? ret.name().text() + " " + of(ret.type()) : of(ret.type()));
        }
        return params + " -> " + returns;
    }

    @Override
    public String visitPrimitive(PrimitiveTypeNode type) {
        return type.primitive().keyword();
    }

    @Override
    public String visitArray(ArrayTypeNode type) {
        return "array<" + of(type.element()) + ">";
    }

    @Override
    public String visitMap(MapTypeNode type) {
        return "map<" + of(type.key()) + ", " + of(type.value()) + ">";
    }

    @Override
    public String visitOptional(OptionalTypeNode type) {
        return "optional<" + of(type.inner()) + ">";
    }

    @Override
    public String visitStreaming(StreamingTypeNode type) {
        return "stream " + of(type.inner());
    }

    @Override
    public String visitSimpleUserType(SimpleUserTypeNode type) {
        return user(type);
    }

    @Override
    public String visitQualifiedUserType(QualifiedUserTypeNode type) {
        return user(type);
    }

    private String user(UserTypeNode type) {
        return symbolTable.resolutionOf(type.id()).map(Symbol::fqn).orElse(type.name());
    }
}
