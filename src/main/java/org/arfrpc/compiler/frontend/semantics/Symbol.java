package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.frontend.parser.ast.Declaration;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.model.SourcePosition;

import java.util.Locale;

/**
 * A named, addressable declaration in the symbol table.
 *
 * @param fqn         The fully qualified name: package, enclosing structs, then the name.
 * @param type        What kind of declaration this is.
 * @param node        The declaration node.
 * @param module      The file that declares it.
 * @param packageName The package that owns it.
 */
public record Symbol(String fqn, Type type, Declaration node, ModuleId module, String packageName) {

    /**
     * Defines the types of symbols that can be stored in the symbol table.
     */
    public enum Type {
        STRUCT,
        ENUM,
        SERVICE
    }

    public String name() {
        return node.name().text();
    }

    public NodeId id() {
        return node.id();
    }

    public NodeId parentId() {
        return node.parentId();
    }

    public SourcePosition position() {
        return node.position();
    }

    /**
     * @return True for the declarations a type reference may point at.
     */
    public boolean isType() {
        return type == Type.STRUCT || type == Type.ENUM;
    }

    /**
     * @return e.g. {@code struct org.example.Foo}.
     */
    public String describe() {
        return type.name().toLowerCase(Locale.ROOT) + " " + fqn;
    }
}
