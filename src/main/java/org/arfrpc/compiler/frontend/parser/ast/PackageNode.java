package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.List;

/**
 * The {@code package a.b.c;} declaration that opens every file.
 *
 * @param keyword    The {@code package} keyword token.
 * @param components The dotted name components, in order.
 */
public record PackageNode(Token keyword, List<String> components) implements AstNode, SourceLocatable {

    /**
     * @return The dotted package name.
     */
    public String name() {
        return String.join(".", components);
    }

    /**
     * @return The last name component, used to synthesize import aliases.
     */
    public String lastComponent() {
        return components.get(components.size() - 1);
    }

    @Override
    public SourcePosition position() {
        return keyword.position();
    }
}
