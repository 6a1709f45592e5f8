package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The root node of one parsed source file.
 *
 * @param path          The logical file name.
 * @param packageDecl   The package declaration, or {@code null} if it failed to parse.
 * @param imports       Import declarations, in order.
 * @param structs       Top-level structs.
 * @param enums         Top-level enums.
 * @param services      Top-level services, with reopened blocks already merged.
 */
public record FileNode(
        String path,
        PackageNode packageDecl,
        List<ImportNode> imports,
        List<StructNode> structs,
        List<EnumNode> enums,
        List<ServiceNode> services
) implements AstNode, SourceLocatable {

    /**
     * @return The dotted package name, or an empty string when the declaration is missing.
     */
    public String packageName() {
        return packageDecl == null ? "" : packageDecl.name();
    }

    public Optional<StructNode> findStruct(String name) {
        return structs.stream().filter(s -> s.name().text().equals(name)).findFirst();
    }

    public Optional<EnumNode> findEnum(String name) {
        return enums.stream().filter(e -> e.name().text().equals(name)).findFirst();
    }

    public Optional<ServiceNode> findService(String name) {
        return services.stream().filter(s -> s.name().text().equals(name)).findFirst();
    }

    @Override
    public SourcePosition position() {
        return new SourcePosition(path, 1, 1);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(imports);
        children.addAll(structs);
        children.addAll(enums);
        children.addAll(services);
        return children;
    }
}
