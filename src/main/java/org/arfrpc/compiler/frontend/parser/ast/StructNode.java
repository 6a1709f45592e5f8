package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@code struct Name { ... }} declaration. Nested structs and enums are owned by the
 * struct; their {@link Declaration#parentId()} points back at it.
 *
 * @param id            The struct identity.
 * @param parentId      The enclosing struct, or {@code null} at file level.
 * @param name          The name token.
 * @param fields        Plain and union fields, in source order.
 * @param structs       Nested structs.
 * @param enums         Nested enums.
 * @param annotations   Annotations preceding the struct.
 * @param documentation Comment lines preceding the struct.
 */
public record StructNode(
        NodeId id,
        NodeId parentId,
        Token name,
        List<FieldNode> fields,
        List<StructNode> structs,
        List<EnumNode> enums,
        List<AnnotationNode> annotations,
        List<String> documentation
) implements Declaration {

    /**
     * Returns every plain field, including union members, in source order.
     */
    public List<PlainFieldNode> plainFields() {
        List<PlainFieldNode> result = new ArrayList<>();
        for (FieldNode field : fields) {
            if (field instanceof PlainFieldNode plain) {
                result.add(plain);
            } else if (field instanceof UnionFieldNode union) {
                result.addAll(union.members());
            }
        }
        return result;
    }

    public Optional<StructNode> findStruct(String structName) {
        return structs.stream().filter(s -> s.name().text().equals(structName)).findFirst();
    }

    public Optional<EnumNode> findEnum(String enumName) {
        return enums.stream().filter(e -> e.name().text().equals(enumName)).findFirst();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(fields);
        children.addAll(structs);
        children.addAll(enums);
        return children;
    }
}
