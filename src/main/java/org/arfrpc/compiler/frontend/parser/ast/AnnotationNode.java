package org.arfrpc.compiler.frontend.parser.ast;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An annotation such as {@code @deprecated} or {@code @since("1.2", 3)}.
 *
 * @param name      The annotation name token (without the {@code @}).
 * @param arguments The literal argument tokens (strings or numbers), in order.
 */
public record AnnotationNode(Token name, List<Token> arguments) implements AstNode, SourceLocatable {

    @Override
    public SourcePosition position() {
        return name.position();
    }

    /**
     * @return The decoded argument values: {@link String} or {@link Long}.
     */
    public List<Object> values() {
        return arguments.stream().map(Token::value).collect(Collectors.toList());
    }

    /**
     * Finds an annotation by name.
     *
     * @param annotations The annotations to search.
     * @param name        The annotation name.
     * @return The first matching annotation, or {@code null}.
     */
    public static AnnotationNode byName(List<AnnotationNode> annotations, String name) {
        for (AnnotationNode annotation : annotations) {
            if (annotation.name().text().equals(name)) {
                return annotation;
            }
        }
        return null;
    }
}
