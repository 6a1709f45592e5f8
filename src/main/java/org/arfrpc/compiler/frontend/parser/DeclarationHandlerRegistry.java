package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.frontend.parser.features.enums.EnumDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.features.imports.ImportDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.features.pkg.PackageDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.features.service.ServiceDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.features.struct.StructDeclarationHandler;
import org.arfrpc.compiler.frontend.parser.features.struct.UnionDeclarationHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for declaration handlers.
 * Maps declaration keywords (e.g., "struct", "service") to their handlers.
 */
public class DeclarationHandlerRegistry {

    private final Map<String, IDeclarationHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for a keyword.
     * @param keyword The keyword (e.g., "struct").
     * @param handler The handler for this keyword.
     */
    public void register(String keyword, IDeclarationHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a keyword.
     * @param keyword The keyword. Keywords are case sensitive.
     * @return The handler, or empty if no handler is registered for this keyword.
     */
    public Optional<IDeclarationHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Creates a registry with all built-in declaration handlers.
     * @return A new registry instance.
     */
    public static DeclarationHandlerRegistry initialize() {
        DeclarationHandlerRegistry registry = new DeclarationHandlerRegistry();
        registry.register(Keywords.PACKAGE, new PackageDeclarationHandler());
        registry.register(Keywords.IMPORT, new ImportDeclarationHandler());
        registry.register(Keywords.STRUCT, new StructDeclarationHandler());
        registry.register(Keywords.UNION, new UnionDeclarationHandler());
        registry.register(Keywords.ENUM, new EnumDeclarationHandler());
        registry.register(Keywords.SERVICE, new ServiceDeclarationHandler());
        return registry;
    }
}
