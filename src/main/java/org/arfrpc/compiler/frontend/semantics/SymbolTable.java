package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A module-aware symbol table for the whole program.
 *
 * <p>Declarations are indexed by fully qualified name across every file, and by node
 * identity. Each file gets a {@link ModuleScope} holding its import aliases. A scope stack
 * tracks the declaration being traversed so that nested names and relative type references
 * can be resolved against their enclosing struct.</p>
 *
 * <p>Type resolution results are kept in a side table from type reference id to target
 * symbol; the syntax tree is never modified.</p>
 */
public class SymbolTable {

    /**
     * Represents one level of declaration nesting during traversal.
     */
    public static class Scope {
        private final Scope parent;
        private final Symbol owner;

        Scope(Scope parent, Symbol owner) {
            this.parent = parent;
            this.owner = owner;
        }

        public Scope parent() {
            return parent;
        }

        /**
         * @return The declaration that opened this scope, or null for the file scope.
         */
        public Symbol owner() {
            return owner;
        }
    }

    private final Map<ModuleId, ModuleScope> modules = new LinkedHashMap<>();
    private ModuleId currentModuleId;

    private final Scope rootScope = new Scope(null, null);
    private Scope currentScope = rootScope;

    private final Map<String, Symbol> byFqn = new LinkedHashMap<>();
    private final Map<NodeId, Symbol> byId = new HashMap<>();
    private final Map<String, List<Symbol>> serviceDeclarations = new LinkedHashMap<>();
    private final Set<String> packages = new LinkedHashSet<>();
    private final Map<NodeId, Symbol> resolutions = new HashMap<>();

    // === Module management ===

    /**
     * Registers a file in the symbol table.
     * @param moduleId The file identity.
     * @param file     The parsed file.
     * @return The file's scope.
     */
    public ModuleScope registerModule(ModuleId moduleId, FileNode file) {
        packages.add(file.packageName());
        return modules.computeIfAbsent(moduleId, id -> new ModuleScope(id, file));
    }

    /**
     * Sets the current file. Resolution operations consult this file's aliases and package.
     * @param moduleId The file to set as current.
     */
    public void setCurrentModule(ModuleId moduleId) {
        if (!modules.containsKey(moduleId)) {
            throw new IllegalArgumentException("Unknown module " + moduleId);
        }
        this.currentModuleId = moduleId;
    }

    public ModuleId getCurrentModuleId() {
        return currentModuleId;
    }

    public ModuleScope getCurrentModuleScope() {
        return modules.get(currentModuleId);
    }

    public Optional<ModuleScope> getModuleScope(ModuleId moduleId) {
        return Optional.ofNullable(modules.get(moduleId));
    }

    /**
     * @param name A dotted name.
     * @return true if some file declares exactly this package.
     */
    public boolean isPackage(String name) {
        return packages.contains(name);
    }

    // === Scope management ===

    /**
     * Resets the current scope to the file scope.
     */
    public void resetScope() {
        this.currentScope = rootScope;
    }

    /**
     * Enters the scope of a declaration.
     * @param owner The declaration whose members are traversed next.
     * @return The new scope.
     */
    public Scope enterScope(Symbol owner) {
        currentScope = new Scope(currentScope, owner);
        return currentScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    /**
     * @return The innermost enclosing struct, or empty at file level and inside services.
     */
    public Optional<Symbol> currentStruct() {
        Symbol owner = currentScope.owner;
        if (owner != null && owner.type() == Symbol.Type.STRUCT) {
            return Optional.of(owner);
        }
        return Optional.empty();
    }

    // === Symbol definition and lookup ===

    /**
     * Defines a declaration. Several declarations of the same service are legal and are all
     * recorded; any other reuse of a fully qualified name is a clash.
     *
     * @param symbol The symbol to define.
     * @return The earlier declaration this one clashes with, or empty if it was accepted.
     */
    public Optional<Symbol> define(Symbol symbol) {
        byId.put(symbol.id(), symbol);
        Symbol existing = byFqn.get(symbol.fqn());
        if (existing == null) {
            byFqn.put(symbol.fqn(), symbol);
            if (symbol.type() == Symbol.Type.SERVICE) {
                serviceDeclarations.computeIfAbsent(symbol.fqn(), k -> new ArrayList<>()).add(symbol);
            }
            return Optional.empty();
        }
        if (existing.type() == Symbol.Type.SERVICE && symbol.type() == Symbol.Type.SERVICE) {
            serviceDeclarations.get(symbol.fqn()).add(symbol);
            return Optional.empty();
        }
        return Optional.of(existing);
    }

    /**
     * @param fqn A fully qualified name.
     * @return The first declaration with that name.
     */
    public Optional<Symbol> lookup(String fqn) {
        return Optional.ofNullable(byFqn.get(fqn));
    }

    /**
     * @param id A declaration identity.
     * @return The symbol created for that declaration, including clashing ones.
     */
    public Optional<Symbol> symbolOf(NodeId id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    /**
     * @return Every accepted declaration, in definition order.
     */
    public List<Symbol> getAllSymbols() {
        return List.copyOf(byFqn.values());
    }

    /**
     * @return Service FQN to every declaration block of that service, across files.
     */
    public Map<String, List<Symbol>> getServiceDeclarations() {
        return Collections.unmodifiableMap(serviceDeclarations);
    }

    // === Resolution side table ===

    /**
     * Records the target of a type reference.
     * @param reference The reference identity.
     * @param target    The struct or enum it denotes.
     */
    public void bind(NodeId reference, Symbol target) {
        resolutions.put(reference, target);
    }

    public Optional<Symbol> resolutionOf(NodeId reference) {
        return Optional.ofNullable(resolutions.get(reference));
    }
}
