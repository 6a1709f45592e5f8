package org.arfrpc.compiler.api;

import org.arfrpc.compiler.frontend.parser.ast.Declaration;
import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.types.UserTypeNode;
import org.arfrpc.compiler.frontend.semantics.Symbol;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The result of a successful compilation: the validated files grouped by package, and the
 * binding of every user type reference.
 */
public final class CompiledTree {

    private final String entryPath;
    private final Map<String, PackageTree> packages = new LinkedHashMap<>();
    private final SymbolTable symbolTable;

    /**
     * @param entryPath   The path of the entry file.
     * @param files       Every loaded file, dependencies first.
     * @param symbolTable The symbol table produced by the analysis.
     */
    public CompiledTree(String entryPath, List<FileNode> files, SymbolTable symbolTable) {
        this.entryPath = entryPath;
        this.symbolTable = symbolTable;
        for (FileNode file : files) {
            packages.computeIfAbsent(file.packageName(), PackageTree::new).add(file);
        }
    }

    public String entryPath() {
        return entryPath;
    }

    /**
     * @return Package name to package tree, in load order.
     */
    public Map<String, PackageTree> packages() {
        return Collections.unmodifiableMap(packages);
    }

    public Optional<PackageTree> getPackage(String name) {
        return Optional.ofNullable(packages.get(name));
    }

    /**
     * @param reference A type reference anywhere in the tree.
     * @return The fully qualified name of the struct or enum it denotes.
     */
    public Optional<String> resolvedFqn(UserTypeNode reference) {
        return symbolTable.resolutionOf(reference.id()).map(Symbol::fqn);
    }

    /**
     * @param reference A type reference anywhere in the tree.
     * @return The struct or enum declaration it denotes.
     */
    public Optional<Declaration> resolvedDeclaration(UserTypeNode reference) {
        return symbolTable.resolutionOf(reference.id()).map(Symbol::node);
    }

    /**
     * @param fqn A fully qualified name such as {@code org.example.Outer.Inner}.
     * @return The struct, enum or (first block of the) service with that name.
     */
    public Optional<Declaration> lookup(String fqn) {
        return symbolTable.lookup(fqn).map(Symbol::node);
    }
}
