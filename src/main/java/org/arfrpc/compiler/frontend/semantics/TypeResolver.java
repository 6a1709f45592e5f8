package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.types.UserTypeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Binds user type references to the struct or enum they name.
 *
 * <p>A reference is looked up relative to the symbol table's current file and scope:</p>
 * <ol>
 *   <li>A first component naming an import alias is replaced by the imported package.</li>
 *   <li>A first component equal to the first component of the file's own package is tried
 *       as a fully qualified name.</li>
 *   <li>Otherwise the name is tried inside each enclosing struct, innermost first, then
 *       inside the file's package, then as a fully qualified name.</li>
 * </ol>
 * <p>Every package is visible; an import only introduces an alias.</p>
 */
public final class TypeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TypeResolver.class);

    private final SymbolTable symbolTable;

    public TypeResolver(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    /**
     * Resolves a reference and records the binding. A reference that is already bound is
     * returned as is.
     *
     * @param reference   The reference.
     * @param diagnostics Receives an error when the reference names nothing, a service or a package.
     * @return The struct or enum, or empty if resolution failed.
     */
    public Optional<Symbol> resolve(UserTypeNode reference, DiagnosticsEngine diagnostics) {
        Optional<Symbol> bound = symbolTable.resolutionOf(reference.id());
        if (bound.isPresent()) {
            return bound;
        }

        Optional<Symbol> found = lookup(reference);
        if (found.isEmpty()) {
            String rewritten = rewriteAlias(reference.components()).orElse(reference.name());
            String message = symbolTable.isPackage(rewritten)
                    ? "Cannot use package " + reference.name() + " as a type"
                    : "Undefined type " + reference.name();
            diagnostics.reportError(Diagnostic.Kind.RESOLUTION, message, reference.position());
            return Optional.empty();
        }

        Symbol target = found.get();
        if (!target.isType()) {
            diagnostics.reportError(Diagnostic.Kind.RESOLUTION,
                    "Cannot use service " + target.fqn() + " as a type", reference.position());
            return Optional.empty();
        }
        LOG.trace("{} at {} resolved to {}", reference.name(), reference.position(), target.fqn());
        symbolTable.bind(reference.id(), target);
        return Optional.of(target);
    }

    /**
     * Looks a reference up without binding it or reporting anything.
     *
     * @param reference The reference.
     * @return Whatever declaration the name denotes, services included.
     */
    public Optional<Symbol> lookup(UserTypeNode reference) {
        List<String> components = reference.components();
        String joined = reference.name();
        String first = components.get(0);

        if (Character.isLowerCase(first.charAt(0))) {
            Optional<String> rewritten = rewriteAlias(components);
            if (rewritten.isPresent()) {
                return symbolTable.lookup(rewritten.get());
            }
            ModuleScope module = symbolTable.getCurrentModuleScope();
            if (first.equals(module.firstPackageComponent())) {
                Optional<Symbol> qualified = symbolTable.lookup(joined);
                if (qualified.isPresent()) {
                    return qualified;
                }
            }
        }

        for (SymbolTable.Scope scope = symbolTable.getCurrentScope(); scope != null; scope = scope.parent()) {
            Symbol owner = scope.owner();
            if (owner == null || owner.type() != Symbol.Type.STRUCT) {
                continue;
            }
            Optional<Symbol> nested = symbolTable.lookup(owner.fqn() + "." + joined);
            if (nested.isPresent()) {
                return nested;
            }
        }

        String packageName = symbolTable.getCurrentModuleScope().packageName();
        if (!packageName.isEmpty()) {
            Optional<Symbol> local = symbolTable.lookup(packageName + "." + joined);
            if (local.isPresent()) {
                return local;
            }
        }
        return components.size() > 1 ? symbolTable.lookup(joined) : Optional.empty();
    }

    private Optional<String> rewriteAlias(List<String> components) {
        return symbolTable.getCurrentModuleScope().alias(components.get(0)).map(binding -> {
            List<String> rest = components.subList(1, components.size());
            return rest.isEmpty() ? binding.packageName() : binding.packageName() + "." + String.join(".", rest);
        });
    }
}
