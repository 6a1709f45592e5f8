package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.semantics.ImportBinding;
import org.arfrpc.compiler.frontend.semantics.ModuleId;
import org.arfrpc.compiler.frontend.semantics.ModuleScope;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.arfrpc.compiler.model.Token;

/**
 * Registers the alias of each import in the importing file's scope. Without {@code as},
 * the alias is the last component of the imported file's package.
 */
public class ImportSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ImportNode importNode = (ImportNode) node;
        ModuleScope scope = symbolTable.getCurrentModuleScope();
        ModuleId target = scope.importTargets().get(importNode);
        if (target == null) {
            // loading failed and was reported
            return;
        }

        String packageName = symbolTable.getModuleScope(target).map(ModuleScope::packageName).orElse("");
        String alias = importNode.explicitAlias()
                .map(Token::text)
                .orElse(packageName.substring(packageName.lastIndexOf('.') + 1));
        if (alias.isEmpty()) {
            return;
        }

        ImportBinding previous = scope.aliases().get(alias);
        if (previous != null) {
            diagnostics.reportError(Diagnostic.Kind.IMPORT,
                    "Duplicate import alias '" + alias + "', already used by the import at "
                            + previous.node().position(),
                    importNode.position());
            return;
        }
        scope.aliases().put(alias, new ImportBinding(alias, target, packageName, importNode));
    }
}
