package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.frontend.parser.ast.ImportNode;

/**
 * An import alias visible inside one file.
 *
 * @param alias       The explicit alias, or the imported package's last component.
 * @param target      The imported file.
 * @param packageName The package declared by the imported file.
 * @param node        The import declaration.
 */
public record ImportBinding(String alias, ModuleId target, String packageName, ImportNode node) {
}
