package org.arfrpc.compiler.frontend.module;

import org.arfrpc.compiler.frontend.semantics.ModuleId;

import java.util.List;
import java.util.Optional;

/**
 * The output of dependency scanning: every reachable file, dependencies first.
 * Import cycles are broken at the edge that closes them, so the order is a topological
 * order of the import graph minus those edges.
 *
 * @param entry            The entry file.
 * @param topologicalOrder Files sorted so that each appears after the files it imports.
 */
public record DependencyGraph(ModuleId entry, List<ModuleDescriptor> topologicalOrder) {

    public Optional<ModuleDescriptor> find(ModuleId id) {
        return topologicalOrder.stream().filter(m -> m.id().equals(id)).findFirst();
    }
}
