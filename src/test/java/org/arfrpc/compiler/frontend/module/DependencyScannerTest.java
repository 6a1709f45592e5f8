package org.arfrpc.compiler.frontend.module;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.io.InMemorySourceLoader;
import org.arfrpc.compiler.frontend.io.SourceLoadException;
import org.arfrpc.compiler.frontend.io.SourceLoader;
import org.arfrpc.compiler.frontend.parser.ast.NodeIdAllocator;
import org.arfrpc.compiler.frontend.semantics.ModuleId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests the dependency scanner that loads the entry file and everything it imports.
 */
@Tag("unit")
class DependencyScannerTest {

    private DiagnosticsEngine diagnostics;
    private InMemorySourceLoader loader;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        loader = new InMemorySourceLoader(".arf");
    }

    private DependencyGraph scan(SourceLoader sourceLoader, String entry) throws SourceLoadException {
        return new DependencyScanner(sourceLoader, diagnostics, new NodeIdAllocator()).scan(sourceLoader.load(entry));
    }

    @Test
    void singleFileProducesSingleModuleGraph() throws Exception {
        loader.add("main.arf", "package p;\nstruct S {}\n");

        DependencyGraph graph = scan(loader, "main.arf");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(graph.entry()).isEqualTo(new ModuleId("main.arf"));
        assertThat(graph.topologicalOrder()).hasSize(1);
        assertThat(graph.topologicalOrder().get(0).packageName()).isEqualTo("p");
    }

    @Test
    void importsComeBeforeImporters() throws Exception {
        loader.add("main.arf", "package app;\nimport \"lib\";\n")
                .add("lib.arf", "package lib;\n");

        DependencyGraph graph = scan(loader, "main.arf");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(graph.topologicalOrder()).extracting(ModuleDescriptor::sourcePath)
                .containsExactly("lib.arf", "main.arf");
        ModuleDescriptor main = graph.find(new ModuleId("main.arf")).orElseThrow();
        assertThat(main.imports()).hasSize(1);
        assertThat(main.imports().get(0).resolvedId()).isEqualTo(new ModuleId("lib.arf"));
    }

    @Test
    void diamondImportLoadsSharedFileOnce() throws Exception {
        loader.add("main.arf", "package app;\nimport \"a\";\nimport \"b\";\n")
                .add("a.arf", "package a;\nimport \"common\";\n")
                .add("b.arf", "package b;\nimport \"common\";\n")
                .add("common.arf", "package common;\n");
        InMemorySourceLoader spied = spy(loader);

        DependencyGraph graph = scan(spied, "main.arf");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(graph.topologicalOrder()).extracting(ModuleDescriptor::sourcePath)
                .containsExactly("common.arf", "a.arf", "b.arf", "main.arf");
        verify(spied, times(1)).load("common.arf");
        assertThat(graph.find(new ModuleId("b.arf")).orElseThrow().imports()).hasSize(1);
    }

    @Test
    void importCycleTerminatesWithoutError() throws Exception {
        loader.add("a.arf", "package a;\nimport \"b\";\n")
                .add("b.arf", "package b;\nimport \"a\";\n");

        DependencyGraph graph = scan(loader, "a.arf");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(graph.topologicalOrder()).extracting(ModuleDescriptor::sourcePath)
                .containsExactly("b.arf", "a.arf");
        assertThat(graph.find(new ModuleId("b.arf")).orElseThrow().imports().get(0).resolvedId())
                .isEqualTo(new ModuleId("a.arf"));
    }

    @Test
    void missingImportIsReportedAtTheImport() throws Exception {
        loader.add("main.arf", "package app;\nimport \"missing\";\n");

        scan(loader, "main.arf");

        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.kind()).isEqualTo(Diagnostic.Kind.IMPORT);
        assertThat(error.render()).isEqualTo("main.arf:2:1: Cannot import \"missing\": file missing.arf does not exist");
    }

    @Test
    void directoryImportIsReported() throws Exception {
        loader.add("main.arf", "package app;\nimport \"dir.arf\";\n")
                .add("dir.arf/inner.arf", "package inner;\n");

        scan(loader, "main.arf");

        assertThat(diagnostics.summary()).isEqualTo("main.arf:2:1: Cannot import \"dir.arf\": dir.arf is a directory");
    }

    @Test
    void unreadableImportIsReported() throws Exception {
        loader.add("main.arf", "package app;\nimport \"lib\";\n")
                .add("lib.arf", "package lib;\n");
        InMemorySourceLoader spied = spy(loader);
        doThrow(SourceLoadException.unreadable("lib.arf", new IOException("Permission denied")))
                .when(spied).load("lib.arf");

        DependencyGraph graph = scan(spied, "main.arf");

        assertThat(diagnostics.summary())
                .isEqualTo("main.arf:2:1: Cannot import \"lib\": lib.arf could not be read (Permission denied)");
        assertThat(graph.topologicalOrder()).hasSize(1);
    }

    @Test
    void unrepresentableImportPathIsReportedAtTheImport() throws Exception {
        loader.add("main.arf", "package app;\nimport \"lib\";\nimport \"a\u0000b\";\n")
                .add("lib.arf", "package lib;\n");

        DependencyGraph graph = scan(loader, "main.arf");

        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.kind()).isEqualTo(Diagnostic.Kind.IMPORT);
        assertThat(error.line()).isEqualTo(3);
        assertThat(error.message()).startsWith("Cannot import \"a\u0000b\": ").contains("is not a valid path");
        assertThat(graph.topologicalOrder()).extracting(ModuleDescriptor::sourcePath).containsExactly("lib.arf", "main.arf");
    }

    @Test
    void syntaxErrorsInImportedFilesAreCollected() throws Exception {
        loader.add("main.arf", "package app;\nimport \"lib\";\nstruct S { a int32 = ; }\n")
                .add("lib.arf", "package lib;\nstruct T { $ }\n");

        scan(loader, "main.arf");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::fileName)
                .contains("lib.arf", "main.arf");
    }
}
