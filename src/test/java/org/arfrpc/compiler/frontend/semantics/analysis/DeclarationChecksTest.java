package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.api.CompilerPhase;
import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.frontend.semantics.AnalysisFixture;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the local well-formedness checks of the declaration phase.
 */
@Tag("unit")
class DeclarationChecksTest {

    @Test
    void reportsDuplicateFieldNameAtSecondDeclaration() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct S {\n  f string = 0;\n  f string = 1;\n}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.rendered()).containsExactly(
                "main.arf:4:3: Duplicate field 'f' in struct S, first declared at main.arf:3:3");
        assertThat(fixture.diagnostics().getDiagnostics().get(0).kind()).isEqualTo(Diagnostic.Kind.SEMANTIC);
    }

    @Test
    void reportsDuplicateFieldIndex() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct S {\n  a int32 = 1;\n  b int32 = 1;\n}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.rendered()).containsExactly(
                "main.arf:4:3: Duplicate field index 1 in struct S: 'b' reuses the index of 'a' at main.arf:3:3");
    }

    @Test
    void unionMembersShareNamesAndIndicesWithFields() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\n"
                        + "struct S {\n"
                        + "  a int32 = 0;\n"
                        + "  union choice {\n"
                        + "    a string = 1;\n"
                        + "    b int32 = 0;\n"
                        + "  }\n"
                        + "}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly(
                "Duplicate field 'a' in struct S, first declared at main.arf:3:3",
                "Duplicate field index 0 in struct S: 'b' reuses the index of 'a' at main.arf:3:3");
    }

    @Test
    void reportsStructRedefinedInImportedFileOfSamePackage() {
        AnalysisFixture fixture = new AnalysisFixture()
                .file("a.arf", "package p;\nstruct S {}\n")
                .file("main.arf", "package p;\nimport \"a\";\nstruct S {}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.rendered()).containsExactly("main.arf:3:8: p.S is already defined at a.arf:2:8");
    }

    @Test
    void reportsServiceClashingWithStruct() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct X {}\nservice X {}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly("p.X is already defined at main.arf:2:8");
    }

    @Test
    void allowsServiceReopenedInAnotherFile() {
        AnalysisFixture fixture = new AnalysisFixture()
                .file("a.arf", "package p;\nstruct S {}\nservice X { M(i S); }\n")
                .file("main.arf", "package p;\nimport \"a\";\nservice X { M(i S); N(i S); }\n");

        assertThat(fixture.analyze("main.arf")).isEmpty();
        assertThat(fixture.symbolTable().getServiceDeclarations().get("p.X")).hasSize(2);
    }

    @Test
    void rejectsEmptyEnum() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf", "package p;\nenum E {}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly("Enum E must have at least one member");
    }

    @Test
    void reportsDuplicateOptionNameButAcceptsDuplicateValues() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nenum E {\n  A = 0;\n  A = 1;\n  B = 0;\n}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.rendered()).containsExactly(
                "main.arf:4:3: Duplicate option 'A' in enum E, first declared at main.arf:3:3");
    }

    @Test
    void enforcesNamingConventions() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\n"
                        + "struct foo { Bar int32 = 0; }\n"
                        + "enum color { red = 0; }\n"
                        + "service api { get_user(Req S); }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly(
                "Struct name 'foo' must be CamelCase",
                "Field name 'Bar' must be snake_case",
                "Enum name 'color' must be CamelCase",
                "Enum option name 'red' must be SCREAMING_SNAKE_CASE",
                "Service name 'api' must be CamelCase",
                "Method name 'get_user' must be camelCase or CamelCase",
                "Parameter name 'Req' must be snake_case");
    }

    @Test
    void acceptsLowerCamelCaseMethodNames() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct S {}\nservice Api { getUser(S) -> S; GetUser(S) -> S; }\n");

        assertThat(fixture.analyze("main.arf")).isEmpty();
    }

    @Test
    void rejectsReservedWordsAsDeclarationNames() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\n"
                        + "struct string {}\n"
                        + "struct S {\n"
                        + "  union map { a int32 = 0; }\n"
                        + "}\n"
                        + "service Api { map(bytes S); }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly(
                "'string' is a reserved word and cannot be used as a struct name",
                "'map' is a reserved word and cannot be used as a union name",
                "'map' is a reserved word and cannot be used as a method name",
                "'bytes' is a reserved word and cannot be used as a parameter name");
    }

    @Test
    void reportsDuplicateImportAlias() {
        AnalysisFixture fixture = new AnalysisFixture()
                .file("one/common.arf", "package x.common;\n")
                .file("two/common.arf", "package y.common;\n")
                .file("main.arf", "package app;\nimport \"one/common\";\nimport \"two/common\";\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.rendered()).containsExactly(
                "main.arf:3:1: Duplicate import alias 'common', already used by the import at main.arf:2:1");
        assertThat(fixture.diagnostics().getDiagnostics().get(0).kind()).isEqualTo(Diagnostic.Kind.IMPORT);
    }

    @Test
    void explicitAliasAvoidsImportClash() {
        AnalysisFixture fixture = new AnalysisFixture()
                .file("one/common.arf", "package x.common;\n")
                .file("two/common.arf", "package y.common;\n")
                .file("main.arf", "package app;\nimport \"one/common\";\nimport \"two/common\" as other;\n");

        assertThat(fixture.analyze("main.arf")).isEmpty();
    }

    @Test
    void checksMethodParameterAndReturnShape() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\n"
                        + "struct S {}\n"
                        + "service Api {\n"
                        + "  Mixed(a S, S);\n"
                        + "  TwoStreams(stream S, stream S);\n"
                        + "  StreamFirst(stream S, S);\n"
                        + "  Returns(S) -> (stream S, S);\n"
                        + "  Dupes(a S, a S);\n"
                        + "  NamedStream(a S, stream S) -> (r S, stream S);\n"
                        + "}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly(
                "Method Mixed must name either all of its parameters or none of them",
                "The stream parameter of method TwoStreams must be the last parameter",
                "Method TwoStreams can only have one stream parameter",
                "The stream parameter of method StreamFirst must be the last parameter",
                "The stream return value of method Returns must be the last return value",
                "Duplicate parameter name 'a' in method Dupes, first declared at main.arf:8:9");
    }

    @Test
    void declarationErrorsStopBeforeTypeResolution() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct s { x Missing = 0; }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.DECLARATIONS);
        assertThat(fixture.messages()).containsExactly("Struct name 's' must be CamelCase");
    }
}
