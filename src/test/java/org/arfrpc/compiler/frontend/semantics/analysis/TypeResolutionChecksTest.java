package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.api.CompilerPhase;
import org.arfrpc.compiler.config.CompilerOptions;
import org.arfrpc.compiler.config.CompilerOptions.CycleDetection;
import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.frontend.semantics.AnalysisFixture;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the type resolution phase: undefined references, map keys and RPC types.
 */
@Tag("unit")
class TypeResolutionChecksTest {

    @Test
    void reportsIllegalMapKeyAtMapPosition() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p; struct S{} struct T{ a map<optional<string>, S> = 0; }");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.rendered()).containsExactly("main.arf:1:35: Cannot use optional<string> as a map key");
        assertThat(fixture.diagnostics().getDiagnostics().get(0).kind()).isEqualTo(Diagnostic.Kind.RESOLUTION);
    }

    @ParameterizedTest
    @ValueSource(strings = {"array<string>", "map<string, string>", "bytes"})
    void rejectsNonScalarKeys(String key) {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct T { a map<" + key + ", int32> = 0; }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.messages()).containsExactly("Cannot use " + key + " as a map key");
    }

    @Test
    void acceptsPrimitiveEnumAndStructKeys() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\n"
                        + "enum E { A = 0; }\n"
                        + "struct K {}\n"
                        + "struct T {\n"
                        + "  a map<string, int32> = 0;\n"
                        + "  b map<int64, E> = 1;\n"
                        + "  c map<E, K> = 2;\n"
                        + "  d map<K, string> = 3;\n"
                        + "}\n");

        assertThat(fixture.analyze("main.arf")).isEmpty();
    }

    @Test
    void rejectsStructKeysWhenDisallowed() {
        AnalysisFixture fixture = new AnalysisFixture()
                .options(new CompilerOptions(".arf", CycleDetection.FULL, false))
                .file("main.arf", "package p;\nstruct K {}\nstruct T { d map<K, string> = 0; }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.messages()).containsExactly("Cannot use K as a map key");
    }

    @Test
    void undefinedMapValueIsReportedOnce() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p; enum E{A=1;} struct S{ m map<E,V> = 0; }");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.messages()).containsExactly("Undefined type V");
    }

    @Test
    void undefinedMapKeyIsNotAlsoReportedAsIllegalKey() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct S { m map<Missing, string> = 0; }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.messages()).containsExactly("Undefined type Missing");
    }

    @Test
    void resolvesTypesInsideUnionMembers() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct S {\n  union choice {\n    a Missing = 0;\n  }\n}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.rendered()).containsExactly("main.arf:4:7: Undefined type Missing");
    }

    @Test
    void requiresStructsInMethodSignatures() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\n"
                        + "struct S {}\n"
                        + "enum E { A = 0; }\n"
                        + "service Api {\n"
                        + "  Prim(string) -> S;\n"
                        + "  Enum(E) -> S;\n"
                        + "  Arr(array<S>) -> S;\n"
                        + "  Ok(S) -> stream S;\n"
                        + "  Missing(Nope) -> S;\n"
                        + "}\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.messages()).containsExactly(
                "Types used within methods are required to be user-defined structures. Cannot use string",
                "Types used within methods are required to be user-defined structures. Cannot use E",
                "Types used within methods are required to be user-defined structures. Cannot use array<S>",
                "Undefined type Nope");
    }

    @Test
    void resolutionErrorsStopBeforeConsistencyChecks() {
        AnalysisFixture fixture = new AnalysisFixture().file("main.arf",
                "package p;\nstruct S { s S = 0; m Missing = 1; }\n");

        assertThat(fixture.analyze("main.arf")).contains(CompilerPhase.TYPE_RESOLUTION);
        assertThat(fixture.messages()).containsExactly("Undefined type Missing");
    }
}
