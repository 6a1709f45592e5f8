package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.lexer.Lexer;
import org.arfrpc.compiler.frontend.parser.ast.AnnotationNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeIdAllocator;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.parser.ast.UnionFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.types.ArrayTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.MapTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.OptionalTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveType;
import org.arfrpc.compiler.frontend.parser.ast.types.PrimitiveTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.QualifiedUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.SimpleUserTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the parser on valid declarations and on its error recovery.
 */
@Tag("unit")
class ParserTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private FileNode parse(String source) {
        Lexer lexer = new Lexer(source, "test.arf", diagnostics);
        return new Parser(lexer.scanTokens(), "test.arf", diagnostics, new NodeIdAllocator()).parse();
    }

    @Test
    void parsesPackageAndImports() {
        FileNode file = parse("package org.example.arf;\nimport \"other\";\nimport \"sub/pkg\" as sub;\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(file.packageName()).isEqualTo("org.example.arf");
        assertThat(file.packageDecl().lastComponent()).isEqualTo("arf");
        assertThat(file.imports()).extracting(ImportNode::pathValue).containsExactly("other", "sub/pkg");
        assertThat(file.imports().get(0).explicitAlias()).isEmpty();
        assertThat(file.imports().get(1).explicitAlias()).hasValueSatisfying(t -> assertThat(t.text()).isEqualTo("sub"));
    }

    @Test
    @DisplayName("Fields keep their names, indices and source order")
    void parsesStructFieldsInOrder() {
        FileNode file = parse("package p;\nstruct User {\n  id uint64 = 0;\n  name string = 1;\n  tags array<string> = 2;\n}\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        StructNode user = file.findStruct("User").orElseThrow();
        assertThat(user.plainFields()).extracting(f -> f.name().text()).containsExactly("id", "name", "tags");
        assertThat(user.plainFields()).extracting(PlainFieldNode::index).containsExactly(0, 1, 2);
        assertThat(user.plainFields().get(0).type()).isInstanceOf(PrimitiveTypeNode.class);
        assertThat(((PrimitiveTypeNode) user.plainFields().get(0).type()).primitive()).isEqualTo(PrimitiveType.UINT64);
        assertThat(user.plainFields().get(2).type()).isInstanceOf(ArrayTypeNode.class);
        assertThat(user.parentId()).isNull();
    }

    @Test
    void parsesGenericAndUserTypes() {
        FileNode file = parse("package p;\nstruct S {\n"
                + "  m map<string, optional<Other>> = 0;\n"
                + "  q other.pkg.Thing = 1;\n"
                + "}\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        StructNode s = file.structs().get(0);
        MapTypeNode map = (MapTypeNode) s.plainFields().get(0).type();
        assertThat(map.key()).isInstanceOf(PrimitiveTypeNode.class);
        OptionalTypeNode optional = (OptionalTypeNode) map.value();
        assertThat(optional.inner()).isInstanceOf(SimpleUserTypeNode.class);
        assertThat(map.describe()).isEqualTo("map<string, optional<Other>>");

        QualifiedUserTypeNode qualified = (QualifiedUserTypeNode) s.plainFields().get(1).type();
        assertThat(qualified.components()).containsExactly("other", "pkg", "Thing");
        assertThat(qualified.name()).isEqualTo("other.pkg.Thing");
    }

    @Test
    void nestedDeclarationsPointAtTheirParent() {
        FileNode file = parse("package p;\nstruct Outer {\n"
                + "  struct Inner { a int32 = 0; }\n"
                + "  enum Kind { A = 0; }\n"
                + "  union choice { x int32 = 1; y string = 2; }\n"
                + "}\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        StructNode outer = file.structs().get(0);
        StructNode inner = outer.findStruct("Inner").orElseThrow();
        EnumNode kind = outer.findEnum("Kind").orElseThrow();
        assertThat(inner.parentId()).isEqualTo(outer.id());
        assertThat(kind.parentId()).isEqualTo(outer.id());

        assertThat(outer.fields()).hasSize(1);
        UnionFieldNode union = (UnionFieldNode) outer.fields().get(0);
        assertThat(union.name().text()).isEqualTo("choice");
        assertThat(union.members()).extracting(f -> f.name().text()).containsExactly("x", "y");
        assertThat(outer.plainFields()).extracting(PlainFieldNode::index).containsExactly(1, 2);
    }

    @Test
    void parsesEnumsWithAliasedValues() {
        FileNode file = parse("package p;\nenum Status {\n  OK = 0;\n  SUCCESS = 0;\n  FAILED = 0x2;\n}\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        EnumNode status = file.enums().get(0);
        assertThat(status.options()).extracting(o -> o.name().text()).containsExactly("OK", "SUCCESS", "FAILED");
        assertThat(status.options()).extracting(o -> o.value()).containsExactly(0, 0, 2);
    }

    @Test
    void parsesMethodSignatures() {
        FileNode file = parse("package p;\nservice Api {\n"
                + "  Get(req Request) -> Response;\n"
                + "  Upload(Header, stream Chunk) -> (Summary);\n"
                + "  Watch(req Request) -> (head Header, stream Event);\n"
                + "  Ping();\n"
                + "}\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        ServiceNode api = file.findService("Api").orElseThrow();
        assertThat(api.methods()).extracting(m -> m.name().text()).containsExactly("Get", "Upload", "Watch", "Ping");

        MethodNode get = api.methods().get(0);
        assertThat(get.params()).hasSize(1);
        assertThat(get.params().get(0).named()).isTrue();
        assertThat(get.params().get(0).name().text()).isEqualTo("req");
        assertThat(get.returns()).hasSize(1);
        assertThat(get.returns().get(0).named()).isFalse();
        assertThat(get.parentId()).isEqualTo(api.id());

        MethodNode upload = api.methods().get(1);
        assertThat(upload.params().get(0).named()).isFalse();
        assertThat(upload.params().get(1).stream()).isTrue();
        assertThat(((StreamingTypeNode) upload.params().get(1).type()).inner().describe()).isEqualTo("Chunk");

        MethodNode watch = api.methods().get(2);
        assertThat(watch.returns().get(0).name().text()).isEqualTo("head");
        assertThat(watch.returns().get(1).stream()).isTrue();

        assertThat(api.methods().get(3).params()).isEmpty();
        assertThat(api.methods().get(3).returns()).isEmpty();
    }

    @Test
    void reopenedServiceInOneFileIsMerged() {
        FileNode file = parse("package p;\nservice X { A(S); }\nstruct S {}\nservice X { B(S); }\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(file.services()).hasSize(1);
        ServiceNode x = file.services().get(0);
        assertThat(x.methods()).extracting(m -> m.name().text()).containsExactly("A", "B");
        assertThat(x.blocks()).extracting(p -> p.line()).containsExactly(2, 4);
        assertThat(x.methods().get(1).parentId()).isEqualTo(x.id());
    }

    @Test
    void attachesDocumentationAndAnnotations() {
        FileNode file = parse("package p;\n"
                + "# A user of the system.\n"
                + "# Second line.\n"
                + "@deprecated(\"use Person\", 2)\n"
                + "struct User {\n"
                + "  # The id.\n"
                + "  id int64 = 0; # trailing\n"
                + "\n"
                + "  name string = 1;\n"
                + "}\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        StructNode user = file.structs().get(0);
        assertThat(user.annotations()).hasSize(1);
        AnnotationNode deprecated = AnnotationNode.byName(user.annotations(), "deprecated");
        assertThat(deprecated).isNotNull();
        assertThat(deprecated.values()).containsExactly("use Person", 2L);
        assertThat(user.plainFields().get(0).documentation()).containsExactly("The id.");
        assertThat(user.plainFields().get(1).documentation()).isEmpty();
    }

    @Test
    void documentationRequiresAdjacentComments() {
        FileNode file = parse("package p;\n# Detached.\n\nstruct A {}\n# Attached.\nstruct B {}\n");

        assertThat(file.findStruct("A").orElseThrow().documentation()).isEmpty();
        assertThat(file.findStruct("B").orElseThrow().documentation()).containsExactly("Attached.");
    }

    @Test
    void missingPackageIsReported() {
        parse("struct S {}");

        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message)
                .contains("Expected 'package' declaration at the start of the file");
    }

    @Test
    void lateImportIsReported() {
        FileNode file = parse("package p;\nstruct S {}\nimport \"other\";\n");

        assertThat(file.imports()).isEmpty();
        assertThat(diagnostics.summary()).contains("test.arf:3:1: Imports must appear before any struct, enum or service declaration");
    }

    @Test
    void serviceInsideStructIsRejectedButParsed() {
        FileNode file = parse("package p;\nstruct S {\n  service X { M(S); }\n  a int32 = 0;\n}\n");

        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("'service' is not allowed inside struct 'S'");
        assertThat(file.structs().get(0).plainFields()).hasSize(1);
        assertThat(file.services()).isEmpty();
    }

    @Test
    void nestedDeclarationsInsideEnumAreRejected() {
        FileNode file = parse("package p;\nenum E {\n  A = 0;\n  struct N {}\n  B = 1;\n}\n");

        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("'struct' is not allowed inside enum 'E'");
        assertThat(file.enums().get(0).options()).hasSize(2);
    }

    @Test
    @DisplayName("Recovery collects several independent errors from one file")
    void recoversAfterErrors() {
        FileNode file = parse("package p;\nstruct S {\n"
                + "  a int32 = x;\n"
                + "  b = 1;\n"
                + "  c string = 2;\n"
                + "}\n"
                + "struct T {}\n");

        assertThat(diagnostics.getDiagnostics()).hasSize(2);
        assertThat(diagnostics.getDiagnostics()).allMatch(d -> d.kind() == Diagnostic.Kind.PARSE);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::line).containsExactly(3, 4);
        assertThat(file.findStruct("S").orElseThrow().plainFields()).extracting(f -> f.name().text()).containsExactly("c");
        assertThat(file.findStruct("T")).isPresent();
    }

    @Test
    void reservedFieldNameIsRejected() {
        parse("package p;\nstruct S { string string = 0; }\n");

        assertThat(diagnostics.summary()).contains("'string' is a reserved word and cannot be used as a field name");
    }

    @Test
    void streamOutsideSignatureIsRejected() {
        parse("package p;\nstruct S { a map<stream S, int32> = 0; }\n");

        assertThat(diagnostics.summary()).contains("'stream' can only prefix a method parameter or return type");
    }

    @Test
    void indexMustFitInThirtyTwoBits() {
        parse("package p;\nstruct S { a int32 = 4294967296; }\n");

        assertThat(diagnostics.summary()).contains("does not fit in a 32-bit signed integer");
    }

    @Test
    void invalidPackageComponentIsReported() {
        parse("package org.Example;\n");

        assertThat(diagnostics.summary()).contains("Package name component 'Example' must be snake_case");
    }

    @Test
    void strayClosingBraceIsReported() {
        FileNode file = parse("package p;\n}\nstruct S {}\n");

        assertThat(diagnostics.summary()).contains("test.arf:2:1: Unexpected '}'");
        assertThat(file.structs()).hasSize(1);
    }
}
