package org.pxdforge.generator;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pxdforge.generator.api.OutputUnit;
import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.UpstreamDiagnostic;
import org.pxdforge.generator.frontend.semantics.TypeResolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pxdforge.test.utils.AstFixtures.*;

/**
 * End-to-end tests from in-memory syntax trees to module text.
 */
@Tag("unit")
class PxdGeneratorTest {

    private static final String LIB_A = "/work/include/lib/a.h";
    private static final String LIB_B = "/work/include/lib/b.h";

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private PxdGenerator generator(GeneratorOptions options) {
        return new PxdGenerator(options, diagnostics, new TypeResolver(diagnostics));
    }

    private static String textOf(List<OutputUnit> units, String module) {
        return units.stream()
                .filter(u -> u.modulePath().equals(module))
                .map(OutputUnit::text)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no module " + module));
    }

    @Test
    void generate_defaultArgumentsExpandIntoOverloads() {
        TranslationUnit unit = unit(function("f", VOID,
                param("a", INT), defaultedParam("b", INT), defaultedParam("c", INT)));

        List<OutputUnit> units = generator(GeneratorOptions.defaults()).generate(unit);

        assertThat(units).extracting(OutputUnit::modulePath).containsExactly("test");
        assertThat(units.get(0).text()).isEqualTo("""
                cdef extern from "test.h":
                    void f(int a)
                    void f(int a, int b)
                    void f(int a, int b, int c)
                """);
    }

    @Test
    void generate_namespacedTypeIsImportedIntoTheGlobalModule() {
        TranslationUnit unit = unit(
                namespace("A", struct("c:@N@A@S@Name", "Name", field("x", INT))),
                function("use", VOID, param("n", pointer(record("A::Name", "c:@N@A@S@Name")))));

        List<OutputUnit> units = generator(GeneratorOptions.defaults()).generate(unit);

        assertThat(units).extracting(OutputUnit::modulePath).containsExactly("test", "A");
        assertThat(textOf(units, "test")).isEqualTo("""
                from A cimport Name as A_Name

                cdef extern from "test.h":
                    void use(A_Name* n)
                """);
        assertThat(textOf(units, "A")).isEqualTo("""
                cdef extern from "test.h" namespace "A":
                    struct Name:
                        int x
                """);
    }

    @Test
    void generate_typeOfEnclosingNamespaceNeedsNoImport() {
        TranslationUnit unit = unit(namespace("A",
                struct("c:@N@A@S@Name", "Name"),
                namespace("B", function("use", VOID, param("n", pointer(record("A::Name", "c:@N@A@S@Name")))))));

        List<OutputUnit> units = generator(GeneratorOptions.defaults()).generate(unit);

        assertThat(units).extracting(OutputUnit::modulePath).containsExactly("A", "A.B");
        assertThat(textOf(units, "A.B")).isEqualTo("""
                cdef extern from "test.h" namespace "A::B":
                    void use(Name* n)
                """);
    }

    @Test
    void generate_scopesWithoutDeclarationsAreNotEmitted() {
        TranslationUnit unit = unit(
                namespace("empty", macro("GUARD", "GUARD")),
                variable("counter", INT));

        List<OutputUnit> units = generator(GeneratorOptions.defaults()).generate(unit);

        assertThat(units).extracting(OutputUnit::modulePath).containsExactly("test");
    }

    @Test
    void generate_headersGlobAddsMatchingIncludes() {
        Cursor included = Cursor.builder(CursorKind.FUNCTION_DECL, "helper").file(OTHER_HEADER).resultType(VOID).build();
        TranslationUnit unit = unit(function("main_api", VOID), included);

        String plain = generator(GeneratorOptions.defaults()).generate(unit).get(0).text();
        String globbed = generator(GeneratorOptions.builder().headersGlob("other.h").build()).generate(unit).get(0).text();

        assertThat(plain).doesNotContain("helper");
        assertThat(globbed).contains("    void main_api()", "    void helper()");
    }

    @Test
    void generate_strictModeAbortsOnUpstreamErrors() {
        TranslationUnit unit = TranslationUnit.of(HEADER, List.of(function("f", VOID)),
                List.of(new UpstreamDiagnostic(3, "expected ';'", HEADER, 4)));

        assertThatThrownBy(() -> generator(GeneratorOptions.builder().strict(true).build()).generate(unit))
                .isInstanceOf(GenerationAbortedException.class)
                .hasMessageContaining("expected ';'")
                .satisfies(e -> assertThat(((GenerationAbortedException) e).getErrors()).hasSize(1));

        List<OutputUnit> lenient = generator(GeneratorOptions.defaults()).generate(unit);
        assertThat(lenient).hasSize(1);
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void generate_macrosAreDeclaredWithTheDefinesFlag() {
        TranslationUnit unit = unit(macro("SIZE", "SIZE", "4"), function("f", VOID));

        String text = generator(GeneratorOptions.builder().defines(true).build()).generate(unit).get(0).text();

        assertThat(text).contains("    const long SIZE");
    }

    @Test
    void generateAll_importsTypesOfSiblingHeaders() {
        Cursor point = Cursor.builder(CursorKind.STRUCT_DECL, "Point").id("c:@S@Point").file(LIB_A)
                .child(field("x", INT)).build();
        TranslationUnit a = unit(LIB_A, point);
        Cursor includedPoint = Cursor.builder(CursorKind.STRUCT_DECL, "Point").id("c:@S@Point").file(LIB_A)
                .child(field("x", INT)).build();
        TranslationUnit b = unit(LIB_B, includedPoint,
                function("move", VOID, param("p", pointer(record("Point", "c:@S@Point")))));

        List<OutputUnit> units = generator(GeneratorOptions.builder().importAll(true).build())
                .generateAll(List.of(a, b), null);

        assertThat(units).extracting(OutputUnit::modulePath).containsExactly("lib.a", "lib.b");
        assertThat(textOf(units, "lib.a")).isEqualTo("""
                cdef extern from "lib/a.h":
                    struct Point:
                        int x
                """);
        assertThat(textOf(units, "lib.b")).isEqualTo("""
                from lib.a cimport Point

                cdef extern from "lib/b.h":
                    void move(Point* p)
                """);
    }

    @Test
    void generateAll_withoutImportAllStubsTypesOfSiblingHeaders() {
        Cursor point = Cursor.builder(CursorKind.STRUCT_DECL, "Point").id("c:@S@Point").file(LIB_A).build();
        TranslationUnit b = unit(LIB_B, point,
                function("move", VOID, param("p", pointer(record("Point", "c:@S@Point")))));

        List<OutputUnit> units = generator(GeneratorOptions.defaults()).generateAll(List.of(b), Path.of("/work/include"));

        assertThat(units).extracting(OutputUnit::modulePath).containsExactly("lib.b");
        assertThat(units.get(0).text()).isEqualTo("""
                cdef extern from "lib/b.h":
                    struct Point:
                        pass
                    void move(Point* p)
                """);
    }

    @Test
    void finish_countsTypesThatNeverResolved() {
        TypeDescriptor missing = TypeDescriptor.record("Missing", null);
        PxdGenerator generator = generator(GeneratorOptions.builder().autodefine(true).build());

        String text = generator.generate(unit(function("load", VOID, param("m", pointer(missing))))).get(0).text();

        assertThat(text).startsWith("cdef extern from *:\n    ctypedef struct Missing:\n        pass\n");
        assertThat(generator.finish()).isEqualTo(1);
    }

    @Test
    void relativeHeader_isTheBasenameWithoutBase() {
        assertThat(PxdGenerator.relativeHeader("/work/include/lib/a.h", null)).isEqualTo("a.h");
        assertThat(PxdGenerator.relativeHeader("/work/include/lib/a.h", Path.of("/work/include"))).isEqualTo("lib/a.h");
    }

    @Test
    void defaultIncludeBase_isTheParentOfTheCommonDirectory() {
        List<TranslationUnit> units = List.of(
                unit("/work/include/lib/a.h"),
                unit("/work/include/lib/sub/c.h"));

        assertThat(PxdGenerator.defaultIncludeBase(units)).isEqualTo(Path.of("/work/include"));
    }
}
