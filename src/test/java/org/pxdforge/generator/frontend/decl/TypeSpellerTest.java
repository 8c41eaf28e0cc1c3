package org.pxdforge.generator.frontend.decl;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pxdforge.generator.backend.render.ScopeRenderContext;
import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;
import org.pxdforge.generator.frontend.semantics.ImportStatement;
import org.pxdforge.generator.frontend.semantics.ModuleLayout;
import org.pxdforge.generator.frontend.semantics.ReferenceSite;
import org.pxdforge.generator.frontend.semantics.TypeResolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pxdforge.test.utils.AstFixtures.*;

@Tag("unit")
class TypeSpellerTest {

    private TypeResolver resolver;
    private RenderContext context;
    private TranslationUnit unit;

    @BeforeEach
    void setUp() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        resolver = new TypeResolver(diagnostics);
        ReferenceSite site = new ReferenceSite("", "test", Set.of(HEADER), false, false, ModuleLayout.NAMESPACE);
        context = new ScopeRenderContext(resolver, site, diagnostics);
        unit = unit(
                anonymousStruct("c:anon", field("x", INT)),
                struct("c:@S@Point", "Point", field("x", INT)));
        resolver.registerDeclared("Point", "", "test", HEADER, true);
    }

    private String declare(TypeDescriptor type, String name) {
        return TypeSpeller.declare(type, name, context, unit);
    }

    @Test
    void declare_attachesPointersAndReferencesToTheBaseType() {
        assertThat(declare(pointer(INT), "ip")).isEqualTo("int* ip");
        assertThat(declare(pointer(pointer(CHAR)), "argv")).isEqualTo("char** argv");
        assertThat(declare(TypeDescriptor.lvalueReference(INT), "r")).isEqualTo("int& r");
        assertThat(declare(TypeDescriptor.rvalueReference(INT), "moved")).isEqualTo("int&& moved");
    }

    @Test
    void declare_suffixesArraysAndParenthesizesFunctionPointers() {
        assertThat(declare(TypeDescriptor.array(INT, 20), "data")).isEqualTo("int data[20]");
        assertThat(declare(TypeDescriptor.array(TypeDescriptor.array(INT, 3), 2), "grid")).isEqualTo("int grid[2][3]");
        assertThat(declare(pointer(TypeDescriptor.functionProto(VOID, INT)), "fptrfield"))
                .isEqualTo("void (*fptrfield)(int)");
        assertThat(declare(pointer(TypeDescriptor.array(INT, 4)), "rows")).isEqualTo("int (*rows)[4]");
    }

    @Test
    void declare_convertsBuiltinsAndConstQualifiers() {
        TypeDescriptor constChar = TypeDescriptor.builder(TypeKind.BUILTIN).spelling("char").constQualified(true).build();

        assertThat(declare(BOOL, "flag")).isEqualTo("bint flag");
        assertThat(declare(pointer(constChar), "name")).isEqualTo("const char* name");
        assertThat(declare(null, "nothing")).isEqualTo("void nothing");
        assertThat(TypeSpeller.spell(pointer(INT), context, unit)).isEqualTo("int*");
    }

    @Test
    void declare_resolvesDeclaredRecordsThroughTheResolver() {
        assertThat(declare(pointer(record("Point", "c:@S@Point")), "p")).isEqualTo("Point* p");
    }

    @Test
    void declare_aliasesStandardTemplatesAndRecordsTheImport() {
        TypeDescriptor vector = record("std::vector<int>", null, INT);

        assertThat(declare(vector, "values")).isEqualTo("std_vector[int] values");
        assertThat(resolver.drainImports())
                .containsExactly(new ImportStatement("libcpp.vector", "vector", "std_vector"));
    }

    @Test
    void declare_fallsBackForAnonymousTypesNobodyNamed() {
        TypeDescriptor anonymous = TypeDescriptor.builder(TypeKind.RECORD)
                .spelling("struct (anonymous)")
                .declarationId("c:anon")
                .sizeBytes(8)
                .build();

        assertThat(declare(pointer(anonymous), "opaque")).isEqualTo("void* opaque");
        assertThat(declare(anonymous, "blob")).isEqualTo("char blob[8]");
    }

    @Test
    void declare_keepsTemplateParameters() {
        assertThat(declare(TypeDescriptor.templateParameter("T"), "value")).isEqualTo("T value");
        assertThat(declare(pointer(TypeDescriptor.templateParameter("T")), "items")).isEqualTo("T* items");
    }
}
