package org.pxdforge.generator.frontend.semantics;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.diagnostics.Severity;
import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.Declarations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pxdforge.test.utils.AstFixtures.*;

@Tag("unit")
class TypeResolverTest {

    private DiagnosticsEngine diagnostics;
    private TypeResolver resolver;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        resolver = new TypeResolver(diagnostics);
    }

    private static ReferenceSite site(String namespace, String module, ModuleLayout layout, boolean importAll) {
        return new ReferenceSite(namespace, module, Set.of(HEADER), false, importAll, layout);
    }

    @Test
    void reference_namespacedTypeFromGlobalScope_importsOnceUnderFlattenedAlias() {
        resolver.registerDeclared("A::Name", "A", "A", HEADER, true);
        ReferenceSite site = site("", "test", ModuleLayout.NAMESPACE, false);

        assertThat(resolver.reference(site, "A::Name", null)).isEqualTo("A_Name");
        assertThat(resolver.reference(site, "A::Name", null)).isEqualTo("A_Name");

        assertThat(resolver.drainImports()).extracting(ImportStatement::toString)
                .containsExactly("from A cimport Name as A_Name");
        assertThat(resolver.drainImports()).isEmpty();
    }

    @Test
    void reference_nestedTypeImportsItsTopLevelSymbol() {
        resolver.registerDeclared("A::Outer::Inner", "A", "A", HEADER, true);

        String token = resolver.reference(site("", "test", ModuleLayout.NAMESPACE, false), "A::Outer::Inner", null);

        assertThat(token).isEqualTo("A_Outer.Inner");
        assertThat(resolver.drainImports()).extracting(ImportStatement::toString)
                .containsExactly("from A cimport Outer as A_Outer");
    }

    @Test
    void reference_globalTypeOfAnotherModule_importsUnaliased() {
        resolver.registerDeclared("Point", "", "geom", OTHER_HEADER, true);

        assertThat(resolver.reference(site("", "test", ModuleLayout.NAMESPACE, false), "Point", null)).isEqualTo("Point");
        assertThat(resolver.drainImports()).extracting(ImportStatement::toString)
                .containsExactly("from geom cimport Point");
    }

    @Test
    void reference_sameModuleUsesLocalPath() {
        resolver.registerDeclared("A::Outer::Inner", "A", "A", HEADER, true);

        assertThat(resolver.reference(site("A", "A", ModuleLayout.NAMESPACE, false), "A::Outer::Inner", null))
                .isEqualTo("Outer.Inner");
        assertThat(resolver.drainImports()).isEmpty();
    }

    @Test
    void reference_typeOfEnclosingNamespaceNeedsNoImport() {
        resolver.registerDeclared("A::Name", "A", "A", HEADER, true);

        assertThat(resolver.reference(site("A::B", "A.B", ModuleLayout.NAMESPACE, false), "A::Name", null))
                .isEqualTo("Name");
        assertThat(resolver.drainImports()).isEmpty();
        assertThat(diagnostics.count(Severity.WARNING)).isZero();
    }

    @Test
    void reference_sameNamespaceInSiblingHeader_warnsUnlessImportAll() {
        resolver.registerDeclared("ns::Name", "ns", "lib.a", "/work/include/lib/a.h", true);

        assertThat(resolver.reference(site("ns", "lib.b", ModuleLayout.HEADER, false), "ns::Name", null))
                .isEqualTo("Name");
        assertThat(resolver.drainImports()).isEmpty();
        assertThat(diagnostics.count(Severity.WARNING)).isEqualTo(1);

        assertThat(resolver.reference(site("ns", "lib.b", ModuleLayout.HEADER, true), "ns::Name", null))
                .isEqualTo("Name");
        assertThat(resolver.drainImports()).extracting(ImportStatement::toString)
                .containsExactly("from lib.a cimport Name");
    }

    @Test
    void reference_standardTypes() {
        ReferenceSite site = site("", "test", ModuleLayout.NAMESPACE, false);

        assertThat(resolver.reference(site, "int", null)).isEqualTo("int");
        assertThat(resolver.reference(site, "std::size_t", null)).isEqualTo("size_t");
        assertThat(resolver.reference(site, "std::vector", null)).isEqualTo("std_vector");
        assertThat(resolver.reference(site, "uint32_t", null)).isEqualTo("uint32_t");

        assertThat(resolver.drainImports()).extracting(ImportStatement::toString).containsExactly(
                "from libc.stdint cimport uint32_t",
                "from libcpp.vector cimport vector as std_vector");
        assertThat(resolver.drainUnresolved()).isEmpty();
    }

    @Test
    void reference_unknownTypeFallsBackToDottedRelativeName() {
        String token = resolver.reference(site("A", "A", ModuleLayout.NAMESPACE, false), "A::Missing::Part", null);

        assertThat(token).isEqualTo("Missing.Part");
        assertThat(resolver.drainUnresolved()).containsExactly("Missing.Part");
        assertThat(resolver.unknownTypes()).containsKey("A::Missing::Part");
        assertThat(resolver.warnUnresolved()).isEqualTo(1);
        assertThat(diagnostics.count(Severity.WARNING)).isEqualTo(1);
    }

    @Test
    void reference_restrictedSiteWritesForeignDeclarationsByName() {
        Cursor foreign = Cursor.builder(CursorKind.STRUCT_DECL, "Foreign").id("c:@S@Foreign").file(OTHER_HEADER).build();
        TranslationUnit unit = unit(namespace("ns", foreign));
        Declaration declaration = Declarations.specialize(foreign, unit);
        resolver.registerDeclared("ns::Foreign", "ns", "ns", OTHER_HEADER, true);
        ReferenceSite restricted = new ReferenceSite("", "test", Set.of(HEADER), true, false, ModuleLayout.NAMESPACE);

        assertThat(resolver.reference(restricted, "ns::Foreign", declaration)).isEqualTo("Foreign");
        assertThat(resolver.drainImports()).isEmpty();
    }

    @Test
    void processReference_resolvesRelativeToEnclosingNamespaces() {
        resolver.registerDeclared("A::Name", "A", "A", HEADER, true);

        assertThat(resolver.processReference("Name", "A::B::C")).isTrue();
        assertThat(resolver.processReference("std::string", "")).isTrue();
        assertThat(resolver.processReference("Later", "")).isFalse();
        assertThat(resolver.unknownTypes()).containsOnlyKeys("Later");

        resolver.registerDeclared("Later");

        assertThat(resolver.unknownTypes()).isEmpty();
        assertThat(resolver.warnUnresolved()).isZero();
    }

    @Test
    void registerDeclared_definitionReplacesForwardDeclarationOnly() {
        resolver.registerDeclared("Node", "", "fwd", OTHER_HEADER, false);
        resolver.registerDeclared("Node", "", "nodes", HEADER, true);
        resolver.registerDeclared("Node", "", "late", HEADER, true);

        assertThat(resolver.lookup("Node")).hasValueSatisfying(type -> {
            assertThat(type.modulePath()).isEqualTo("nodes");
            assertThat(type.definition()).isTrue();
        });
    }

    @Test
    void registerDeclared_firstForwardDeclarationWinsOverLaterForward() {
        resolver.registerDeclared("Handle", "", "first", HEADER, false);
        resolver.registerDeclared("Handle", "", "second", HEADER, false);

        assertThat(resolver.lookup("Handle").map(ResolvedType::modulePath)).hasValue("first");
    }
}
