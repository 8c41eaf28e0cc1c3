package org.pxdforge.generator.frontend.decl;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pxdforge.test.utils.AstFixtures.*;

@Tag("unit")
class AssociatedTypesTest {

    @Test
    void of_followsDecorationsTemplateArgumentsAndFunctionPointers() {
        TranslationUnit unit = unit(
                struct("c:@S@Inner", "Inner"),
                struct("c:@S@Item", "Item"),
                struct("c:@S@Arg", "Arg"),
                struct("c:@S@Outer", "Outer",
                        field("inner", pointer(record("Inner", "c:@S@Inner"))),
                        field("items", record("std::vector<Item>", null, record("Item", "c:@S@Item"))),
                        field("cb", pointer(TypeDescriptor.functionProto(VOID, pointer(record("Arg", "c:@S@Arg"))))),
                        field("self", pointer(record("Outer", "c:@S@Outer")))));
        Declaration outer = Declarations.specialize(unit.root().children().get(3), unit);

        AssociatedTypes associated = AssociatedTypes.of(outer);

        assertThat(associated.declarations()).extracting(Declaration::address)
                .containsExactlyInAnyOrder("Inner", "Item", "Arg");
        assertThat(associated.undeclaredNames()).containsExactly("std::vector");
    }

    @Test
    void of_includesTypesOfNestedAnonymousMembersOnce() {
        TranslationUnit unit = unit(
                struct("c:@S@Leaf", "Leaf"),
                struct("c:@S@Tree", "Tree",
                        anonymousStruct("c:anon", field("left", pointer(record("Leaf", "c:@S@Leaf")))),
                        field("branch", record("struct (anonymous)", "c:anon")),
                        field("right", pointer(record("Leaf", "c:@S@Leaf")))));
        Declaration tree = Declarations.specialize(unit.root().children().get(1), unit);

        assertThat(tree.associatedTypes()).extracting(Declaration::key)
                .containsExactlyInAnyOrder("Leaf", "anon:c:anon");
    }

    @Test
    void of_survivesDeeplyNestedTemplateArguments() {
        TypeDescriptor nested = INT;
        for (int i = 0; i < 5_000; i++) {
            nested = record("Box<...>", null, nested);
        }
        TranslationUnit unit = unit(variable("deep", nested));
        Declaration deep = Declarations.specialize(unit.root().children().get(0), unit);

        assertThat(AssociatedTypes.of(deep).undeclaredNames()).containsExactly("Box");
    }
}
