package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.DuplicateFieldIdException;
import com.idl.compiler.compile.exception.IllegalDefaultValueException;
import com.idl.compiler.compile.exception.IllegalRequirednessException;
import com.idl.compiler.compile.exception.WrappedCompileException;
import com.idl.compiler.model.StructDefinition;
import com.idl.compiler.model.StructKind;
import com.idl.compiler.parser.IdlParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Compiling structs, unions and exceptions through the shared field-group builder.
 */
class StructCompileTest {

    @Test
    void testExplicitIdsAreKept() {
        StructSpec spec = compileStruct("""
            struct User {
                1: required string name
                7: optional i64 createdAt
            }
            """);

        assertThat(spec.getKind()).isEqualTo(StructKind.STRUCT);
        assertThat(spec.getFields().getFields()).extracting(FieldSpec::getId).containsExactly(1, 7);
        assertThat(spec.getFields().get("name").orElseThrow().isRequired()).isTrue();
        assertThat(spec.getFields().get("createdAt").orElseThrow().isRequired()).isFalse();
        assertThat(spec.getFields().findById(7).orElseThrow().getName()).isEqualTo("createdAt");
    }

    @Test
    void testImplicitIdsCountDownInDeclarationOrder() {
        StructSpec spec = compileStruct("""
            struct Legacy {
                string first
                2: string second
                string third
            }
            """);

        assertThat(spec.getFields().getFields()).extracting(FieldSpec::getName)
                .containsExactly("first", "second", "third");
        assertThat(spec.getFields().getFields()).extracting(FieldSpec::getId)
                .containsExactly(-1, 2, -2);
    }

    @Test
    void testImplicitIdCollidesWithExplicitNegativeId() {
        assertThatThrownBy(() -> compileStruct("""
            struct Legacy {
                -1: string first
                string second
            }
            """))
                .isInstanceOf(WrappedCompileException.class)
                .hasMessage("cannot compile \"Legacy\": field \"second\" on line 3 has the ID -1"
                        + " already used by \"first\" on line 2");
    }

    @Test
    void testDuplicateExplicitIdIsRejected() {
        assertThatThrownBy(() -> compileStruct("""
            struct User {
                1: string name
                1: string email
            }
            """))
                .satisfies(e -> {
                    DuplicateFieldIdException cause =
                            (DuplicateFieldIdException) ((WrappedCompileException) e).getRootCause();
                    assertThat(cause.getMessage()).contains("field \"email\"", "the ID 1", "\"name\"");
                });
    }

    @Test
    void testDuplicateFieldNameIsRejected() {
        assertThatThrownBy(() -> compileStruct("""
            struct User {
                1: string name
                2: i32 name
            }
            """))
                .hasMessage("cannot compile \"User\": the name \"name\" has already been used on line 2");
    }

    @Test
    void testStructFieldsMayHaveDefaults() {
        StructSpec spec = compileStruct("""
            struct Page {
                1: i32 size = 20
            }
            """);

        assertThat(spec.getFields().get("size").orElseThrow().getDefaultValue()).isNotNull();
    }

    @Test
    void testUnionRejectsDefaultValues() {
        assertThatThrownBy(() -> compileStruct("""
            union Value {
                1: string text = "x"
                2: i64 number
            }
            """))
                .satisfies(e -> assertThat(((WrappedCompileException) e).getRootCause())
                        .isInstanceOf(IllegalDefaultValueException.class))
                .hasMessageContaining("field \"text\" on line 2 cannot have a default value");
    }

    @Test
    void testUnionRejectsRequiredFields() {
        assertThatThrownBy(() -> compileStruct("""
            union Value {
                1: required string text
            }
            """))
                .satisfies(e -> assertThat(((WrappedCompileException) e).getRootCause())
                        .isInstanceOf(IllegalRequirednessException.class))
                .hasMessageContaining("field \"text\" on line 2 cannot be required");
    }

    @Test
    void testSelfReferenceLinksToSameInstance() {
        StructSpec node = compileStruct("""
            struct Node {
                1: string value
                2: optional Node next
                3: list<Node> children
            }
            """);

        node.link(Registry.builder().type(node).build());

        assertThat(node.isLinked()).isTrue();
        assertThat(node.getFields().get("next").orElseThrow().getType()).isSameAs(node);
        ListSpec children = (ListSpec) node.getFields().get("children").orElseThrow().getType();
        assertThat(children.getValueSpec()).isSameAs(node);
        assertThat(node.toString()).contains("Node");
    }

    @Test
    void testSelfReferencingStructsCompareStructurally() {
        String source = """
            struct Node {
                1: optional Node next
            }
            """;
        StructSpec first = compileStruct(source);
        first.link(Registry.builder().type(first).build());
        StructSpec second = compileStruct(source);
        second.link(Registry.builder().type(second).build());

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    void testExceptionKind() {
        StructSpec spec = compileStruct("""
            exception NotFound {
                1: string message
            }
            """);

        assertThat(spec.isException()).isTrue();
        assertThat(spec.isUnion()).isFalse();
    }

    private static StructSpec compileStruct(String source) {
        StructDefinition definition = (StructDefinition) IdlParser.parse(source, "struct.thrift")
                .getDefinitions().get(0);
        return new Compiler().compileStruct(definition);
    }
}
