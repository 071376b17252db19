package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.CyclicReferenceException;
import com.idl.compiler.compile.exception.UnresolvedReferenceException;
import com.idl.compiler.compile.exception.WrappedCompileException;
import com.idl.compiler.model.ConstantLiteral;
import com.idl.compiler.model.Definition;
import com.idl.compiler.parser.IdlParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Enums, typedefs and constants.
 */
class DefinitionCompileTest {

    private final Compiler compiler = new Compiler();

    @Test
    void testEnumValuesContinueFromPrevious() {
        EnumSpec spec = (EnumSpec) compile("enum Status { ACTIVE, INACTIVE = 5, DELETED }");

        assertThat(spec.getItems()).extracting(EnumItemSpec::getValue).containsExactly(0, 5, 6);
        assertThat(spec.findItem("DELETED")).contains(new EnumItemSpec("DELETED", 6));
        assertThat(spec.findItem("UNKNOWN")).isEmpty();
    }

    @Test
    void testEnumRejectsDuplicateItems() {
        assertThatThrownBy(() -> compile("""
            enum Status {
                ACTIVE
                ACTIVE
            }
            """))
                .isInstanceOf(WrappedCompileException.class)
                .hasMessage("cannot compile \"Status\": the name \"ACTIVE\" has already been used on line 2");
    }

    @Test
    void testEnumLinksWithoutScope() {
        EnumSpec spec = (EnumSpec) compile("enum Empty {}");

        assertThat(spec.link(Scope.empty())).isSameAs(spec);
        assertThat(spec.getState()).isEqualTo(SpecState.LINKED);
    }

    @Test
    void testTypedefResolvesTarget() {
        TypedefSpec typedef = (TypedefSpec) compile("typedef UserId Owner");
        TypedefSpec userId = (TypedefSpec) compile("typedef i64 UserId");

        assertThat(typedef.getTarget()).isInstanceOf(TypeReferenceSpec.class);

        typedef.link(Registry.builder().type(userId).build());

        assertThat(typedef.getTarget()).isSameAs(userId);
        assertThat(userId.getTarget()).isEqualTo(BaseTypeSpec.I64);
        assertThat(userId.isLinked()).isTrue();
    }

    @Test
    void testTypedefToUnknownTypeFailsLink() {
        TypedefSpec typedef = (TypedefSpec) compile("typedef Missing Alias");

        assertThatThrownBy(() -> typedef.link(Scope.empty()))
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessage("Missing is not defined on line 1");
    }

    @Test
    void testTypedefCycleIsRejected() {
        TypedefSpec a = (TypedefSpec) compile("typedef B A");
        TypedefSpec b = (TypedefSpec) compile("typedef A B");
        Scope scope = Registry.builder().type(a).type(b).build();

        assertThatThrownBy(() -> a.link(scope))
                .isInstanceOf(CyclicReferenceException.class)
                .hasMessage("\"A\" refers back to itself: A -> B -> A");
        assertThat(a.getState()).isEqualTo(SpecState.FAILED);
        assertThat(b.getState()).isNotEqualTo(SpecState.LINKED);
        assertThat(a.getTarget()).isInstanceOf(TypeReferenceSpec.class);
    }

    @Test
    void testTypedefChainThroughStructIsNotACycle() {
        TypedefSpec a = (TypedefSpec) compile("typedef S A");
        StructSpec s = (StructSpec) compile("struct S { 1: B b }");
        TypedefSpec b = (TypedefSpec) compile("typedef A B");
        Scope scope = Registry.builder().type(a).type(s).type(b).build();

        a.link(scope);

        assertThat(List.of(a, s, b)).allMatch(spec -> spec.getState() == SpecState.LINKED);
        assertThat(b.getTarget()).isSameAs(a);
    }

    @Test
    void testConstantKeepsRawValue() {
        ConstantSpec constant = (ConstantSpec) compile("const i8 LIMIT = 42");

        constant.link(Scope.empty());

        assertThat(constant.getType()).isEqualTo(BaseTypeSpec.BYTE);
        assertThat(constant.getValue()).isInstanceOf(ConstantLiteral.class);
        assertThat(((ConstantLiteral) constant.getValue()).getValue()).isEqualTo(42L);
    }

    @Test
    void testConstantTypeIsLinked() {
        ConstantSpec constant = (ConstantSpec) compile("const Status DEFAULT_STATUS = Status.ACTIVE");
        EnumSpec status = (EnumSpec) compile("enum Status { ACTIVE }");

        constant.link(Registry.builder().type(status).build());

        assertThat(constant.getType()).isSameAs(status);
    }

    private Spec compile(String source) {
        Definition definition = IdlParser.parse(source, "defs.thrift").getDefinitions().get(0);
        return compiler.compile(definition);
    }
}
