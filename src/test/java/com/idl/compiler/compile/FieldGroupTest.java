package com.idl.compiler.compile;

import com.idl.compiler.model.StructKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FieldGroupTest {

    @Test
    void testEmptyGroupsAreEqual() {
        assertThat(FieldGroup.empty()).isEqualTo(FieldGroup.empty());
        assertThat(FieldGroup.empty().hashCode()).isEqualTo(FieldGroup.empty().hashCode());
    }

    @Test
    void testGroupsWithEqualFieldsAreEqual() {
        FieldGroup first = FieldGroup.of(
                FieldSpec.builder().id(1).name("key").type(BaseTypeSpec.STRING).build(),
                FieldSpec.builder().id(2).name("value").type(BaseTypeSpec.BINARY).build());
        FieldGroup second = FieldGroup.of(
                FieldSpec.builder().id(1).name("key").type(BaseTypeSpec.STRING).build(),
                FieldSpec.builder().id(2).name("value").type(BaseTypeSpec.BINARY).build());

        assertThat(first).isNotSameAs(second);
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    void testGroupsWithDifferentIdsAreNotEqual() {
        FieldGroup first = FieldGroup.of(FieldSpec.builder().id(1).name("key").type(BaseTypeSpec.STRING).build());
        FieldGroup second = FieldGroup.of(FieldSpec.builder().id(2).name("key").type(BaseTypeSpec.STRING).build());

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void testStructsWithEqualGroupsAreEqual() {
        StructSpec first = new StructSpec("Empty", StructKind.STRUCT, FieldGroup.empty());
        StructSpec second = new StructSpec("Empty", StructKind.STRUCT, FieldGroup.empty());

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }
}
