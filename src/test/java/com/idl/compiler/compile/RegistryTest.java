package com.idl.compiler.compile;

import com.idl.compiler.model.ConstantLiteral;
import com.idl.compiler.model.StructKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RegistryTest {

    @Test
    void testEmptyScopeResolvesNothing() {
        Scope scope = Scope.empty();

        assertThat(scope.resolveType("User")).isEmpty();
        assertThat(scope.resolveService("KeyValue")).isEmpty();
        assertThat(scope.resolveConstant("LIMIT")).isEmpty();
        assertThat(scope.lookupInclude("shared")).isEmpty();
    }

    @Test
    void testLookupTablesAreSeparate() {
        StructSpec user = new StructSpec("User", StructKind.STRUCT, FieldGroup.empty());
        ServiceSpec service = new ServiceSpec("UserService", null, Map.of());
        ConstantSpec limit = new ConstantSpec("LIMIT", BaseTypeSpec.I32, new ConstantLiteral(10L, 1));

        Registry registry = Registry.builder().add(user).add(service).add(limit).build();

        assertThat(registry.lookupType("User")).containsSame(user);
        assertThat(registry.lookupService("UserService")).containsSame(service);
        assertThat(registry.lookupConstant("LIMIT")).containsSame(limit);
        assertThat(registry.lookupType("UserService")).isEmpty();
        assertThat(registry.lookupService("User")).isEmpty();
        assertThat(registry.getTypes()).containsExactly(user);
    }

    @Test
    void testDottedNameResolvesThroughInclude() {
        StructSpec address = new StructSpec("Address", StructKind.STRUCT, FieldGroup.empty());
        Registry shared = Registry.builder().type(address).build();
        Registry main = Registry.builder().include("shared", shared).build();

        assertThat(main.resolveType("shared.Address")).containsSame(address);
        assertThat(main.resolveType("Address")).isEmpty();
        assertThat(main.resolveType("other.Address")).isEmpty();
        assertThat(main.getIncludeNames()).containsExactly("shared");
    }

    @Test
    void testBuilderRejectsDuplicateNames() {
        StructSpec first = new StructSpec("User", StructKind.STRUCT, FieldGroup.empty());
        StructSpec second = new StructSpec("User", StructKind.EXCEPTION, FieldGroup.empty());

        assertThatThrownBy(() -> Registry.builder().type(first).type(second))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("\"User\" is already registered");
    }

    @Test
    void testBuilderRejectsNonTopLevelSpecs() {
        FunctionSpec function = new FunctionSpec("ping", FieldGroup.empty(), null);

        assertThatThrownBy(() -> Registry.builder().add(function))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
