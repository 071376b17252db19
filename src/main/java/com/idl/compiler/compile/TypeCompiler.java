package com.idl.compiler.compile;

import com.idl.compiler.model.BaseTypeNode;
import com.idl.compiler.model.ListTypeNode;
import com.idl.compiler.model.MapTypeNode;
import com.idl.compiler.model.SetTypeNode;
import com.idl.compiler.model.TypeNode;
import com.idl.compiler.model.TypeReferenceNode;

/**
 * Turns type nodes into type specs. References to other definitions stay
 * unresolved ({@link TypeReferenceSpec}) until linking.
 */
public class TypeCompiler {

    public TypeSpec compile(TypeNode node) {
        if (node instanceof BaseTypeNode base) {
            return BaseTypeSpec.of(base.getBaseType());
        }
        if (node instanceof MapTypeNode map) {
            return new MapSpec(compile(map.getKeyType()), compile(map.getValueType()));
        }
        if (node instanceof ListTypeNode list) {
            return new ListSpec(compile(list.getElementType()));
        }
        if (node instanceof SetTypeNode set) {
            return new SetSpec(compile(set.getElementType()));
        }
        if (node instanceof TypeReferenceNode reference) {
            return new TypeReferenceSpec(reference.getName(), reference.getSourceLine());
        }
        throw new IllegalArgumentException("Unsupported type node: " + node.getClass().getSimpleName());
    }
}
