package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.DuplicateFieldIdException;
import com.idl.compiler.compile.exception.IllegalDefaultValueException;
import com.idl.compiler.compile.exception.IllegalRequirednessException;
import com.idl.compiler.model.FieldNode;
import com.idl.compiler.model.Requiredness;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds field groups for struct bodies, argument lists and throws lists.
 *
 * Every group gets the same checks: unique names, unique ids, and whatever
 * the {@link FieldOptions} forbid. Fields without an explicit id are numbered
 * -1, -2, ... in declaration order.
 */
public class FieldCompiler {

    private final TypeCompiler typeCompiler;

    public FieldCompiler(TypeCompiler typeCompiler) {
        this.typeCompiler = typeCompiler;
    }

    public FieldGroup compileFields(List<FieldNode> nodes, FieldOptions options) {
        Namespace names = new Namespace();
        Map<Integer, FieldNode> fieldsById = new HashMap<>();
        Map<String, FieldSpec> fields = new LinkedHashMap<>();
        int nextImplicitId = -1;

        for (FieldNode node : nodes) {
            names.claim(node.getName(), node.getSourceLine());

            int id = node.getId() != null ? node.getId() : nextImplicitId--;
            FieldNode previous = fieldsById.putIfAbsent(id, node);
            if (previous != null) {
                throw new DuplicateFieldIdException(node.getName(), node.getSourceLine(), id,
                        previous.getName(), previous.getSourceLine());
            }

            if (options.isDisallowDefaultValue() && node.hasDefaultValue()) {
                throw new IllegalDefaultValueException(node.getName(), node.getSourceLine());
            }
            if (options.isDisallowRequired() && node.getRequiredness() == Requiredness.REQUIRED) {
                throw new IllegalRequirednessException(node.getName(), node.getSourceLine());
            }

            fields.put(node.getName(), FieldSpec.builder()
                    .id(id)
                    .name(node.getName())
                    .type(typeCompiler.compile(node.getType()))
                    .required(node.getRequiredness() == Requiredness.REQUIRED)
                    .defaultValue(node.getDefaultValue())
                    .build());
        }

        return new FieldGroup(fields);
    }
}
