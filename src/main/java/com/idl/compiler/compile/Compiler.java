package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.CompileException;
import com.idl.compiler.compile.exception.IllegalOnewayFunctionException;
import com.idl.compiler.compile.exception.WrappedCompileException;
import com.idl.compiler.model.ConstantDefinition;
import com.idl.compiler.model.Definition;
import com.idl.compiler.model.DefinitionVisitor;
import com.idl.compiler.model.EnumDefinition;
import com.idl.compiler.model.EnumItemNode;
import com.idl.compiler.model.FunctionNode;
import com.idl.compiler.model.ServiceDefinition;
import com.idl.compiler.model.StructDefinition;
import com.idl.compiler.model.StructKind;
import com.idl.compiler.model.TypedefDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles top-level definitions into unlinked specs.
 *
 * Every local constraint is checked here; references to other definitions are
 * left as names for the {@link Linker}. The first error aborts the definition.
 */
public class Compiler implements DefinitionVisitor<Spec> {

    private final TypeCompiler typeCompiler;
    private final FieldCompiler fieldCompiler;

    public Compiler() {
        this.typeCompiler = new TypeCompiler();
        this.fieldCompiler = new FieldCompiler(typeCompiler);
    }

    public Spec compile(Definition definition) {
        return definition.accept(this);
    }

    public ServiceSpec compileService(ServiceDefinition service) {
        Namespace functionNames = new Namespace();
        Map<String, FunctionSpec> functions = new LinkedHashMap<>();

        try {
            for (FunctionNode function : service.getFunctions()) {
                functionNames.claim(function.getName(), function.getSourceLine());
                functions.put(function.getName(), compileFunction(function));
            }
        } catch (CompileException e) {
            throw new WrappedCompileException(service.getName(), e);
        }

        return new ServiceSpec(service.getName(), service.getParentName(), service.getParentLine(), functions);
    }

    public FunctionSpec compileFunction(FunctionNode function) {
        try {
            if (function.isOneWay()) {
                if (!function.isVoid()) {
                    throw IllegalOnewayFunctionException.returnsValue(function.getName());
                }
                if (!function.getExceptions().isEmpty()) {
                    throw IllegalOnewayFunctionException.throwsExceptions(function.getName());
                }
            }

            FieldGroup args = fieldCompiler.compileFields(function.getArguments(), FieldOptions.ARGUMENTS);
            FieldGroup exceptions = fieldCompiler.compileFields(function.getExceptions(), FieldOptions.EXCEPTIONS);

            ResultSpec result = null;
            if (!function.isVoid() || !exceptions.isEmpty()) {
                TypeSpec returnType = function.isVoid() ? null : typeCompiler.compile(function.getReturnType());
                result = new ResultSpec(returnType, exceptions);
            }

            return new FunctionSpec(function.getName(), args, result, function.isOneWay());
        } catch (CompileException e) {
            throw new WrappedCompileException(function.getName(), e);
        }
    }

    public StructSpec compileStruct(StructDefinition struct) {
        FieldOptions options = struct.getKind() == StructKind.UNION ? FieldOptions.UNION : FieldOptions.STRUCT;
        try {
            FieldGroup fields = fieldCompiler.compileFields(struct.getFields(), options);
            return new StructSpec(struct.getName(), struct.getKind(), fields);
        } catch (CompileException e) {
            throw new WrappedCompileException(struct.getName(), e);
        }
    }

    public TypedefSpec compileTypedef(TypedefDefinition typedef) {
        return new TypedefSpec(typedef.getName(), typeCompiler.compile(typedef.getTarget()));
    }

    /**
     * Items without a value take the previous value plus one, starting at 0.
     */
    public EnumSpec compileEnum(EnumDefinition enumDefinition) {
        Namespace itemNames = new Namespace();
        List<EnumItemSpec> items = new ArrayList<>();
        int next = 0;

        try {
            for (EnumItemNode item : enumDefinition.getItems()) {
                itemNames.claim(item.getName(), item.getSourceLine());
                int value = item.getValue() != null ? item.getValue() : next;
                items.add(new EnumItemSpec(item.getName(), value));
                next = value + 1;
            }
        } catch (CompileException e) {
            throw new WrappedCompileException(enumDefinition.getName(), e);
        }

        return new EnumSpec(enumDefinition.getName(), items);
    }

    public ConstantSpec compileConstant(ConstantDefinition constant) {
        return new ConstantSpec(constant.getName(), typeCompiler.compile(constant.getType()), constant.getValue());
    }

    @Override
    public Spec visit(ServiceDefinition service) {
        return compileService(service);
    }

    @Override
    public Spec visit(StructDefinition struct) {
        return compileStruct(struct);
    }

    @Override
    public Spec visit(TypedefDefinition typedef) {
        return compileTypedef(typedef);
    }

    @Override
    public Spec visit(EnumDefinition enumDefinition) {
        return compileEnum(enumDefinition);
    }

    @Override
    public Spec visit(ConstantDefinition constant) {
        return compileConstant(constant);
    }
}
