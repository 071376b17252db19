package com.idl.compiler.model;

/**
 * Visitor pattern interface for dispatching over top-level definitions.
 */
public interface DefinitionVisitor<T> {
    T visit(ServiceDefinition service);
    T visit(StructDefinition struct);
    T visit(TypedefDefinition typedef);
    T visit(EnumDefinition enumDefinition);
    T visit(ConstantDefinition constant);
}
