package com.idl.compiler.compile;

/**
 * A spec usable as the type of a field, argument, return value or typedef target.
 */
public interface TypeSpec extends Spec {

    @Override
    TypeSpec link(Scope scope);
}
