package com.idl.compiler.compile;

import lombok.Builder;
import lombok.Value;

/**
 * Constraints applied to one field group on top of name and id uniqueness.
 */
@Value
@Builder
public class FieldOptions {

    public static final FieldOptions STRUCT = FieldOptions.builder().build();

    public static final FieldOptions UNION = FieldOptions.builder()
            .disallowDefaultValue(true)
            .disallowRequired(true)
            .build();

    public static final FieldOptions ARGUMENTS = FieldOptions.builder().build();

    public static final FieldOptions EXCEPTIONS = FieldOptions.builder()
            .disallowDefaultValue(true)
            .build();

    boolean disallowDefaultValue;
    boolean disallowRequired;
}
