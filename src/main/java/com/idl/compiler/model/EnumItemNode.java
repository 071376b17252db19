package com.idl.compiler.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single enum item. The value is null when the source omits it.
 */
@Value
@Builder
public class EnumItemNode {
    String name;
    Integer value;
    int sourceLine;
}
