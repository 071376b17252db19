package com.idl.compiler.model;

import com.idl.compiler.util.NamingUtil;

import lombok.Value;

/**
 * {@code include "path"}
 */
@Value
public class IncludeNode {
    String path;
    int sourceLine;

    /**
     * Name under which the included module's definitions are referenced,
     * e.g. {@code shared} for {@code include "common/shared.thrift"}.
     */
    public String getIncludeName() {
        return NamingUtil.moduleName(path);
    }
}
