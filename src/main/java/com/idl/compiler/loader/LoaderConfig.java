package com.idl.compiler.loader;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings for {@link ModuleLoader}.
 */
@Value
@Builder
public class LoaderConfig {

    /** Searched in order after the including file's own directory. */
    @Singular
    List<Path> includeDirs;

    public static LoaderConfig defaults() {
        return LoaderConfig.builder().build();
    }
}
