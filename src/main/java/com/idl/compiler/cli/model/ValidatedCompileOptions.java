package com.idl.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.idl.compiler.loader.LoaderConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
    List<Path> files;
    LoaderConfig loaderConfig;
    boolean summary;
}
