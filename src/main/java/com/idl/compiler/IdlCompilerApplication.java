package com.idl.compiler;

import com.idl.compiler.cli.CompileCommand;
import picocli.CommandLine;

/**
 * Main entry point for the IDL compiler.
 * Compiles and links Thrift IDL files, reporting the first error of each file.
 */
public class IdlCompilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand()).execute(args);
        System.exit(exitCode);
    }
}
