package com.idl.compiler.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the compile command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

	@Option(names = { "--include-dir",
			"-I" }, description = "Directory searched for included files after the including file's directory (repeatable)")
	private List<Path> includeDirs = new ArrayList<>();

	@Option(names = { "--summary" }, description = "Print a summary of every compiled module")
	private boolean summary;

	@Parameters(paramLabel = "FILE", arity = "1..*", description = "IDL files to compile")
	private List<Path> files = new ArrayList<>();

}
