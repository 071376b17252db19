package com.idl.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.idl.compiler.cli.exception.OptionsValidationException;
import com.idl.compiler.cli.model.CompileOptions;
import com.idl.compiler.cli.model.ValidatedCompileOptions;
import com.idl.compiler.loader.LoaderConfig;

public class CompileOptionsValidator {

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getFiles() == null || o.getFiles().isEmpty()) {
			errors.add("At least one IDL file is required.");
		}

		List<Path> files = new ArrayList<>();
		if (o.getFiles() != null) {
			for (Path file : o.getFiles()) {
				if (!Files.isRegularFile(file)) {
					errors.add("IDL file does not exist or is not a regular file: " + file);
				} else {
					files.add(file.toAbsolutePath().normalize());
				}
			}
		}

		LoaderConfig.LoaderConfigBuilder loaderConfig = LoaderConfig.builder();
		if (o.getIncludeDirs() != null) {
			for (Path dir : o.getIncludeDirs()) {
				if (!existsDirectory(dir)) {
					errors.add("Include directory does not exist or is not a directory: " + dir);
				} else {
					loaderConfig.includeDir(dir.toAbsolutePath().normalize());
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedCompileOptions(files, loaderConfig.build(), o.isSummary());
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
