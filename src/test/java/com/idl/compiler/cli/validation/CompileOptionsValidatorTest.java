package com.idl.compiler.cli.validation;

import com.idl.compiler.cli.exception.OptionsValidationException;
import com.idl.compiler.cli.model.CompileOptions;
import com.idl.compiler.cli.model.ValidatedCompileOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class CompileOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final CompileOptionsValidator validator = new CompileOptionsValidator();

    @Test
    void testValidOptions() throws IOException {
        Path file = Files.writeString(tempDir.resolve("kv.thrift"), "service KeyValue {}\n");
        Path includeDir = Files.createDirectories(tempDir.resolve("include"));

        ValidatedCompileOptions validated = validator.validate(
                parse("-I", includeDir.toString(), "--summary", file.toString()));

        assertThat(validated.getFiles()).containsExactly(file.toAbsolutePath().normalize());
        assertThat(validated.getLoaderConfig().getIncludeDirs()).containsExactly(includeDir.toAbsolutePath().normalize());
        assertThat(validated.isSummary()).isTrue();
    }

    @Test
    void testAllProblemsAreReportedTogether() {
        Path missingFile = tempDir.resolve("missing.thrift");
        Path missingDir = tempDir.resolve("nope");

        assertThatThrownBy(() -> validator.validate(
                parse("--include-dir", missingDir.toString(), missingFile.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(2)
                        .anySatisfy(error -> assertThat(error).contains("IDL file does not exist"))
                        .anySatisfy(error -> assertThat(error).contains("Include directory does not exist")));
    }

    private static CompileOptions parse(String... args) {
        CompileOptions options = new CompileOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
