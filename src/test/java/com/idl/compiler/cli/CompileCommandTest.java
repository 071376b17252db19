package com.idl.compiler.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class CompileCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testSuccessfulCompileExitsWithZero() throws IOException {
        Files.writeString(tempDir.resolve("shared.thrift"), "exception KeyDoesNotExist {}\n");
        Path file = Files.writeString(tempDir.resolve("kv.thrift"), """
            include "shared.thrift"
            service KeyValue {
                binary getValue(1: string key) throws (1: shared.KeyDoesNotExist doesNotExist)
            }
            """);

        int exitCode = new CommandLine(new CompileCommand()).execute("--summary", file.toString());

        assertThat(exitCode).isEqualTo(0);
    }

    @Test
    void testCompileErrorExitsWithOne() throws IOException {
        Path good = Files.writeString(tempDir.resolve("good.thrift"), "struct Ok {}\n");
        Path bad = Files.writeString(tempDir.resolve("bad.thrift"), """
            service Foo {
                void bar(1: string foo, 2: binary bar, 3: i32 foo)
            }
            """);

        int exitCode = new CommandLine(new CompileCommand()).execute(good.toString(), bad.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsExitWithOne() {
        int exitCode = new CommandLine(new CompileCommand())
                .execute(tempDir.resolve("missing.thrift").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
