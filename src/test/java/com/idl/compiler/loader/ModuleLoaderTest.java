package com.idl.compiler.loader;

import com.idl.compiler.compile.Module;
import com.idl.compiler.compile.StructSpec;
import com.idl.compiler.compile.exception.CompileException;
import com.idl.compiler.parser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ModuleLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadResolvesIncludeNextToFile() throws IOException {
        write("shared.thrift", """
            struct Address {
                1: string street
            }
            """);
        Path users = write("users.thrift", """
            include "shared.thrift"
            struct User {
                1: shared.Address address
            }
            """);

        ModuleLoader loader = new ModuleLoader(LoaderConfig.defaults());
        Module module = loader.load(users);

        assertThat(module.getName()).isEqualTo("users");
        assertThat(module.getIncludes()).containsOnlyKeys("shared");

        Module shared = module.getIncludes().get("shared");
        StructSpec user = (StructSpec) module.findType("User").orElseThrow();
        assertThat(user.getFields().get("address").orElseThrow().getType())
                .isSameAs(shared.findType("Address").orElseThrow());
    }

    @Test
    void testLoadSearchesIncludeDirs() throws IOException {
        Path libDir = Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(libDir.resolve("common.thrift"), "typedef i64 Timestamp\n");
        Path main = write("main.thrift", """
            include "common.thrift"
            struct Event {
                1: common.Timestamp at
            }
            """);

        ModuleLoader loader = new ModuleLoader(LoaderConfig.builder().includeDir(libDir).build());
        Module module = loader.load(main);

        assertThat(module.findType("common.Timestamp")).isPresent();
        assertThat(loader.findInclude(tempDir, "common.thrift")).isEqualTo(libDir.resolve("common.thrift"));
    }

    @Test
    void testSharedIncludeIsLoadedOnce() throws IOException {
        write("base.thrift", "struct Base {}\n");
        write("left.thrift", """
            include "base.thrift"
            struct Left { 1: base.Base base }
            """);
        write("right.thrift", """
            include "base.thrift"
            struct Right { 1: base.Base base }
            """);
        Path top = write("top.thrift", """
            include "left.thrift"
            include "right.thrift"
            struct Top {
                1: left.Left left
                2: right.Right right
            }
            """);

        ModuleLoader loader = new ModuleLoader(LoaderConfig.defaults());
        Module module = loader.load(top);

        Module viaLeft = module.getIncludes().get("left").getIncludes().get("base");
        Module viaRight = module.getIncludes().get("right").getIncludes().get("base");
        assertThat(viaLeft).isSameAs(viaRight);
        assertThat(loader.load(top)).isSameAs(module);
    }

    @Test
    void testMissingIncludeIsReported() throws IOException {
        Path main = write("main.thrift", """
            include "nowhere.thrift"
            """);

        ModuleLoader loader = new ModuleLoader(LoaderConfig.defaults());

        assertThatThrownBy(() -> loader.load(main))
                .isInstanceOf(ModuleLoadException.class)
                .hasMessageContaining("Missing include 'nowhere.thrift'")
                .hasMessageContaining("main.thrift line 1");
    }

    @Test
    void testIncludeCycleIsReported() throws IOException {
        write("a.thrift", "include \"b.thrift\"\n");
        write("b.thrift", "include \"a.thrift\"\n");

        ModuleLoader loader = new ModuleLoader(LoaderConfig.defaults());

        assertThatThrownBy(() -> loader.load(tempDir.resolve("a.thrift")))
                .isInstanceOf(ModuleLoadException.class)
                .hasMessageContaining("Cyclic include detected: a.thrift -> b.thrift -> a.thrift");
    }

    @Test
    void testCompileErrorsPropagate() throws IOException {
        Path broken = write("broken.thrift", """
            struct User {
                1: string name
                2: string name
            }
            """);
        Path invalid = write("invalid.thrift", "struct {}\n");

        ModuleLoader loader = new ModuleLoader(LoaderConfig.defaults());

        assertThatThrownBy(() -> loader.load(broken))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("the name \"name\" has already been used on line 2");
        assertThatThrownBy(() -> loader.load(invalid))
                .isInstanceOf(ParseException.class);
    }

    private Path write(String fileName, String content) throws IOException {
        return Files.writeString(tempDir.resolve(fileName), content);
    }
}
