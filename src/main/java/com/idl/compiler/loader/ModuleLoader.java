package com.idl.compiler.loader;

import com.idl.compiler.compile.Module;
import com.idl.compiler.compile.ModuleCompiler;
import com.idl.compiler.model.IncludeNode;
import com.idl.compiler.model.Program;
import com.idl.compiler.parser.IdlParser;
import com.idl.compiler.parser.IdlToken;
import com.idl.compiler.parser.IdlTokenizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads an IDL file together with everything it includes, compiling and
 * linking included files first.
 *
 * Modules are cached by normalized path, so a file included from several
 * places is compiled once and shared. Not thread-safe.
 */
public class ModuleLoader {
    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final LoaderConfig config;
    private final ModuleCompiler moduleCompiler;

    /** Loaded modules by normalized absolute path. */
    private final Map<Path, Module> loadedModules = new HashMap<>();

    /** Include chain currently being loaded, for cycle detection. */
    private final Set<Path> currentlyLoading = new LinkedHashSet<>();

    public ModuleLoader(LoaderConfig config) {
        this(config, new ModuleCompiler());
    }

    public ModuleLoader(LoaderConfig config, ModuleCompiler moduleCompiler) {
        this.config = Objects.requireNonNull(config, "config");
        this.moduleCompiler = Objects.requireNonNull(moduleCompiler, "moduleCompiler");
    }

    /**
     * Load, compile and link one file and its includes.
     *
     * @throws ModuleLoadException if an include is missing or includes form a cycle
     * @throws com.idl.compiler.parser.ParseException on a syntax error
     * @throws com.idl.compiler.compile.exception.CompileException on a semantic error
     */
    public Module load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Path key = path.toAbsolutePath().normalize();

        Module cached = loadedModules.get(key);
        if (cached != null) {
            return cached;
        }

        if (currentlyLoading.contains(key)) {
            throw new ModuleLoadException("Cyclic include detected: " + describeCycle(key));
        }

        currentlyLoading.add(key);
        try {
            String fileName = key.getFileName().toString();
            String content = Files.readString(key);

            log.debug("Parsing {}", key);
            List<IdlToken> tokens = new IdlTokenizer(content, fileName).tokenize();
            Program program = new IdlParser(tokens, fileName).parse();

            Map<String, Module> includes = new LinkedHashMap<>();
            for (IncludeNode include : program.getIncludes()) {
                Path resolved = findInclude(key.getParent(), include.getPath());
                if (resolved == null) {
                    throw new ModuleLoadException(String.format(
                            "Missing include '%s' referenced from %s line %d. Provide it next to the file or with --include-dir",
                            include.getPath(), fileName, include.getSourceLine()));
                }

                Module included = load(resolved);
                if (includes.putIfAbsent(include.getIncludeName(), included) != null) {
                    throw new ModuleLoadException(String.format(
                            "Include name '%s' is used twice in %s (line %d)",
                            include.getIncludeName(), fileName, include.getSourceLine()));
                }
                log.debug("Resolved include {} -> {}", include.getPath(), resolved);
            }

            Module module = moduleCompiler.compile(program, includes);
            loadedModules.put(key, module);
            return module;
        } finally {
            currentlyLoading.remove(key);
        }
    }

    /**
     * Find an included file relative to the including directory, then in the include directories.
     */
    public Path findInclude(Path baseDir, String includePath) {
        if (includePath == null || includePath.isBlank()) {
            return null;
        }

        if (baseDir != null) {
            Path candidate = baseDir.resolve(includePath);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }

        for (Path dir : config.getIncludeDirs()) {
            Path candidate = dir.resolve(includePath);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }

        return null;
    }

    private String describeCycle(Path repeated) {
        StringBuilder chain = new StringBuilder();
        boolean inCycle = false;
        for (Path path : currentlyLoading) {
            if (path.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                chain.append(path.getFileName()).append(" -> ");
            }
        }
        return chain.append(repeated.getFileName()).toString();
    }
}
