package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.CompileException;
import com.idl.compiler.compile.exception.WrappedCompileException;
import com.idl.compiler.model.Definition;
import com.idl.compiler.model.Program;
import com.idl.compiler.util.NamingUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiles and links every definition of one parsed file.
 *
 * Steps: claim top-level names, compile each definition, assemble the
 * registry with the included modules, then link. The first error stops the file.
 */
public class ModuleCompiler {
    private static final Logger log = LoggerFactory.getLogger(ModuleCompiler.class);

    private final Compiler compiler;
    private final Linker linker;

    public ModuleCompiler() {
        this(new Compiler(), new Linker());
    }

    public ModuleCompiler(Compiler compiler, Linker linker) {
        this.compiler = compiler;
        this.linker = linker;
    }

    public Module compile(Program program) {
        return compile(program, Map.of());
    }

    /**
     * @param includes already linked modules keyed by include name
     */
    public Module compile(Program program, Map<String, Module> includes) {
        String moduleName = NamingUtil.moduleName(program.getSourceFile());
        log.debug("Compiling module {} ({} definitions)", moduleName, program.getDefinitions().size());

        Namespace topLevel = new Namespace();
        for (Definition definition : program.getDefinitions()) {
            topLevel.claim(definition.getName(), definition.getSourceLine());
        }

        Map<String, Spec> specs = new LinkedHashMap<>();
        for (Definition definition : program.getDefinitions()) {
            specs.put(definition.getName(), compiler.compile(definition));
        }

        Registry.Builder registry = Registry.builder();
        specs.values().forEach(registry::add);
        includes.forEach((includeName, module) -> registry.include(includeName, module.getScope()));
        Registry scope = registry.build();

        for (Spec spec : specs.values()) {
            try {
                linker.link(spec, scope);
            } catch (CompileException e) {
                throw new WrappedCompileException(spec.getThriftName(), e);
            }
        }

        log.info("Compiled module {}: {} definitions, {} includes", moduleName, specs.size(), includes.size());
        return new Module(moduleName, program.getSourceFile(), scope, specs, includes);
    }
}
