package com.idl.compiler.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.idl.compiler.cli.model.ValidatedCompileOptions;
import com.idl.compiler.compile.Module;

/**
 * Responsible only for printing CLI output for the compile command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("IDL Compiler");
        log.info("=================================================");
        log.info("Files: {}", v.getFiles().size());
        if (v.getLoaderConfig().getIncludeDirs().isEmpty()) {
            log.info("Include Directories: None");
        } else {
            v.getLoaderConfig().getIncludeDirs().forEach(dir -> log.info("Include Directory: {}", dir));
        }
        log.info("=================================================");
    }

    public void printModule(Module module) {
        log.info("OK {} ({} definitions, {} includes)",
                module.getSourceFile(), module.getSpecs().size(), module.getIncludes().size());
    }

    public void printSummary(String summary) {
        log.info("{}{}", System.lineSeparator(), summary);
    }

    public void printFailure(Path file, RuntimeException e) {
        log.error("FAILED {}: {}", file.getFileName(), e.getMessage());
    }

    public void printTotals(int files, int failures) {
        log.info("=================================================");
        if (failures == 0) {
            log.info("COMPILATION SUCCESSFUL ({} files)", files);
        } else {
            log.error("COMPILATION FAILED ({} of {} files)", failures, files);
        }
        log.info("=================================================");
    }
}
