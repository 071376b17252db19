package com.idl.compiler.cli;

import com.idl.compiler.cli.exception.OptionsValidationException;
import com.idl.compiler.cli.model.CompileOptions;
import com.idl.compiler.cli.model.ValidatedCompileOptions;
import com.idl.compiler.cli.output.CompileResultsPrinter;
import com.idl.compiler.cli.output.ModuleSummaryRenderer;
import com.idl.compiler.cli.validation.CompileOptionsValidator;
import com.idl.compiler.compile.Module;
import com.idl.compiler.compile.exception.CompileException;
import com.idl.compiler.loader.ModuleLoadException;
import com.idl.compiler.loader.ModuleLoader;
import com.idl.compiler.parser.ParseException;

import freemarker.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command that compiles and links IDL files.
 * Exit code 0 when every file succeeds, 1 otherwise.
 */
@Command(
        name = "idlc",
        mixinStandardHelpOptions = true,
        version = "idlc 1.0.0",
        description = "Compiles Thrift IDL files, checking names, field ids and references across includes."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Mixin
    private CompileOptions options = new CompileOptions();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();
    private final ModuleSummaryRenderer summaryRenderer = new ModuleSummaryRenderer();

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        printer.printBanner(validated);

        ModuleLoader loader = new ModuleLoader(validated.getLoaderConfig());
        int failures = 0;

        for (Path file : validated.getFiles()) {
            try {
                Module module = loader.load(file);
                printer.printModule(module);
                if (validated.isSummary()) {
                    printer.printSummary(summaryRenderer.render(module));
                }
            } catch (ParseException | CompileException | ModuleLoadException e) {
                printer.printFailure(file, e);
                failures++;
            } catch (IOException e) {
                log.error("Failed to read {}", file, e);
                failures++;
            } catch (TemplateException e) {
                log.error("Failed to render summary for {}", file, e);
                failures++;
            }
        }

        printer.printTotals(validated.getFiles().size(), failures);
        return failures == 0 ? 0 : 1;
    }
}
