package org.pragmatica.pywrap.cli;

import org.pragmatica.pywrap.format.FormattingError;
import org.pragmatica.pywrap.format.FormattingException;
import org.pragmatica.pywrap.format.PyWrapFormatter;
import org.pragmatica.pywrap.shared.FileCollector;
import org.pragmatica.pywrap.shared.SourceFile;
import org.pragmatica.pywrap.wrap.FixerConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Check command - reports files the format command would change (for CI).
 */
@Command(
        name = "check",
        description = "List Python files with lines the format command would rewrap",
        mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to check",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = "--max-passes",
            description = "Maximal number of fixing passes per file (default: ${DEFAULT-VALUE})",
            defaultValue = "32"
    )
    int maxPasses;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        var formatter = PyWrapFormatter.pyWrapFormatter(FixerConfig.defaultConfig().withMaxPasses(maxPasses));

        var errors = new ArrayList<String>();
        var files = FileCollector.collectPythonFiles(paths, errors::add);
        int unformatted = 0;

        for (var file : files) {
            try {
                if (!formatter.isFormatted(SourceFile.sourceFile(file))) {
                    unformatted++;
                    out.println("Would reformat: " + file);
                }
            } catch (IOException e) {
                errors.add(FormattingError.readError(file, e.getMessage()).message());
            } catch (FormattingException e) {
                errors.add(e.error().message());
            }
        }

        errors.forEach(err::println);
        out.flush();
        err.flush();

        // Errors take precedence over findings
        if (!errors.isEmpty()) {
            return 2;
        }
        return unformatted > 0 ? 1 : 0;
    }
}
