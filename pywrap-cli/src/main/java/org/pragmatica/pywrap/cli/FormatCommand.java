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
 * Format command - rewraps files in place.
 */
@Command(
        name = "format",
        description = "Rewrap over-long lines of Python files in place",
        mixinStandardHelpOptions = true
)
public class FormatCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to format",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--dry-run", "-n"},
            description = "Print the formatted content of changed files instead of writing them"
    )
    boolean dryRun;

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
        int changed = 0;

        for (var file : files) {
            try {
                var source = SourceFile.sourceFile(file);
                var formatted = formatter.format(source);

                if (formatted.content().equals(source.content())) {
                    continue;
                }
                changed++;

                if (dryRun) {
                    out.println("==> " + file + " <==");
                    out.print(formatted.content());
                } else {
                    formatted.write();
                    out.println("Formatted: " + file);
                }
            } catch (IOException e) {
                errors.add(FormattingError.readError(file, e.getMessage()).message());
            } catch (FormattingException e) {
                errors.add(e.error().message());
            }
        }

        errors.forEach(err::println);
        out.println(summary(files.size(), changed));
        out.flush();
        err.flush();

        return errors.isEmpty() ? 0 : 2;
    }

    private String summary(int total, int changed) {
        var verb = dryRun ? "would be reformatted" : "reformatted";
        return changed + " of " + total + " file(s) " + verb;
    }
}
