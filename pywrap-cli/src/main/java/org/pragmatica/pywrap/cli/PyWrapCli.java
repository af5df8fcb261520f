package org.pragmatica.pywrap.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Line-length fixer for Python sources.
///
/// Usage examples:
/// ```
/// pywrap format src/
/// pywrap format --dry-run module.py
/// pywrap check src/ tests/
/// ```
@Command(name = "pywrap",
mixinStandardHelpOptions = true,
version = "pywrap 0.1.0",
description = "Rewrap Python source lines longer than 79 characters",
subcommands = {FormatCommand.class,
CheckCommand.class})
public class PyWrapCli implements Runnable {
    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PyWrapCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }
}
