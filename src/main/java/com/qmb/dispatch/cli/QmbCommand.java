package com.qmb.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the Qlik model builder.
 * Routes to subcommands: build, analyze, validate, serve.
 */
@Command(
        name = "qmb",
        mixinStandardHelpOptions = true,
        version = "Qlik Model Builder 0.1.0",
        description = "Staged Qlik data model and load script builder",
        subcommands = {
                BuildCommand.class,
                AnalyzeCommand.class,
                ValidateCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class QmbCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // The command line built with the Spring factory
        spec.commandLine().usage(System.out);
    }
}
