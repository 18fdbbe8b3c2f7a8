package com.example.musiccatalog.api.command;

import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(
        name = "music-catalog",
        description = "Catalogue music file trees into a database and compare scans.",
        mixinStandardHelpOptions = true,
        subcommands = {
                InitStoreCommand.class,
                ScanCommand.class,
                DiffCountCommand.class,
                DiffListCommand.class,
                CopyDiffCommand.class,
                ExtensionsCommand.class,
                ListFilesCommand.class,
                ListScansCommand.class
        }
)
public class CatalogCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    /**
     * Reached only when no subcommand was given.
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }
}
