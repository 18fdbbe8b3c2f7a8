package com.example.musiccatalog.api.command;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Dispatches the process arguments to the picocli command tree and keeps its exit code for
 * {@code SpringApplication.exit}.
 */
@Component
public class CatalogCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final String SPRING_ARG_PREFIX = "--spring.";

    private final CatalogCommand catalogCommand;
    private final SpringCommandFactory commandFactory;
    private final CommandExceptionHandler commandExceptionHandler;

    private int exitCode;

    public CatalogCommandRunner(CatalogCommand catalogCommand,
                                SpringCommandFactory commandFactory,
                                CommandExceptionHandler commandExceptionHandler) {
        this.catalogCommand = catalogCommand;
        this.commandFactory = commandFactory;
        this.commandExceptionHandler = commandExceptionHandler;
    }

    @Override
    public void run(String... args) {
        exitCode = newCommandLine().execute(stripSpringArguments(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine newCommandLine() {
        return new CommandLine(catalogCommand, commandFactory)
                .setExecutionExceptionHandler(commandExceptionHandler);
    }

    private String[] stripSpringArguments(String[] args) {
        List<String> kept = new ArrayList<>();
        if (args != null) {
            for (String arg : args) {
                if (arg != null && !arg.startsWith(SPRING_ARG_PREFIX)) {
                    kept.add(arg);
                }
            }
        }
        return kept.toArray(new String[0]);
    }
}
