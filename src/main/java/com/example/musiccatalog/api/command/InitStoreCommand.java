package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.service.CatalogSchemaService;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(name = "init-store", mixinStandardHelpOptions = true,
        description = "Create the catalog tables. Running it again changes nothing.")
public class InitStoreCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    private final CatalogSchemaService catalogSchemaService;

    public InitStoreCommand(CatalogSchemaService catalogSchemaService) {
        this.catalogSchemaService = catalogSchemaService;
    }

    @Override
    public Integer call() {
        catalogSchemaService.initStore();
        spec.commandLine().getOut().println("Database initialized.");
        return 0;
    }
}
