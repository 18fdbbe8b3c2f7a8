package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.service.CatalogQueryService;
import com.example.musiccatalog.infrastructure.persistence.model.ExtensionCountRow;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Component
@Command(name = "exts", mixinStandardHelpOptions = true,
        description = "Count catalogued files per extension, most frequent first.")
public class ExtensionsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--scan-name", description = "Only count files of this scan.")
    private String scanName;

    private final CatalogQueryService catalogQueryService;

    public ExtensionsCommand(CatalogQueryService catalogQueryService) {
        this.catalogQueryService = catalogQueryService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (ExtensionCountRow row : catalogQueryService.listExtensions(scanName)) {
            out.printf("\t%s\t\t%d%n", row.getExtension(), row.getFileCount());
        }
        out.flush();
        return 0;
    }
}
