package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.service.ReconciliationService;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Component
@Command(name = "diff-list", mixinStandardHelpOptions = true,
        description = "Print the full paths of origin files that are missing from the destination scan.")
public class DiffListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--origin-scan", required = true, description = "Origin scan name.")
    private String originScan;

    @Option(names = "--dest-scan", required = true, description = "Destination scan name.")
    private String destScan;

    private final ReconciliationService reconciliationService;

    public DiffListCommand(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (String fullPath : reconciliationService.listDiffPaths(originScan, destScan)) {
            out.println(fullPath);
        }
        out.flush();
        return 0;
    }
}
