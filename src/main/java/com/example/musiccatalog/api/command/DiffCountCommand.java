package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.service.ReconciliationService;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Component
@Command(name = "diff-count", mixinStandardHelpOptions = true,
        description = "Count the files of the origin scan that are missing from the destination scan.")
public class DiffCountCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--origin-scan", required = true, description = "Origin scan name.")
    private String originScan;

    @Option(names = "--dest-scan", required = true, description = "Destination scan name.")
    private String destScan;

    private final ReconciliationService reconciliationService;

    public DiffCountCommand(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Override
    public Integer call() {
        long count = reconciliationService.countDiff(originScan, destScan);
        spec.commandLine().getOut().printf("Different files count between %s and %s: %d%n", originScan, destScan, count);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
