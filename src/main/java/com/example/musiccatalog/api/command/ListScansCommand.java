package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.service.CatalogQueryService;
import com.example.musiccatalog.infrastructure.persistence.entity.ScanEntity;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(name = "list-scans", mixinStandardHelpOptions = true,
        description = "List recorded scans, newest first. Scans that never finished are marked INCOMPLETE.")
public class ListScansCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    private final CatalogQueryService catalogQueryService;

    public ListScansCommand(CatalogQueryService catalogQueryService) {
        this.catalogQueryService = catalogQueryService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<ScanEntity> scans = catalogQueryService.listScans();
        if (scans.isEmpty()) {
            out.println("No scans recorded.");
            out.flush();
            return 0;
        }
        out.println("scan_name | status | start | end | files | taggable | errors");
        for (ScanEntity scan : scans) {
            out.printf("%s | %s | %s | %s | %s | %s | %s%n",
                    scan.getScanName(),
                    scan.getEndTime() == null ? "INCOMPLETE" : "COMPLETE",
                    scan.getStartTime(),
                    dash(scan.getEndTime()),
                    dash(scan.getNumFiles()),
                    dash(scan.getNumTaggable()),
                    dash(scan.getNumErrors()));
        }
        out.flush();
        return 0;
    }

    private String dash(Object value) {
        return value == null ? "-" : String.valueOf(value);
    }
}
