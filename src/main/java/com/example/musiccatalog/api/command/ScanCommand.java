package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.progress.ScanProgressListener;
import com.example.musiccatalog.application.service.ScanRecorderService;
import com.example.musiccatalog.domain.model.ScanSummary;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Component
@Command(name = "scan", mixinStandardHelpOptions = true,
        description = "Scan a music directory and record metadata for every file under it.")
public class ScanCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--path", required = true,
            description = "The absolute or relative path to the music directory to scan.")
    private Path path;

    @Option(names = "--scan-name", required = true,
            description = "A unique name for this scanning session.")
    private String scanName;

    private final ScanRecorderService scanRecorderService;

    public ScanCommand(ScanRecorderService scanRecorderService) {
        this.scanRecorderService = scanRecorderService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Path root = path.toAbsolutePath().normalize();

        ScanSummary summary = scanRecorderService.startScan(root, scanName, new ScanProgressListener() {
            @Override
            public void onProgress(String name, int processed) {
                out.println(processed + " files processed.");
                out.flush();
            }

            @Override
            public void onFileFailed(String failedPath, String reason) {
                err.println("Error processing " + failedPath + ": " + reason);
                err.flush();
            }
        });

        out.printf("Scan complete (%d files, %d taggable, %d errors) for directory: %s%n",
                summary.getProcessed(), summary.getTaggable(), summary.getErrors(), summary.getRootPath());
        if (summary.getMissingDigests() > 0) {
            out.printf("%d files were recorded without a content digest.%n", summary.getMissingDigests());
        }
        out.flush();
        return 0;
    }
}
