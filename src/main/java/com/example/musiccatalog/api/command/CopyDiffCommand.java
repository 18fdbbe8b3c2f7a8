package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.progress.CopyProgressListener;
import com.example.musiccatalog.application.service.CopyDiffService;
import com.example.musiccatalog.domain.model.CopyReport;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Component
@Command(name = "copy-diff", mixinStandardHelpOptions = true,
        description = "Copy the origin files missing from the destination scan into one folder.")
public class CopyDiffCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--origin-scan", required = true, description = "Origin scan name.")
    private String originScan;

    @Option(names = "--dest-scan", required = true, description = "Destination scan name.")
    private String destScan;

    @Option(names = {"--folder", "--folder-name"}, required = true,
            description = "Folder to copy files into; created when missing.")
    private Path folder;

    private final CopyDiffService copyDiffService;

    public CopyDiffCommand(CopyDiffService copyDiffService) {
        this.copyDiffService = copyDiffService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CopyReport report = copyDiffService.copyDiff(originScan, destScan, folder, new CopyProgressListener() {
            @Override
            public void onProgress(int copied, int total) {
                double percentage = total == 0 ? 100.0D : copied * 100.0D / total;
                out.println(String.format(Locale.ROOT, "%.2f%%: %d files out of %d copied", percentage, copied, total));
                out.flush();
            }

            @Override
            public void onMissingSource(String sourcePath) {
                err.println("File " + sourcePath + " not found in source directory");
                err.flush();
            }
        });

        out.printf("done: %d out of %d copied, %d missing%n", report.getCopied(), report.getTotal(), report.getMissing());
        out.flush();
        return 0;
    }
}
