package com.example.musiccatalog.api.command;

import com.example.musiccatalog.application.service.CatalogQueryService;
import com.example.musiccatalog.infrastructure.persistence.entity.FileDataEntity;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Component
@Command(name = "list-files", mixinStandardHelpOptions = true,
        description = "List catalogued files with the given extension, by file name descending.")
public class ListFilesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--ext", required = true, description = "File extension to filter by.")
    private String extension;

    @Option(names = "--limit",
            description = "Maximum rows to print, at most " + CatalogQueryService.MAX_LIMIT
                    + "; values below 1 print the default page (default: ${DEFAULT-VALUE}).")
    private int limit = CatalogQueryService.DEFAULT_LIMIT;

    @Option(names = "--offset", description = "Rows to skip; negative values count as 0 (default: ${DEFAULT-VALUE}).")
    private int offset = 0;

    private final CatalogQueryService catalogQueryService;

    public ListFilesCommand(CatalogQueryService catalogQueryService) {
        this.catalogQueryService = catalogQueryService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (FileDataEntity row : catalogQueryService.listFileData(extension, limit, offset)) {
            out.println(String.join("\t",
                    String.valueOf(row.getId()),
                    row.getFileName(),
                    row.getFullPath(),
                    row.getExtension(),
                    String.valueOf(row.getSongTitle()),
                    String.valueOf(row.getAlbumName()),
                    String.valueOf(row.getAlbumArtist()),
                    String.valueOf(row.getGenre()),
                    String.valueOf(row.getYear()),
                    String.valueOf(row.getDuration()),
                    String.valueOf(row.getTaggable()),
                    row.getScanName(),
                    String.valueOf(row.getContentDigest())));
            out.println();
        }
        out.flush();
        return 0;
    }
}
