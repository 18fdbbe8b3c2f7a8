package com.example.musiccatalog.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CopyReport {

    private int total;

    private int copied;

    private int missing;

    private List<String> missingPaths;

    private String targetFolder;
}
