package com.example.musiccatalog.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanSummary {

    private String scanName;

    private String rootPath;

    private int processed;

    private int taggable;

    private int errors;

    /**
     * Recorded files whose content could not be read for hashing.
     */
    private int missingDigests;

    private LocalDateTime startTime;

    private LocalDateTime endTime;
}
