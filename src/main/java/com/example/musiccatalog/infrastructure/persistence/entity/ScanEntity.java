package com.example.musiccatalog.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ScanEntity {

    private Long id;

    private String scanName;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private Integer numFiles;

    private Integer numTaggable;

    private Integer numErrors;
}
