package com.example.musiccatalog.infrastructure.persistence.model;

import lombok.Data;

@Data
public class ExtensionCountRow {

    private String extension;
    private Long fileCount;
}
