package com.example.musiccatalog.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class FileDataEntity {

    private Long id;

    private String fileName;

    private String fullPath;

    private String fullPathMd5;

    private String extension;

    private String songTitle;

    private String albumName;

    private String albumArtist;

    private String genre;

    private Integer year;

    private Double duration;

    private Boolean taggable;

    private String scanName;

    private String contentDigest;

    /**
     * md5 of the reconciliation identity key, see {@code ReconciliationService#identityKeyOf}.
     */
    private String identityKeyMd5;
}
