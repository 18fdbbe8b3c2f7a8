package com.example.musiccatalog.domain.model;

import lombok.Data;

@Data
public class AudioMetadata {

    private String title;

    private String album;

    private String albumArtist;

    private String genre;

    /**
     * Year field exactly as stored in the tag, e.g. "2015-06-01".
     */
    private String rawYear;

    private Double durationSec;
}
