package com.example.musiccatalog.infrastructure.parser;

import com.example.musiccatalog.domain.model.AudioMetadata;
import java.io.File;

public interface AudioMetadataParser {

    /**
     * Whether the file's container format is one this parser can read tags from.
     */
    boolean isSupported(File audioFile);

    AudioMetadata parse(File audioFile) throws Exception;
}
