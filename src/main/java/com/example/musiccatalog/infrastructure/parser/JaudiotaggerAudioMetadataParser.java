package com.example.musiccatalog.infrastructure.parser;

import com.example.musiccatalog.common.config.AppScanProperties;
import com.example.musiccatalog.domain.model.AudioMetadata;
import java.io.File;
import java.util.Locale;
import java.util.Set;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private final Set<String> supportedExtensions;

    public JaudiotaggerAudioMetadataParser(AppScanProperties appScanProperties) {
        this.supportedExtensions = appScanProperties.normalizedTaggableExtensions();
    }

    @Override
    public boolean isSupported(File audioFile) {
        if (audioFile == null) {
            return false;
        }
        String name = audioFile.getName();
        int idx = name.lastIndexOf('.');
        if (idx < 0 || idx >= name.length() - 1) {
            return false;
        }
        return supportedExtensions.contains(name.substring(idx + 1).toLowerCase(Locale.ROOT));
    }

    @Override
    public AudioMetadata parse(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        metadata.setAlbumArtist(firstNonNull(
                safeTagValue(tag, FieldKey.ALBUM_ARTIST),
                safeTagValue(tag, FieldKey.ARTIST)));
        metadata.setGenre(safeTagValue(tag, FieldKey.GENRE));
        metadata.setRawYear(safeTagValue(tag, FieldKey.YEAR));

        if (header != null) {
            metadata.setDurationSec(header.getPreciseTrackLength());
        }
        return metadata;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (KeyNotFoundException | UnsupportedOperationException e) {
            // field has no mapping in this container's tag format
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
