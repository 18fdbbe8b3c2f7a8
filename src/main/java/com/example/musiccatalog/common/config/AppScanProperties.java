package com.example.musiccatalog.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    /**
     * Extensions that are never catalogued (property lists, thumbnails).
     */
    private List<String> excludedExtensions = new ArrayList<>(Arrays.asList("plist", "jpg"));

    /**
     * File name suffixes of per-directory system metadata files.
     */
    private List<String> excludedNameSuffixes = new ArrayList<>(Arrays.asList(".DS_Store"));

    /**
     * Extensions the tag reader is asked to parse.
     */
    private List<String> taggableExtensions = new ArrayList<>(Arrays.asList(
            "mp3", "flac", "m4a", "m4b", "m4p", "mp4", "ogg", "oga", "wav", "wma", "aif", "aiff", "aifc", "dsf"));

    private int progressInterval = 500;

    private int hashBufferSize = 4096;

    public Set<String> normalizedExcludedExtensions() {
        return normalizeExtensions(excludedExtensions);
    }

    public Set<String> normalizedTaggableExtensions() {
        return normalizeExtensions(taggableExtensions);
    }

    private Set<String> normalizeExtensions(List<String> values) {
        if (values == null) {
            return new LinkedHashSet<>();
        }
        return values.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
