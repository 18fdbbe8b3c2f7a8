package com.example.musiccatalog.application.service;

import com.example.musiccatalog.common.config.AppScanProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Decides which walked files never reach the catalog: thumbnails, property lists and
 * per-directory system metadata files.
 */
@Component
public class FileExclusionPolicy {

    private final Set<String> excludedExtensions;
    private final List<String> excludedNameSuffixes;

    public FileExclusionPolicy(AppScanProperties appScanProperties) {
        this.excludedExtensions = appScanProperties.normalizedExcludedExtensions();
        this.excludedNameSuffixes = new ArrayList<>();
        if (appScanProperties.getExcludedNameSuffixes() != null) {
            for (String suffix : appScanProperties.getExcludedNameSuffixes()) {
                if (suffix != null && !suffix.trim().isEmpty()) {
                    excludedNameSuffixes.add(suffix.trim());
                }
            }
        }
    }

    public boolean isExcluded(String fileName) {
        if (fileName == null) {
            return true;
        }
        for (String suffix : excludedNameSuffixes) {
            if (fileName.endsWith(suffix)) {
                return true;
            }
        }
        return excludedExtensions.contains(extensionOf(fileName));
    }

    /**
     * Lower-cased text after the last dot, without the dot. Names without a dot, and
     * dot-files such as ".profile", have no extension.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0 || idx >= fileName.length() - 1) {
            return "";
        }
        return fileName.substring(idx + 1).toLowerCase(Locale.ROOT);
    }
}
