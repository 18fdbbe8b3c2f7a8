package com.example.musiccatalog.domain.model;

import com.example.musiccatalog.domain.enumtype.FileOutcomeStatus;

/**
 * Result of one attempt to catalogue a single file.
 */
public final class FileOutcome {

    private final FileOutcomeStatus status;
    private final String path;
    private final boolean taggable;
    private final boolean digestMissing;
    private final String reason;

    private FileOutcome(FileOutcomeStatus status, String path, boolean taggable, boolean digestMissing, String reason) {
        this.status = status;
        this.path = path;
        this.taggable = taggable;
        this.digestMissing = digestMissing;
        this.reason = reason;
    }

    public static FileOutcome recorded(String path, boolean taggable, boolean digestMissing) {
        return new FileOutcome(FileOutcomeStatus.RECORDED, path, taggable, digestMissing, null);
    }

    public static FileOutcome skipped(String path, String reason) {
        return new FileOutcome(FileOutcomeStatus.SKIPPED, path, false, false, reason);
    }

    public static FileOutcome failed(String path, String reason) {
        return new FileOutcome(FileOutcomeStatus.FAILED, path, false, false, reason);
    }

    public FileOutcomeStatus getStatus() {
        return status;
    }

    public String getPath() {
        return path;
    }

    public boolean isTaggable() {
        return taggable;
    }

    public boolean isDigestMissing() {
        return digestMissing;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return status + "(" + path + (reason == null ? "" : ": " + reason) + ")";
    }
}
