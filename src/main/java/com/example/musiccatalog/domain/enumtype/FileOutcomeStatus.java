package com.example.musiccatalog.domain.enumtype;

public enum FileOutcomeStatus {
    RECORDED,
    SKIPPED,
    FAILED
}
