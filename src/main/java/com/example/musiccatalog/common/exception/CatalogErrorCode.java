package com.example.musiccatalog.common.exception;

/**
 * Precondition failures an operator can correct, each with the hint printed under the message.
 */
public enum CatalogErrorCode {

    SCAN_NAME_CONFLICT("Choose a different --scan-name; a scan name can only be used once."),
    SCAN_NAME_REQUIRED("Pass a non-empty --scan-name."),
    SCAN_ROOT_INVALID("Pass an existing directory with --path."),
    SCAN_NOT_FOUND("Run list-scans to see the recorded scan names."),
    COPY_TARGET_INVALID("Pass a directory path with --folder.");

    private final String userAction;

    CatalogErrorCode(String userAction) {
        this.userAction = userAction;
    }

    public String getUserAction() {
        return userAction;
    }
}
