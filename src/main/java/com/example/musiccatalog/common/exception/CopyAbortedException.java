package com.example.musiccatalog.common.exception;

/**
 * A copy batch stopped because the target could not be written.
 */
public class CopyAbortedException extends RuntimeException {

    private final int copiedBeforeAbort;

    public CopyAbortedException(String message, int copiedBeforeAbort, Throwable cause) {
        super(message, cause);
        this.copiedBeforeAbort = copiedBeforeAbort;
    }

    public int getCopiedBeforeAbort() {
        return copiedBeforeAbort;
    }
}
