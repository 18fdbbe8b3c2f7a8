package com.example.musiccatalog.application.progress;

/**
 * Receives scan progress as files are catalogued.
 */
public interface ScanProgressListener {

    ScanProgressListener NONE = new ScanProgressListener() {
        @Override
        public void onProgress(String scanName, int processed) {
        }
    };

    /**
     * Called every {@code app.scan.progress-interval} recorded files with the cumulative count.
     */
    void onProgress(String scanName, int processed);

    default void onFileFailed(String path, String reason) {
    }
}
