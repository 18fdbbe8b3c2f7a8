package com.example.musiccatalog.application.progress;

public interface CopyProgressListener {

    CopyProgressListener NONE = new CopyProgressListener() {
        @Override
        public void onProgress(int copied, int total) {
        }

        @Override
        public void onMissingSource(String sourcePath) {
        }
    };

    void onProgress(int copied, int total);

    void onMissingSource(String sourcePath);
}
