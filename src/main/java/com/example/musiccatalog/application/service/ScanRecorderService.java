package com.example.musiccatalog.application.service;

import com.example.musiccatalog.application.progress.ScanProgressListener;
import com.example.musiccatalog.common.config.AppScanProperties;
import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.common.util.HashUtil;
import com.example.musiccatalog.common.util.ReleaseYearParser;
import com.example.musiccatalog.domain.enumtype.FileOutcomeStatus;
import com.example.musiccatalog.domain.model.AudioMetadata;
import com.example.musiccatalog.domain.model.FileOutcome;
import com.example.musiccatalog.domain.model.ScanSummary;
import com.example.musiccatalog.infrastructure.parser.AudioMetadataParser;
import com.example.musiccatalog.infrastructure.persistence.entity.FileDataEntity;
import com.example.musiccatalog.infrastructure.persistence.mapper.FileDataMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Walks a directory tree and writes one {@code file_data} row per catalogued file, committing
 * each row before the next file is attempted. A failing file is counted and skipped; it never
 * stops the walk.
 */
@Service
public class ScanRecorderService {

    private static final Logger log = LoggerFactory.getLogger(ScanRecorderService.class);

    private static final String MDC_SCAN_NAME = "scanName";

    private final ScanSessionService scanSessionService;
    private final FileDataMapper fileDataMapper;
    private final AudioMetadataParser audioMetadataParser;
    private final FileExclusionPolicy fileExclusionPolicy;
    private final StoreRetrier storeRetrier;
    private final AppScanProperties appScanProperties;
    private final MeterRegistry meterRegistry;

    public ScanRecorderService(ScanSessionService scanSessionService,
                               FileDataMapper fileDataMapper,
                               AudioMetadataParser audioMetadataParser,
                               FileExclusionPolicy fileExclusionPolicy,
                               StoreRetrier storeRetrier,
                               AppScanProperties appScanProperties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.scanSessionService = scanSessionService;
        this.fileDataMapper = fileDataMapper;
        this.audioMetadataParser = audioMetadataParser;
        this.fileExclusionPolicy = fileExclusionPolicy;
        this.storeRetrier = storeRetrier;
        this.appScanProperties = appScanProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public ScanSummary startScan(Path rootPath, String scanName, ScanProgressListener listener) {
        if (!StringUtils.hasText(scanName)) {
            throw new BusinessException(CatalogErrorCode.SCAN_NAME_REQUIRED, "A scan name is required.");
        }
        if (rootPath == null || !Files.isDirectory(rootPath)) {
            throw new BusinessException(CatalogErrorCode.SCAN_ROOT_INVALID,
                    "Scan path " + rootPath + " is not a directory.");
        }
        Path walkRoot = resolveRoot(rootPath);
        ScanProgressListener progress = listener == null ? ScanProgressListener.NONE : listener;

        LocalDateTime startTime = LocalDateTime.now();
        scanSessionService.open(scanName, startTime);

        MDC.put(MDC_SCAN_NAME, scanName);
        long startNanos = System.nanoTime();
        try {
            log.info("SCAN_START scanName={} root={}", scanName, walkRoot);
            ScanCounters counters = new ScanCounters();
            walk(walkRoot, scanName, counters, progress);

            LocalDateTime endTime = LocalDateTime.now();
            scanSessionService.finish(scanName, endTime, counters.processed, counters.taggable, counters.errors);
            recordDuration(System.nanoTime() - startNanos);
            log.info("SCAN_FINISH scanName={} root={} processed={} taggable={} errors={} missingDigests={} skipped={}",
                    scanName, walkRoot, counters.processed, counters.taggable, counters.errors,
                    counters.missingDigests, counters.skipped);
            return new ScanSummary(scanName, walkRoot.toString(), counters.processed, counters.taggable,
                    counters.errors, counters.missingDigests, startTime, endTime);
        } finally {
            MDC.remove(MDC_SCAN_NAME);
        }
    }

    private void walk(Path rootPath, String scanName, ScanCounters counters, ScanProgressListener progress) {
        try {
            Files.walkFileTree(rootPath, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!isCataloguable(file, attrs)) {
                        return FileVisitResult.CONTINUE;
                    }
                    FileOutcome outcome = processFile(file, scanName);
                    counters.accept(outcome);
                    recordOutcome(outcome.getStatus());
                    if (outcome.getStatus() == FileOutcomeStatus.FAILED) {
                        progress.onFileFailed(outcome.getPath(), outcome.getReason());
                    } else if (outcome.getStatus() == FileOutcomeStatus.RECORDED
                            && counters.processed % progressInterval() == 0) {
                        log.info("SCAN_PROGRESS scanName={} processed={} taggable={} errors={}",
                                scanName, counters.processed, counters.taggable, counters.errors);
                        progress.onProgress(scanName, counters.processed);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    FileOutcome outcome = FileOutcome.failed(file.toString(), describe(exc));
                    counters.accept(outcome);
                    recordOutcome(outcome.getStatus());
                    log.warn("Scan entry unreadable, scanName={}, path={}, reason={}",
                            scanName, file, outcome.getReason());
                    progress.onFileFailed(outcome.getPath(), outcome.getReason());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Scan walk failed under " + rootPath, e);
        }
    }

    /**
     * The walk starts from the real directory so that a root given as a symbolic link is entered.
     * Links below the root are not followed.
     */
    private Path resolveRoot(Path rootPath) {
        try {
            return rootPath.toRealPath();
        } catch (IOException e) {
            throw new BusinessException(CatalogErrorCode.SCAN_ROOT_INVALID,
                    "Scan path " + rootPath + " cannot be resolved: " + describe(e));
        }
    }

    private boolean isCataloguable(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile()) {
            return true;
        }
        return attrs.isSymbolicLink() && Files.isRegularFile(file);
    }

    FileOutcome processFile(Path file, String scanName) {
        String fullPath = file.toString();
        Path namePath = file.getFileName();
        String fileName = namePath == null ? fullPath : namePath.toString();
        if (fileExclusionPolicy.isExcluded(fileName)) {
            return FileOutcome.skipped(fullPath, "excluded");
        }
        try {
            String digest = digestOrNull(file);
            File ioFile = file.toFile();
            boolean taggable = audioMetadataParser.isSupported(ioFile);
            AudioMetadata metadata = taggable ? audioMetadataParser.parse(ioFile) : null;

            FileDataEntity entity = buildFileDataEntity(scanName, fileName, fullPath, taggable, metadata, digest);
            storeRetrier.runInsert("file_data.insert", () -> fileDataMapper.insert(entity));
            return FileOutcome.recorded(fullPath, taggable, digest == null);
        } catch (Exception e) {
            if (storeRetrier.isTransient(e)) {
                // the store is gone, not this file
                throw (RuntimeException) e;
            }
            String reason = describe(e);
            log.warn("Scan file failed, scanName={}, path={}, reason={}", scanName, fullPath, reason);
            log.debug("Scan file failure detail, path={}", fullPath, e);
            return FileOutcome.failed(fullPath, reason);
        }
    }

    private String digestOrNull(Path file) {
        try {
            return HashUtil.sha256Hex(file, appScanProperties.getHashBufferSize());
        } catch (IOException e) {
            log.warn("Could not hash {}: {}", file, describe(e));
            return null;
        }
    }

    private FileDataEntity buildFileDataEntity(String scanName,
                                               String fileName,
                                               String fullPath,
                                               boolean taggable,
                                               AudioMetadata metadata,
                                               String digest) {
        FileDataEntity entity = new FileDataEntity();
        entity.setFileName(fileName);
        entity.setFullPath(fullPath);
        entity.setFullPathMd5(HashUtil.md5Hex(fullPath));
        entity.setExtension(FileExclusionPolicy.extensionOf(fileName));
        entity.setTaggable(taggable);
        entity.setScanName(scanName);
        entity.setContentDigest(digest);
        if (metadata != null) {
            entity.setSongTitle(metadata.getTitle());
            entity.setAlbumName(metadata.getAlbum());
            entity.setAlbumArtist(metadata.getAlbumArtist());
            entity.setGenre(metadata.getGenre());
            entity.setYear(ReleaseYearParser.parse(metadata.getRawYear()));
            entity.setDuration(metadata.getDurationSec());
        }
        entity.setIdentityKeyMd5(ReconciliationService.identityKeyMd5(
                entity.getSongTitle(), entity.getFileName(), entity.getAlbumName()));
        return entity;
    }

    private int progressInterval() {
        return Math.max(1, appScanProperties.getProgressInterval());
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        return StringUtils.hasText(message) ? e.getClass().getSimpleName() + ": " + message : e.getClass().getSimpleName();
    }

    private void recordOutcome(FileOutcomeStatus status) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("catalog.scan.file", "outcome", status.name().toLowerCase(Locale.ROOT)).increment();
        } catch (Exception ex) {
            log.debug("Scan metric counter failed, outcome={}", status, ex);
        }
    }

    private void recordDuration(long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer("catalog.scan.duration").record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Scan metric timer failed", ex);
        }
    }

    private static final class ScanCounters {

        private int processed;
        private int taggable;
        private int errors;
        private int missingDigests;
        private int skipped;

        private void accept(FileOutcome outcome) {
            switch (outcome.getStatus()) {
                case RECORDED:
                    processed++;
                    if (outcome.isTaggable()) {
                        taggable++;
                    }
                    if (outcome.isDigestMissing()) {
                        missingDigests++;
                    }
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                case FAILED:
                default:
                    errors++;
                    break;
            }
        }
    }
}
