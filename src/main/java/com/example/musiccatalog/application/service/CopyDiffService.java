package com.example.musiccatalog.application.service;

import com.example.musiccatalog.application.progress.CopyProgressListener;
import com.example.musiccatalog.common.config.AppCopyProperties;
import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.common.exception.CopyAbortedException;
import com.example.musiccatalog.domain.model.CopyReport;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Copies the files of a scan diff into one flat folder.
 */
@Service
public class CopyDiffService {

    private static final Logger log = LoggerFactory.getLogger(CopyDiffService.class);

    private final ReconciliationService reconciliationService;
    private final AppCopyProperties appCopyProperties;
    private final MeterRegistry meterRegistry;

    public CopyDiffService(ReconciliationService reconciliationService,
                           AppCopyProperties appCopyProperties,
                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.reconciliationService = reconciliationService;
        this.appCopyProperties = appCopyProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public CopyReport copyDiff(String originScan, String destScan, Path targetFolder, CopyProgressListener listener) {
        CopyProgressListener progress = listener == null ? CopyProgressListener.NONE : listener;
        if (targetFolder == null) {
            throw new BusinessException(CatalogErrorCode.COPY_TARGET_INVALID, "A target folder is required.");
        }
        List<String> sourcePaths = reconciliationService.listDiffPaths(originScan, destScan);
        ensureTargetFolder(targetFolder);

        int total = sourcePaths.size();
        int copied = 0;
        List<String> missingPaths = new ArrayList<>();
        int interval = Math.max(1, appCopyProperties.getProgressInterval());
        log.info("COPY_DIFF_START originScan={} destScan={} target={} total={}",
                originScan, destScan, targetFolder, total);

        for (String sourcePath : sourcePaths) {
            Path source = Paths.get(sourcePath);
            if (!Files.exists(source)) {
                markMissing(sourcePath, missingPaths, progress);
                continue;
            }
            Path target = targetFolder.resolve(source.getFileName().toString());
            try {
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            } catch (NoSuchFileException e) {
                if (source.toString().equals(e.getFile())) {
                    markMissing(sourcePath, missingPaths, progress);
                    continue;
                }
                throw abort(sourcePath, target, copied, e);
            } catch (IOException e) {
                throw abort(sourcePath, target, copied, e);
            }
            copied++;
            recordCopy("copied");
            if (copied % interval == 0) {
                log.info("COPY_DIFF_PROGRESS copied={} total={}", copied, total);
                progress.onProgress(copied, total);
            }
        }

        log.info("COPY_DIFF_FINISH originScan={} destScan={} copied={} missing={} total={}",
                originScan, destScan, copied, missingPaths.size(), total);
        return new CopyReport(total, copied, missingPaths.size(), missingPaths, targetFolder.toString());
    }

    private void ensureTargetFolder(Path targetFolder) {
        try {
            Files.createDirectories(targetFolder);
        } catch (FileAlreadyExistsException e) {
            throw new BusinessException(CatalogErrorCode.COPY_TARGET_INVALID,
                    "Target " + targetFolder + " exists and is not a directory.");
        } catch (IOException e) {
            throw new BusinessException(CatalogErrorCode.COPY_TARGET_INVALID,
                    "Target folder " + targetFolder + " cannot be created: " + e.getMessage());
        }
    }

    private void markMissing(String sourcePath, List<String> missingPaths, CopyProgressListener progress) {
        missingPaths.add(sourcePath);
        recordCopy("missing");
        log.warn("COPY_DIFF_MISSING source={}", sourcePath);
        progress.onMissingSource(sourcePath);
    }

    private CopyAbortedException abort(String sourcePath, Path target, int copied, IOException e) {
        log.error("COPY_DIFF_ABORTED source={} target={} copied={}", sourcePath, target, copied, e);
        return new CopyAbortedException("Copy of " + sourcePath + " to " + target + " failed: " + e.getMessage(), copied, e);
    }

    private void recordCopy(String result) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("catalog.copy.file", "result", result).increment();
        } catch (Exception ex) {
            log.debug("Copy metric counter failed, result={}", result, ex);
        }
    }
}
