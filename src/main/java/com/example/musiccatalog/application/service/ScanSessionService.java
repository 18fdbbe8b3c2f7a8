package com.example.musiccatalog.application.service;

import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.infrastructure.persistence.entity.ScanEntity;
import com.example.musiccatalog.infrastructure.persistence.mapper.ScanMapper;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle of a scan session row: claimed once at start, completed once at end.
 */
@Service
public class ScanSessionService {

    private static final Logger log = LoggerFactory.getLogger(ScanSessionService.class);

    private final ScanMapper scanMapper;
    private final StoreRetrier storeRetrier;

    public ScanSessionService(ScanMapper scanMapper, StoreRetrier storeRetrier) {
        this.scanMapper = scanMapper;
        this.storeRetrier = storeRetrier;
    }

    public boolean exists(String scanName) {
        Integer count = storeRetrier.execute("scan.exists", () -> scanMapper.countByScanName(scanName));
        return count != null && count > 0;
    }

    /**
     * Claims {@code scanName}. Fails with {@link CatalogErrorCode#SCAN_NAME_CONFLICT} and writes
     * nothing when the name is already taken.
     */
    public ScanEntity open(String scanName, LocalDateTime startTime) {
        if (exists(scanName)) {
            throw conflict(scanName);
        }
        ScanEntity entity = new ScanEntity();
        entity.setScanName(scanName);
        entity.setStartTime(startTime);
        try {
            storeRetrier.runInsert("scan.insert", () -> scanMapper.insert(entity));
        } catch (DuplicateKeyException e) {
            throw conflict(scanName);
        }
        log.info("SCAN_SESSION_OPENED scanName={} id={} startTime={}", scanName, entity.getId(), startTime);
        return entity;
    }

    public void finish(String scanName, LocalDateTime endTime, int processed, int taggable, int errors) {
        int updated = storeRetrier.execute("scan.finish",
                () -> scanMapper.markFinished(scanName, endTime, processed, taggable, errors));
        if (updated == 0) {
            log.warn("SCAN_SESSION_FINISH_REJECTED scanName={} reason=missing-or-already-finished", scanName);
            return;
        }
        log.info("SCAN_SESSION_FINISHED scanName={} endTime={} files={} taggable={} errors={}",
                scanName, endTime, processed, taggable, errors);
    }

    /**
     * Loads a session that later steps depend on, failing with {@link CatalogErrorCode#SCAN_NOT_FOUND}.
     */
    public ScanEntity require(String scanName) {
        ScanEntity entity = storeRetrier.execute("scan.select", () -> scanMapper.selectByScanName(scanName));
        if (entity == null) {
            throw new BusinessException(CatalogErrorCode.SCAN_NOT_FOUND,
                    "Scan " + scanName + " does not exist.");
        }
        if (entity.getEndTime() == null) {
            log.warn("SCAN_SESSION_INCOMPLETE scanName={} startTime={}", scanName, entity.getStartTime());
        }
        return entity;
    }

    public List<ScanEntity> listSessions() {
        return storeRetrier.execute("scan.list", scanMapper::selectAll);
    }

    private BusinessException conflict(String scanName) {
        return new BusinessException(CatalogErrorCode.SCAN_NAME_CONFLICT,
                "Scan name " + scanName + " already exists.");
    }
}
