package com.example.musiccatalog.application.service;

import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.infrastructure.persistence.entity.FileDataEntity;
import com.example.musiccatalog.infrastructure.persistence.entity.ScanEntity;
import com.example.musiccatalog.infrastructure.persistence.mapper.FileDataMapper;
import com.example.musiccatalog.infrastructure.persistence.model.ExtensionCountRow;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class CatalogQueryService {

    public static final int DEFAULT_LIMIT = 25;

    public static final int MAX_LIMIT = 1000;

    private final FileDataMapper fileDataMapper;
    private final ScanSessionService scanSessionService;
    private final StoreRetrier storeRetrier;

    public CatalogQueryService(FileDataMapper fileDataMapper,
                               ScanSessionService scanSessionService,
                               StoreRetrier storeRetrier) {
        this.fileDataMapper = fileDataMapper;
        this.scanSessionService = scanSessionService;
        this.storeRetrier = storeRetrier;
    }

    /**
     * Record counts per extension, largest first. With a scan name the counts are scoped to
     * that scan and a scan without records is reported as {@link CatalogErrorCode#SCAN_NOT_FOUND}.
     */
    public List<ExtensionCountRow> listExtensions(String scanName) {
        String scope = StringUtils.hasText(scanName) ? scanName.trim() : null;
        if (scope != null) {
            long count = storeRetrier.execute("file_data.countByScan", () -> fileDataMapper.countByScanName(scope));
            if (count == 0) {
                throw new BusinessException(CatalogErrorCode.SCAN_NOT_FOUND,
                        "No records found for scan_name: " + scope);
            }
        }
        List<ExtensionCountRow> rows = storeRetrier.execute("file_data.extensionCounts",
                () -> fileDataMapper.selectExtensionCounts(scope));
        return rows == null ? Collections.<ExtensionCountRow>emptyList() : rows;
    }

    /**
     * One page of records with the given extension. A limit below 1 means {@link #DEFAULT_LIMIT};
     * larger limits are capped at {@link #MAX_LIMIT}. A negative offset reads from the start.
     */
    public List<FileDataEntity> listFileData(String extension, int limit, int offset) {
        String normalized = extension == null ? "" : extension.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
        int safeLimit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int safeOffset = Math.max(0, offset);
        List<FileDataEntity> rows = storeRetrier.execute("file_data.byExtension",
                () -> fileDataMapper.selectByExtension(normalized, safeLimit, safeOffset));
        return rows == null ? Collections.<FileDataEntity>emptyList() : rows;
    }

    public List<ScanEntity> listScans() {
        List<ScanEntity> rows = scanSessionService.listSessions();
        return rows == null ? Collections.<ScanEntity>emptyList() : rows;
    }
}
