package com.example.musiccatalog.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccatalog.common.config.AppStoreProperties;
import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.infrastructure.persistence.entity.ScanEntity;
import com.example.musiccatalog.infrastructure.persistence.mapper.ScanMapper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;

class ScanSessionServiceTest {

    private ScanMapper scanMapper;
    private ScanSessionService scanSessionService;

    @BeforeEach
    void setUp() {
        scanMapper = mock(ScanMapper.class);
        AppStoreProperties storeProperties = new AppStoreProperties();
        storeProperties.setRetryBackoffMs(0);
        scanSessionService = new ScanSessionService(scanMapper, new StoreRetrier(storeProperties));
    }

    @Test
    void openShouldInsertSessionWhenNameIsFree() {
        LocalDateTime start = LocalDateTime.of(2024, 3, 1, 10, 0);
        when(scanMapper.countByScanName("library-2024")).thenReturn(0);

        ScanEntity entity = scanSessionService.open("library-2024", start);

        Assertions.assertEquals("library-2024", entity.getScanName());
        Assertions.assertEquals(start, entity.getStartTime());
        verify(scanMapper).insert(entity);
    }

    @Test
    void openShouldRejectExistingNameWithoutWriting() {
        when(scanMapper.countByScanName("library-2024")).thenReturn(1);

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> scanSessionService.open("library-2024", LocalDateTime.now()));

        Assertions.assertEquals(CatalogErrorCode.SCAN_NAME_CONFLICT, ex.getErrorCode());
        Assertions.assertEquals(CatalogErrorCode.SCAN_NAME_CONFLICT.getUserAction(), ex.getUserAction());
        verify(scanMapper, never()).insert(any(ScanEntity.class));
    }

    @Test
    void openShouldTreatUniqueKeyRaceAsConflict() {
        when(scanMapper.countByScanName("library-2024")).thenReturn(0);
        when(scanMapper.insert(any(ScanEntity.class))).thenThrow(new DuplicateKeyException("uk_scans_scan_name"));

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> scanSessionService.open("library-2024", LocalDateTime.now()));

        Assertions.assertEquals(CatalogErrorCode.SCAN_NAME_CONFLICT, ex.getErrorCode());
    }

    @Test
    void openShouldKeepSessionWhoseInsertWasCommittedBeforeConnectionDropped() {
        when(scanMapper.countByScanName("library-2024")).thenReturn(0);
        when(scanMapper.insert(any(ScanEntity.class)))
                .thenThrow(new TransientDataAccessResourceException("Communications link failure"))
                .thenThrow(new DuplicateKeyException("uk_scans_scan_name"));

        ScanEntity entity = scanSessionService.open("library-2024", LocalDateTime.now());

        Assertions.assertEquals("library-2024", entity.getScanName());
        verify(scanMapper, times(2)).insert(entity);
    }

    @Test
    void finishShouldWriteEndTimeAndCounters() {
        LocalDateTime end = LocalDateTime.of(2024, 3, 1, 11, 0);
        when(scanMapper.markFinished("library-2024", end, 10, 7, 2)).thenReturn(1);

        scanSessionService.finish("library-2024", end, 10, 7, 2);

        verify(scanMapper).markFinished(eq("library-2024"), eq(end), eq(10), eq(7), eq(2));
    }

    @Test
    void requireShouldFailForUnknownScan() {
        when(scanMapper.selectByScanName("nope")).thenReturn(null);

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> scanSessionService.require("nope"));

        Assertions.assertEquals(CatalogErrorCode.SCAN_NOT_FOUND, ex.getErrorCode());
        verify(scanMapper, never()).markFinished(any(), any(), anyInt(), anyInt(), anyInt());
    }

    @Test
    void requireShouldAcceptIncompleteScan() {
        ScanEntity incomplete = new ScanEntity();
        incomplete.setScanName("interrupted");
        incomplete.setStartTime(LocalDateTime.now());
        when(scanMapper.selectByScanName("interrupted")).thenReturn(incomplete);

        Assertions.assertSame(incomplete, scanSessionService.require("interrupted"));
    }
}
