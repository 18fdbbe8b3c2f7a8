package com.example.musiccatalog.application.service;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccatalog.common.config.AppStoreProperties;
import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.infrastructure.persistence.entity.ScanEntity;
import com.example.musiccatalog.infrastructure.persistence.mapper.FileDataMapper;
import com.example.musiccatalog.infrastructure.persistence.mapper.ScanMapper;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReconciliationServiceTest {

    private ScanMapper scanMapper;
    private FileDataMapper fileDataMapper;
    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        scanMapper = mock(ScanMapper.class);
        fileDataMapper = mock(FileDataMapper.class);
        AppStoreProperties storeProperties = new AppStoreProperties();
        storeProperties.setRetryBackoffMs(0);
        StoreRetrier storeRetrier = new StoreRetrier(storeProperties);
        reconciliationService = new ReconciliationService(
                fileDataMapper, new ScanSessionService(scanMapper, storeRetrier), storeRetrier);
    }

    @Test
    void countDiffShouldDelegateToAntiJoin() {
        when(scanMapper.selectByScanName("laptop")).thenReturn(finishedScan("laptop"));
        when(scanMapper.selectByScanName("backup")).thenReturn(finishedScan("backup"));
        when(fileDataMapper.countDiff("laptop", "backup")).thenReturn(42L);

        Assertions.assertEquals(42L, reconciliationService.countDiff("laptop", "backup"));
    }

    @Test
    void listDiffPathsShouldBeRepeatable() {
        when(scanMapper.selectByScanName("laptop")).thenReturn(finishedScan("laptop"));
        when(scanMapper.selectByScanName("backup")).thenReturn(finishedScan("backup"));
        when(fileDataMapper.selectDiffPaths("laptop", "backup"))
                .thenReturn(Arrays.asList("/music/b.mp3", "/music/c.flac"));

        List<String> first = reconciliationService.listDiffPaths("laptop", "backup");
        List<String> second = reconciliationService.listDiffPaths("laptop", "backup");

        Assertions.assertEquals(Arrays.asList("/music/b.mp3", "/music/c.flac"), first);
        Assertions.assertEquals(first, second);
    }

    @Test
    void shouldRejectUnknownDestinationScan() {
        when(scanMapper.selectByScanName("laptop")).thenReturn(finishedScan("laptop"));
        when(scanMapper.selectByScanName("typo")).thenReturn(null);

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> reconciliationService.countDiff("laptop", "typo"));

        Assertions.assertEquals(CatalogErrorCode.SCAN_NOT_FOUND, ex.getErrorCode());
        verify(fileDataMapper, never()).countDiff(anyString(), anyString());
    }

    @Test
    void identityKeyShouldUseTitleOrFileNameFollowedByAlbum() {
        Assertions.assertEquals("AX", ReconciliationService.identityKeyOf("A", "a.mp3", "X"));
        Assertions.assertEquals("b.mp3Y", ReconciliationService.identityKeyOf(null, "b.mp3", "Y"));
        Assertions.assertEquals("b.mp3", ReconciliationService.identityKeyOf(null, "b.mp3", null));
        Assertions.assertEquals("", ReconciliationService.identityKeyOf(null, null, null));
        Assertions.assertNotEquals(ReconciliationService.identityKeyMd5("Song", "s.mp3", "Album"),
                ReconciliationService.identityKeyMd5("song", "s.mp3", "ALBUM"));
    }

    private ScanEntity finishedScan(String name) {
        ScanEntity entity = new ScanEntity();
        entity.setScanName(name);
        entity.setStartTime(LocalDateTime.of(2024, 1, 1, 9, 0));
        entity.setEndTime(LocalDateTime.of(2024, 1, 1, 10, 0));
        return entity;
    }
}
