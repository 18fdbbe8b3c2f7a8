package com.example.musiccatalog.application.service;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccatalog.application.progress.CopyProgressListener;
import com.example.musiccatalog.common.config.AppCopyProperties;
import com.example.musiccatalog.common.exception.BusinessException;
import com.example.musiccatalog.common.exception.CatalogErrorCode;
import com.example.musiccatalog.common.exception.CopyAbortedException;
import com.example.musiccatalog.domain.model.CopyReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class CopyDiffServiceTest {

    @TempDir
    Path workDir;

    private ReconciliationService reconciliationService;
    private AppCopyProperties copyProperties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        reconciliationService = mock(ReconciliationService.class);
        copyProperties = new AppCopyProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void copyDiffShouldCopyExistingFilesAndCountMissingOnes() throws Exception {
        Path source = Files.createDirectories(workDir.resolve("laptop/album"));
        Path first = Files.write(source.resolve("a.mp3"), "aaa".getBytes(StandardCharsets.UTF_8));
        Path third = Files.write(source.resolve("c.flac"), "ccc".getBytes(StandardCharsets.UTF_8));
        String missing = source.resolve("b.mp3").toString();
        when(reconciliationService.listDiffPaths("laptop", "backup"))
                .thenReturn(Arrays.asList(first.toString(), missing, third.toString()));
        copyProperties.setProgressInterval(1);

        Path target = workDir.resolve("out/missing-from-backup");
        List<String> progress = new ArrayList<>();
        List<String> missingReported = new ArrayList<>();
        CopyReport report = newService().copyDiff("laptop", "backup", target, new CopyProgressListener() {
            @Override
            public void onProgress(int copied, int total) {
                progress.add(copied + "/" + total);
            }

            @Override
            public void onMissingSource(String sourcePath) {
                missingReported.add(sourcePath);
            }
        });

        Assertions.assertEquals(3, report.getTotal());
        Assertions.assertEquals(2, report.getCopied());
        Assertions.assertEquals(1, report.getMissing());
        Assertions.assertEquals(Collections.singletonList(missing), report.getMissingPaths());
        Assertions.assertEquals(Collections.singletonList(missing), missingReported);
        Assertions.assertEquals(Arrays.asList("1/3", "2/3"), progress);
        Assertions.assertEquals("aaa", new String(Files.readAllBytes(target.resolve("a.mp3")), StandardCharsets.UTF_8));
        Assertions.assertEquals("ccc", new String(Files.readAllBytes(target.resolve("c.flac")), StandardCharsets.UTF_8));
        Assertions.assertFalse(Files.exists(target.resolve("b.mp3")));
        Assertions.assertEquals(2.0D, meterRegistry.find("catalog.copy.file").tag("result", "copied").counter().count());
        Assertions.assertEquals(1.0D, meterRegistry.find("catalog.copy.file").tag("result", "missing").counter().count());
    }

    @Test
    void copyDiffShouldOverwriteFileWithSameName() throws Exception {
        Path source = Files.write(Files.createDirectories(workDir.resolve("src")).resolve("a.mp3"),
                "new".getBytes(StandardCharsets.UTF_8));
        Path target = Files.createDirectories(workDir.resolve("target"));
        Files.write(target.resolve("a.mp3"), "old".getBytes(StandardCharsets.UTF_8));
        when(reconciliationService.listDiffPaths("laptop", "backup"))
                .thenReturn(Collections.singletonList(source.toString()));

        CopyReport report = newService().copyDiff("laptop", "backup", target, null);

        Assertions.assertEquals(1, report.getCopied());
        Assertions.assertEquals("new", new String(Files.readAllBytes(target.resolve("a.mp3")), StandardCharsets.UTF_8));
    }

    @Test
    void copyDiffShouldAbortBatchWhenTargetCannotBeWritten() throws Exception {
        Path source = Files.createDirectories(workDir.resolve("laptop"));
        Path first = Files.write(source.resolve("a.mp3"), "aaa".getBytes(StandardCharsets.UTF_8));
        Path blocked = Files.write(source.resolve("b.mp3"), "bbb".getBytes(StandardCharsets.UTF_8));
        Path last = Files.write(source.resolve("c.mp3"), "ccc".getBytes(StandardCharsets.UTF_8));
        Path target = Files.createDirectories(workDir.resolve("target"));
        Path occupied = Files.createDirectories(target.resolve("b.mp3"));
        Files.write(occupied.resolve("keep.txt"), "x".getBytes(StandardCharsets.UTF_8));
        when(reconciliationService.listDiffPaths("laptop", "backup"))
                .thenReturn(Arrays.asList(first.toString(), blocked.toString(), last.toString()));

        CopyAbortedException ex = Assertions.assertThrows(CopyAbortedException.class,
                () -> newService().copyDiff("laptop", "backup", target, CopyProgressListener.NONE));

        Assertions.assertEquals(1, ex.getCopiedBeforeAbort());
        Assertions.assertTrue(ex.getMessage().contains(blocked.toString()));
        Assertions.assertTrue(Files.exists(target.resolve("a.mp3")));
        Assertions.assertFalse(Files.exists(target.resolve("c.mp3")));
    }

    @Test
    void copyDiffShouldRejectTargetThatIsAFile() throws Exception {
        Path notAFolder = Files.write(workDir.resolve("target.txt"), "x".getBytes(StandardCharsets.UTF_8));
        when(reconciliationService.listDiffPaths("laptop", "backup")).thenReturn(Collections.<String>emptyList());

        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> newService().copyDiff("laptop", "backup", notAFolder, CopyProgressListener.NONE));

        Assertions.assertEquals(CatalogErrorCode.COPY_TARGET_INVALID, ex.getErrorCode());
    }

    @Test
    void copyDiffShouldNotCreateTargetWhenScanIsUnknown() {
        when(reconciliationService.listDiffPaths("laptop", "typo"))
                .thenThrow(new BusinessException(CatalogErrorCode.SCAN_NOT_FOUND, "Scan typo does not exist."));
        Path target = workDir.resolve("never-created");

        Assertions.assertThrows(BusinessException.class,
                () -> newService().copyDiff("laptop", "typo", target, CopyProgressListener.NONE));

        Assertions.assertFalse(Files.exists(target));
    }

    @Test
    void copyDiffShouldRequireTargetFolder() {
        BusinessException ex = Assertions.assertThrows(BusinessException.class,
                () -> newService().copyDiff("laptop", "backup", null, CopyProgressListener.NONE));

        Assertions.assertEquals(CatalogErrorCode.COPY_TARGET_INVALID, ex.getErrorCode());
        verify(reconciliationService, never()).listDiffPaths("laptop", "backup");
    }

    private CopyDiffService newService() {
        return new CopyDiffService(reconciliationService, copyProperties, beanProvider(meterRegistry));
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
