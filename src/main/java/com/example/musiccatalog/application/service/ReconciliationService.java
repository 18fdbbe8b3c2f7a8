package com.example.musiccatalog.application.service;

import com.example.musiccatalog.common.util.HashUtil;
import com.example.musiccatalog.infrastructure.persistence.mapper.FileDataMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds the records of an origin scan that have no counterpart in a destination scan.
 *
 * <p>Two records are the same logical file when their identity keys match: the song title
 * (or the file name for untagged files) concatenated with the album name. The key is a
 * heuristic. Untitled, album-less records with equal file names collide, and any number of
 * matching destination records simply counts as "present".
 *
 * <p>Keys are compared as the md5 of their UTF-8 bytes, stored with each record, so the match is
 * exact: case and accents count whatever the column collation is.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final FileDataMapper fileDataMapper;
    private final ScanSessionService scanSessionService;
    private final StoreRetrier storeRetrier;

    public ReconciliationService(FileDataMapper fileDataMapper,
                                 ScanSessionService scanSessionService,
                                 StoreRetrier storeRetrier) {
        this.fileDataMapper = fileDataMapper;
        this.scanSessionService = scanSessionService;
        this.storeRetrier = storeRetrier;
    }

    public long countDiff(String originScan, String destScan) {
        requireScans(originScan, destScan);
        long count = storeRetrier.execute("file_data.countDiff",
                () -> fileDataMapper.countDiff(originScan, destScan));
        log.info("DIFF_COUNT originScan={} destScan={} count={}", originScan, destScan, count);
        return count;
    }

    /**
     * Full paths of the origin records missing from the destination, in catalogue order.
     */
    public List<String> listDiffPaths(String originScan, String destScan) {
        requireScans(originScan, destScan);
        List<String> paths = storeRetrier.execute("file_data.selectDiffPaths",
                () -> fileDataMapper.selectDiffPaths(originScan, destScan));
        log.info("DIFF_LIST originScan={} destScan={} count={}", originScan, destScan, paths.size());
        return paths;
    }

    public static String identityKeyOf(String songTitle, String fileName, String albumName) {
        String head = songTitle != null ? songTitle : (fileName != null ? fileName : "");
        return head + (albumName != null ? albumName : "");
    }

    public static String identityKeyMd5(String songTitle, String fileName, String albumName) {
        return HashUtil.md5Hex(identityKeyOf(songTitle, fileName, albumName));
    }

    private void requireScans(String originScan, String destScan) {
        scanSessionService.require(originScan);
        scanSessionService.require(destScan);
    }
}
