package com.example.musiccatalog.infrastructure.persistence.mapper;

import com.example.musiccatalog.infrastructure.persistence.entity.FileDataEntity;
import com.example.musiccatalog.infrastructure.persistence.model.ExtensionCountRow;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface FileDataMapper {

    /**
     * Origin rows without a destination row of the same identity key. Several destination
     * matches still count once, as present.
     */
    String DIFF_FROM = "FROM file_data o "
            + "LEFT JOIN file_data d ON d.scan_name = #{destScan} AND d.identity_key_md5 = o.identity_key_md5 "
            + "WHERE o.scan_name = #{originScan} AND d.id IS NULL";

    String COLUMNS = "id, file_name, full_path, full_path_md5, extension, song_title, album_name, album_artist, "
            + "genre, year, duration, taggable, scan_name, content_digest, identity_key_md5";

    @Insert("INSERT INTO file_data(file_name, full_path, full_path_md5, extension, song_title, album_name, "
            + "album_artist, genre, year, duration, taggable, scan_name, content_digest, identity_key_md5) "
            + "VALUES(#{fileName}, #{fullPath}, #{fullPathMd5}, #{extension}, #{songTitle}, #{albumName}, "
            + "#{albumArtist}, #{genre}, #{year}, #{duration}, #{taggable}, #{scanName}, #{contentDigest}, "
            + "#{identityKeyMd5})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(FileDataEntity entity);

    @Select("SELECT COUNT(*) FROM file_data WHERE scan_name = #{scanName}")
    long countByScanName(@Param("scanName") String scanName);

    @Select("SELECT COUNT(*) " + DIFF_FROM)
    long countDiff(@Param("originScan") String originScan, @Param("destScan") String destScan);

    @Select("SELECT o.full_path " + DIFF_FROM + " ORDER BY o.id")
    List<String> selectDiffPaths(@Param("originScan") String originScan, @Param("destScan") String destScan);

    @Select("<script>"
            + "SELECT extension, COUNT(*) AS file_count FROM file_data "
            + "<where>"
            + "<if test='scanName != null'>scan_name = #{scanName}</if>"
            + "</where>"
            + " GROUP BY extension ORDER BY file_count DESC, extension"
            + "</script>")
    List<ExtensionCountRow> selectExtensionCounts(@Param("scanName") String scanName);

    @Select("SELECT " + COLUMNS + " FROM file_data WHERE extension = #{extension} "
            + "ORDER BY file_name DESC, id LIMIT #{limit} OFFSET #{offset}")
    List<FileDataEntity> selectByExtension(@Param("extension") String extension,
                                           @Param("limit") int limit,
                                           @Param("offset") int offset);
}
