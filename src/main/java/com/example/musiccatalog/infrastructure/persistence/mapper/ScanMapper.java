package com.example.musiccatalog.infrastructure.persistence.mapper;

import com.example.musiccatalog.infrastructure.persistence.entity.ScanEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ScanMapper {

    @Select("SELECT COUNT(*) FROM scans WHERE scan_name = #{scanName}")
    int countByScanName(@Param("scanName") String scanName);

    @Select("SELECT id, scan_name, start_time, end_time, num_files, num_taggable, num_errors "
            + "FROM scans WHERE scan_name = #{scanName}")
    ScanEntity selectByScanName(@Param("scanName") String scanName);

    @Select("SELECT id, scan_name, start_time, end_time, num_files, num_taggable, num_errors "
            + "FROM scans ORDER BY start_time DESC, id DESC")
    List<ScanEntity> selectAll();

    @Insert("INSERT INTO scans(scan_name, start_time) VALUES(#{scanName}, #{startTime})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ScanEntity entity);

    @Update("UPDATE scans SET end_time = #{endTime}, num_files = #{numFiles}, "
            + "num_taggable = #{numTaggable}, num_errors = #{numErrors} "
            + "WHERE scan_name = #{scanName} AND end_time IS NULL")
    int markFinished(@Param("scanName") String scanName,
                     @Param("endTime") LocalDateTime endTime,
                     @Param("numFiles") int numFiles,
                     @Param("numTaggable") int numTaggable,
                     @Param("numErrors") int numErrors);
}
