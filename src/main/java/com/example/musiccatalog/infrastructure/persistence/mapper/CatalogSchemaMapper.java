package com.example.musiccatalog.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface CatalogSchemaMapper {

    @Update("CREATE TABLE IF NOT EXISTS scans ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
            + "scan_name VARCHAR(255) NOT NULL, "
            + "start_time TIMESTAMP NOT NULL, "
            + "end_time TIMESTAMP NULL, "
            + "num_files INT NULL, "
            + "num_taggable INT NULL, "
            + "num_errors INT NULL, "
            + "CONSTRAINT uk_scans_scan_name UNIQUE (scan_name))")
    void createScansTable();

    @Update("CREATE TABLE IF NOT EXISTS file_data ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
            + "file_name VARCHAR(255) NOT NULL, "
            + "full_path VARCHAR(4096) NOT NULL, "
            + "full_path_md5 CHAR(32) NOT NULL, "
            + "extension VARCHAR(32) NOT NULL, "
            + "song_title VARCHAR(255) NULL, "
            + "album_name VARCHAR(255) NULL, "
            + "album_artist VARCHAR(255) NULL, "
            + "genre VARCHAR(255) NULL, "
            + "year INT NULL, "
            + "duration DOUBLE NULL, "
            + "taggable BOOLEAN NOT NULL, "
            + "scan_name VARCHAR(255) NOT NULL, "
            + "content_digest CHAR(64) NULL, "
            + "identity_key_md5 CHAR(32) NOT NULL, "
            + "CONSTRAINT uk_file_data_scan_path UNIQUE (scan_name, full_path_md5), "
            + "KEY idx_file_data_scan_identity (scan_name, identity_key_md5))")
    void createFileDataTable();
}
