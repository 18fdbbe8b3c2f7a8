package com.example.musiccatalog.application.service;

import com.example.musiccatalog.infrastructure.persistence.mapper.CatalogSchemaMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates the catalog tables. Safe to run against an initialised store.
 */
@Service
public class CatalogSchemaService {

    private static final Logger log = LoggerFactory.getLogger(CatalogSchemaService.class);

    private final CatalogSchemaMapper catalogSchemaMapper;
    private final StoreRetrier storeRetrier;

    public CatalogSchemaService(CatalogSchemaMapper catalogSchemaMapper, StoreRetrier storeRetrier) {
        this.catalogSchemaMapper = catalogSchemaMapper;
        this.storeRetrier = storeRetrier;
    }

    public void initStore() {
        storeRetrier.run("schema.scans", catalogSchemaMapper::createScansTable);
        storeRetrier.run("schema.file_data", catalogSchemaMapper::createFileDataTable);
        log.info("CATALOG_SCHEMA_READY tables=scans,file_data");
    }
}
