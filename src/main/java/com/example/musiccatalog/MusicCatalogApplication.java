package com.example.musiccatalog;

import com.example.musiccatalog.common.config.AppCopyProperties;
import com.example.musiccatalog.common.config.AppScanProperties;
import com.example.musiccatalog.common.config.AppStoreProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.musiccatalog.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppScanProperties.class,
        AppCopyProperties.class,
        AppStoreProperties.class
})
public class MusicCatalogApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MusicCatalogApplication.class, args)));
    }
}
