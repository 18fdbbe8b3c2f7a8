package com.example.musiccatalog.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.copy")
public class AppCopyProperties {

    /**
     * Emit a progress notification every N copied files.
     */
    private int progressInterval = 250;
}
