package com.example.musiccatalog.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.store")
public class AppStoreProperties {

    /**
     * Attempts per store call when the failure is transient (connection loss, deadlock).
     */
    private int maxRetry = 3;

    private long retryBackoffMs = 500;
}
