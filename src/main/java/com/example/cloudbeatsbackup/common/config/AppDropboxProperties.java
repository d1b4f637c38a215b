package com.example.cloudbeatsbackup.common.config;

import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.dropbox")
public class AppDropboxProperties {

    @NotBlank
    private String apiBaseUrl = "https://api.dropboxapi.com/2";

    @NotBlank
    private String tokenUrl = "https://api.dropboxapi.com/oauth2/token";

    @NotBlank
    private String authorizeUrl = "https://www.dropbox.com/oauth2/authorize";

    @Min(1)
    private int connectTimeoutMs = 10000;

    @Min(1)
    private int socketTimeoutMs = 30000;

    /**
     * First wait after a 429 without Retry-After; doubled on every further 429.
     */
    @Min(1)
    private long initialBackoffMs = 1000L;

    /**
     * Ceiling for any wait between two attempts, server-provided or computed.
     */
    @Min(1)
    private long maxBackoffMs = 60000L;

    /**
     * Locations of the desktop client's info.json, in lookup order. Empty means the platform defaults.
     */
    private List<String> infoFiles = new ArrayList<>();
}
