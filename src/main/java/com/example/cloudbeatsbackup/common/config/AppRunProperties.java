package com.example.cloudbeatsbackup.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-invocation options. Bound from command-line flags and DROPBOX_* environment variables
 * through the placeholders in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.run")
public class AppRunProperties {

    /**
     * Local folder to scan. Must be inside the Dropbox desktop folder.
     */
    private String local;

    private String output = "cloudbeats.cbbackup";

    /**
     * Short-lived access token used when no refresh credentials are available.
     */
    private String token;

    private String appKey;

    private String appSecret;

    private String refreshToken;

    /**
     * Show the Dropbox mapping without reading tags or writing a file.
     */
    private boolean dryRun;

    /**
     * Fall back to the interactive authorization flow when a console is attached.
     */
    private boolean interactiveSetup = true;

    /**
     * Seconds the shutdown hook waits for a cancelled run to persist its cache.
     */
    private int shutdownGraceSec = 30;
}
