package com.example.cloudbeatsbackup.common.config;

import com.example.cloudbeatsbackup.common.util.UserDirectories;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.cache")
public class AppCacheProperties {

    private boolean enabled = true;

    /**
     * Tag cache file. Blank means &lt;user cache dir&gt;/cloudbeats-backup-generator/cache.json.
     */
    private String path;

    /**
     * Stored OAuth credentials. Blank means &lt;user config dir&gt;/cloudbeats-backup-generator/credentials.json.
     */
    private String credentialsPath;

    public Path resolvedPath() {
        if (path != null && !path.trim().isEmpty()) {
            return Paths.get(path.trim());
        }
        return UserDirectories.cacheDir().resolve(UserDirectories.APP_DIR).resolve("cache.json");
    }

    public Path resolvedCredentialsPath() {
        if (credentialsPath != null && !credentialsPath.trim().isEmpty()) {
            return Paths.get(credentialsPath.trim());
        }
        return UserDirectories.configDir().resolve(UserDirectories.APP_DIR).resolve("credentials.json");
    }
}
