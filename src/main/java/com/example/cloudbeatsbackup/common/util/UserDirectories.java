package com.example.cloudbeatsbackup.common.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Per-user cache and config directories following the platform conventions
 * (XDG on Linux, ~/Library on macOS, %LOCALAPPDATA% / %APPDATA% on Windows).
 */
public final class UserDirectories {

    public static final String APP_DIR = "cloudbeats-backup-generator";

    private UserDirectories() {
    }

    public static Path cacheDir() {
        return cacheDir(System.getProperty("os.name", ""), System.getProperty("user.home", "."), System.getenv());
    }

    public static Path configDir() {
        return configDir(System.getProperty("os.name", ""), System.getProperty("user.home", "."), System.getenv());
    }

    static Path cacheDir(String osName, String home, Map<String, String> env) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return Paths.get(home, "Library", "Caches");
        }
        if (os.contains("win")) {
            String localAppData = env.get("LOCALAPPDATA");
            if (hasText(localAppData)) {
                return Paths.get(localAppData);
            }
            return Paths.get(System.getProperty("java.io.tmpdir"));
        }
        String xdg = env.get("XDG_CACHE_HOME");
        return hasText(xdg) ? Paths.get(xdg) : Paths.get(home, ".cache");
    }

    static Path configDir(String osName, String home, Map<String, String> env) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return Paths.get(home, "Library", "Application Support");
        }
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            return hasText(appData) ? Paths.get(appData) : Paths.get(home, "AppData", "Roaming");
        }
        String xdg = env.get("XDG_CONFIG_HOME");
        return hasText(xdg) ? Paths.get(xdg) : Paths.get(home, ".config");
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
