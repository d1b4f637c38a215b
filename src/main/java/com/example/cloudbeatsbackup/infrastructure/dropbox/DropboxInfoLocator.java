package com.example.cloudbeatsbackup.infrastructure.dropbox;

import com.example.cloudbeatsbackup.common.config.AppDropboxProperties;
import com.example.cloudbeatsbackup.common.exception.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Finds the Dropbox desktop folder through the client's info.json and maps local folders to API paths.
 */
@Component
public class DropboxInfoLocator {

    private static final Logger log = LoggerFactory.getLogger(DropboxInfoLocator.class);

    private final ObjectMapper objectMapper;
    private final AppDropboxProperties properties;
    private final String userHome;

    public DropboxInfoLocator(ObjectMapper objectMapper, AppDropboxProperties properties) {
        this(objectMapper, properties, System.getProperty("user.home", "."));
    }

    DropboxInfoLocator(ObjectMapper objectMapper, AppDropboxProperties properties, String userHome) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.userHome = userHome;
    }

    public Path detectRootPath() {
        List<Path> candidates = candidates();
        for (Path candidate : candidates) {
            try {
                Optional<Path> root = readInfoFile(candidate);
                if (root.isPresent()) {
                    log.debug("DROPBOX_INFO_FOUND file={} root={}", candidate, root.get());
                    return root.get();
                }
            } catch (IOException e) {
                log.debug("Skipping unreadable Dropbox info file {}: {}", candidate, e.getMessage());
            }
        }
        throw new ConfigurationException(
                "Dropbox Desktop does not appear to be installed (checked " + candidates + ")",
                "Verify that Dropbox Desktop is installed and that its info.json exists");
    }

    /**
     * Dropbox API path of a local folder: "" for the Dropbox root itself, otherwise "/a/b".
     * Both paths are resolved to their real location first so symlinked folders compare equal.
     */
    public String computeRemotePath(Path localDir, Path dropboxRoot) {
        Path local = toRealPath(localDir, "local path");
        Path root = toRealPath(dropboxRoot, "Dropbox root");

        if (local.equals(root)) {
            return "";
        }
        if (!local.startsWith(root)) {
            throw new ConfigurationException(
                    "the --local folder (" + localDir + ") is not located inside the Dropbox folder (" + dropboxRoot + ")",
                    "Verify the path");
        }

        StringBuilder remote = new StringBuilder();
        for (Path segment : root.relativize(local)) {
            remote.append('/').append(segment.toString());
        }
        return remote.toString();
    }

    List<Path> candidates() {
        List<Path> candidates = new ArrayList<>();
        if (properties.getInfoFiles() != null) {
            for (String configured : properties.getInfoFiles()) {
                if (StringUtils.hasText(configured)) {
                    candidates.add(expandHome(configured.trim()));
                }
            }
        }
        if (candidates.isEmpty()) {
            candidates.add(Paths.get(userHome, ".dropbox", "info.json"));
            candidates.add(Paths.get(userHome, "Library", "Application Support", "Dropbox", "info.json"));
        }
        return candidates;
    }

    private Optional<Path> readInfoFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        JsonNode info = objectMapper.readTree(file.toFile());
        for (String account : new String[]{"personal", "business"}) {
            String path = info.path(account).path("path").asText("");
            if (StringUtils.hasText(path)) {
                return Optional.of(Paths.get(path));
            }
        }
        log.debug("No personal or business path in {}", file);
        return Optional.empty();
    }

    private Path expandHome(String path) {
        if (path.equals("~")) {
            return Paths.get(userHome);
        }
        if (path.startsWith("~/")) {
            return Paths.get(userHome, path.substring(2));
        }
        return Paths.get(path);
    }

    private Path toRealPath(Path path, String label) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new ConfigurationException("resolving " + label + " " + path + " failed: " + e.getMessage(),
                    "Check that the folder exists", e);
        }
    }
}
