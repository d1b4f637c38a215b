package com.example.cloudbeatsbackup.infrastructure.credentials;

import com.example.cloudbeatsbackup.common.config.AppCacheProperties;
import com.example.cloudbeatsbackup.domain.model.Credentials;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores the refresh credential triple in the user config directory, readable by the owner only.
 */
@Component
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");

    private final ObjectMapper objectMapper;
    private final Path file;

    @Autowired
    public CredentialStore(ObjectMapper objectMapper, AppCacheProperties appCacheProperties) {
        this(objectMapper, appCacheProperties.resolvedCredentialsPath());
    }

    public CredentialStore(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return stored credentials, or empty if nothing has been saved yet
     */
    public Optional<Credentials> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Credentials credentials = objectMapper.readValue(file.toFile(), Credentials.class);
        return Optional.ofNullable(credentials);
    }

    public void save(Credentials credentials) throws IOException {
        Path target = file.toAbsolutePath();
        Path dir = target.getParent();
        boolean posix = supportsPosix(dir);
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            if (posix) {
                Files.setPosixFilePermissions(dir, DIRECTORY_PERMISSIONS);
            }
        }

        Path temp = Files.createTempFile(dir, "credentials-", ".tmp");
        try {
            if (posix) {
                Files.setPosixFilePermissions(temp, FILE_PERMISSIONS);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), credentials);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("CREDENTIALS_SAVED file={}", target);
    }

    private static boolean supportsPosix(Path dir) {
        Path probe = dir;
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        return (probe == null ? dir : probe).getFileSystem().supportedFileAttributeViews().contains("posix");
    }
}
