package com.example.cloudbeatsbackup.infrastructure.backup;

import com.example.cloudbeatsbackup.common.exception.BackupException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BackupWriter {

    private static final Logger log = LoggerFactory.getLogger(BackupWriter.class);

    public static final String CODE_WRITE_FAILED = "BACKUP_WRITE_FAILED";

    private final ObjectMapper objectMapper;

    public BackupWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes {@code document} as compact JSON, replacing any existing file.
     */
    public void write(Path output, BackupDocument document) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(output.toFile(), document);
        } catch (IOException e) {
            throw new BackupException(CODE_WRITE_FAILED, "writing " + output + " failed: " + e.getMessage(),
                    "Check that the --output location is writable", e);
        }
        log.info("BACKUP_WRITTEN file={} items={}", output, document.getItems().size());
    }
}
