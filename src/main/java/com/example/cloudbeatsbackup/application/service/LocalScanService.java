package com.example.cloudbeatsbackup.application.service;

import com.example.cloudbeatsbackup.common.config.AppScanProperties;
import com.example.cloudbeatsbackup.common.exception.LocalScanException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recursive walk of the local music folder. Symbolic links to directories are not followed.
 */
@Service
public class LocalScanService {

    private static final Logger log = LoggerFactory.getLogger(LocalScanService.class);

    private final Set<String> audioExtensions;

    public LocalScanService(AppScanProperties appScanProperties) {
        this.audioExtensions = appScanProperties.normalizedAudioExtensions();
    }

    /**
     * Returns every regular file below {@code root} with a recognized audio extension, sorted by path.
     *
     * @throws LocalScanException if the root is not a directory or any part of the tree cannot be read
     */
    public List<Path> scan(Path root) {
        if (!Files.isDirectory(root)) {
            throw new LocalScanException("local folder is not a directory: " + root, null);
        }
        long startNanos = System.nanoTime();
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk
                    .filter(path -> Files.isRegularFile(path))
                    .filter(this::isAudioFile)
                    .sorted()
                    .collect(Collectors.toList());
            log.info("LOCAL_SCAN_FINISH root={} audioFiles={} elapsedMs={}",
                    root, files.size(), (System.nanoTime() - startNanos) / 1_000_000L);
            return files;
        } catch (IOException e) {
            throw new LocalScanException("scanning " + root + " failed: " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new LocalScanException("scanning " + root + " failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    public boolean isAudioFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && hasAudioExtension(fileName.toString());
    }

    /**
     * Case-insensitive extension check on a bare file name.
     */
    public boolean hasAudioExtension(String fileName) {
        if (fileName == null) {
            return false;
        }
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return false;
        }
        return audioExtensions.contains(fileName.substring(dotIndex + 1).toLowerCase(Locale.ROOT));
    }
}
