package com.example.cloudbeatsbackup.infrastructure.cache;

import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persistent tag cache keyed by absolute file path and validated by file size and modification time.
 *
 * <p>A hit requires both values to equal the stored key exactly. This is a heuristic, not a content hash:
 * an edit that keeps the size and restores the modification time is served stale, and a touch without any
 * content change forces a re-parse.
 *
 * <p>{@link #lookup(Path)} may be called from many threads at once. {@link #store(Path, AudioMetadata)} and
 * {@link #save()} must only run on one thread after all lookups have finished.
 */
public class TagCache {

    private static final Logger log = LoggerFactory.getLogger(TagCache.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, CacheEntry> entries;
    private boolean dirty;

    private TagCache(Path file, ObjectMapper objectMapper, Map<String, CacheEntry> entries) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.entries = entries;
    }

    /**
     * Reads the cache at {@code file}. A missing, unreadable or corrupt file yields an empty cache.
     */
    public static TagCache load(Path file, ObjectMapper objectMapper) {
        if (!Files.exists(file)) {
            return new TagCache(file, objectMapper, new HashMap<>());
        }
        try {
            CacheFile stored = objectMapper.readValue(file.toFile(), CacheFile.class);
            if (stored == null || stored.getVersion() != CacheFile.CURRENT_VERSION || stored.getEntries() == null) {
                log.warn("TAG_CACHE_IGNORED file={} reason=unsupported format", file);
                return new TagCache(file, objectMapper, new HashMap<>());
            }
            Map<String, CacheEntry> entries = new HashMap<>();
            stored.getEntries().forEach((path, entry) -> {
                if (entry != null && entry.getKey() != null && entry.getMeta() != null) {
                    entries.put(path, entry);
                }
            });
            return new TagCache(file, objectMapper, entries);
        } catch (IOException e) {
            log.warn("TAG_CACHE_IGNORED file={} reason={}", file, e.getMessage());
            return new TagCache(file, objectMapper, new HashMap<>());
        }
    }

    public int size() {
        return entries.size();
    }

    public boolean isDirty() {
        return dirty;
    }

    public Optional<AudioMetadata> lookup(Path path) {
        CacheEntry entry = entries.get(cacheKey(path));
        if (entry == null) {
            return Optional.empty();
        }
        FileKey current = stat(path);
        if (current == null || !current.equals(entry.getKey())) {
            return Optional.empty();
        }
        return Optional.of(entry.getMeta());
    }

    public void store(Path path, AudioMetadata metadata) {
        FileKey current = stat(path);
        if (current == null) {
            log.debug("Not caching {}: file cannot be stat'd", path);
            return;
        }
        entries.put(cacheKey(path), new CacheEntry(current, metadata));
        dirty = true;
    }

    /**
     * Writes the cache if it changed since it was loaded or last saved.
     *
     * @return true if the file was written
     */
    public boolean save() throws IOException {
        if (!dirty) {
            return false;
        }
        Path target = file.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);

        Path temp = Files.createTempFile(dir, "tag-cache-", ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), new CacheFile(CacheFile.CURRENT_VERSION, entries));
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        dirty = false;
        log.debug("TAG_CACHE_SAVED file={} entries={}", target, entries.size());
        return true;
    }

    static FileKey stat(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileKey(attributes.size(), attributes.lastModifiedTime().to(TimeUnit.NANOSECONDS));
        } catch (IOException e) {
            return null;
        }
    }

    private static String cacheKey(Path path) {
        return path.toAbsolutePath().toString();
    }
}
