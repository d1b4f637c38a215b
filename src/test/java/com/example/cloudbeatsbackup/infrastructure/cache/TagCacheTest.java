package com.example.cloudbeatsbackup.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TagCacheTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Path cacheFile;
    private Path song;

    @BeforeEach
    void setUp() throws Exception {
        cacheFile = dir.resolve("cache/cache.json");
        song = dir.resolve("song.mp3");
        Files.write(song, new byte[]{1, 2, 3, 4});
        Files.setLastModifiedTime(song, FileTime.from(Instant.parse("2024-03-01T10:15:30.123456789Z")));
    }

    @Test
    void shouldServeStoredMetadataAfterReload() throws Exception {
        TagCache cache = TagCache.load(cacheFile, objectMapper);
        cache.store(song, sample());
        assertTrue(cache.save());

        TagCache reloaded = TagCache.load(cacheFile, objectMapper);
        Optional<AudioMetadata> hit = reloaded.lookup(song);

        assertEquals(1, reloaded.size());
        assertTrue(hit.isPresent());
        assertEquals(sample(), hit.get());
        assertEquals(Integer.valueOf(3), hit.get().getTrackNumber());
    }

    @Test
    void shouldMissWhenSizeChanged() throws Exception {
        TagCache cache = TagCache.load(cacheFile, objectMapper);
        cache.store(song, sample());
        FileTime mtime = Files.getLastModifiedTime(song);

        Files.write(song, new byte[]{1, 2, 3, 4, 5});
        Files.setLastModifiedTime(song, mtime);

        assertFalse(cache.lookup(song).isPresent());
    }

    @Test
    void shouldMissWhenModificationTimeChanged() throws Exception {
        TagCache cache = TagCache.load(cacheFile, objectMapper);
        cache.store(song, sample());

        Files.setLastModifiedTime(song, FileTime.from(Instant.parse("2024-03-02T10:15:30Z")));

        assertFalse(cache.lookup(song).isPresent());
    }

    @Test
    void shouldMissForUnknownOrDeletedFile() throws Exception {
        TagCache cache = TagCache.load(cacheFile, objectMapper);
        assertFalse(cache.lookup(song).isPresent());

        cache.store(song, sample());
        Files.delete(song);

        assertFalse(cache.lookup(song).isPresent());
    }

    @Test
    void shouldSkipStoreWhenFileCannotBeStatted() {
        TagCache cache = TagCache.load(cacheFile, objectMapper);

        cache.store(dir.resolve("gone.mp3"), sample());

        assertEquals(0, cache.size());
        assertFalse(cache.isDirty());
    }

    @Test
    void saveShouldWriteOnlyWhenDirty() throws Exception {
        TagCache cache = TagCache.load(cacheFile, objectMapper);

        assertFalse(cache.save());
        assertFalse(Files.exists(cacheFile));

        cache.store(song, sample());
        assertTrue(cache.isDirty());
        assertTrue(cache.save());
        assertFalse(cache.isDirty());
        assertFalse(cache.save());
    }

    @Test
    void shouldStartEmptyWhenFileIsCorrupt() throws Exception {
        Files.createDirectories(cacheFile.getParent());
        Files.write(cacheFile, "{not json".getBytes(StandardCharsets.UTF_8));

        TagCache cache = TagCache.load(cacheFile, objectMapper);

        assertEquals(0, cache.size());
        assertFalse(cache.lookup(song).isPresent());
    }

    @Test
    void shouldStartEmptyForUnknownFormatVersion() throws Exception {
        Files.createDirectories(cacheFile.getParent());
        Files.write(cacheFile, "{\"version\":99,\"entries\":{}}".getBytes(StandardCharsets.UTF_8));

        assertEquals(0, TagCache.load(cacheFile, objectMapper).size());
    }

    @Test
    void shouldPersistNanosecondValidityKey() throws Exception {
        TagCache cache = TagCache.load(cacheFile, objectMapper);
        cache.store(song, sample());
        cache.save();

        CacheFile stored = objectMapper.readValue(cacheFile.toFile(), CacheFile.class);
        CacheEntry entry = stored.getEntries().get(song.toAbsolutePath().toString());

        assertEquals(4L, entry.getKey().getSize());
        assertEquals(TagCache.stat(song).getModTime(), entry.getKey().getModTime());
    }

    private static AudioMetadata sample() {
        return AudioMetadata.builder()
                .title("Blue in Green")
                .artist("Miles Davis")
                .album("Kind of Blue")
                .albumArtist("Miles Davis")
                .genre("Jazz")
                .year(1959)
                .trackNumber(3)
                .diskNumber(1)
                .durationSeconds(337.5)
                .build();
    }
}
