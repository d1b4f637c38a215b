package com.example.cloudbeatsbackup.infrastructure.backup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.cloudbeatsbackup.common.exception.BackupException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupWriterTest {

    @TempDir
    Path dir;

    private final BackupWriter backupWriter = new BackupWriter(new ObjectMapper());

    @Test
    void shouldWriteItemsWithFixedKeyOrder() throws Exception {
        BackupItem full = BackupItem.builder()
                .accountId("dbid:1")
                .key("id:abc")
                .name("Song.MP3")
                .album("Album")
                .albumArtist("Band")
                .artist("Singer")
                .diskNumber(1)
                .durationSeconds(215.04)
                .genre("Rock")
                .title("Song")
                .trackNumber(3)
                .year(2001)
                .build();
        Path output = dir.resolve("out/cloudbeats.cbbackup");

        backupWriter.write(output, new BackupDocument(Collections.singletonList(full)));

        String json = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertEquals("{\"items\":[{\"account_id\":\"dbid:1\",\"key\":\"id:abc\",\"name\":\"Song.MP3\",\"path\":\"\","
                + "\"service\":\"dropbox\",\"tag_album\":\"Album\",\"tag_albumArtist\":\"Band\","
                + "\"tag_artist\":\"Singer\",\"tag_diskNumber\":1,\"tag_duration\":215.0,\"tag_genre\":\"Rock\","
                + "\"tag_name\":\"Song\",\"tag_trackNumber\":3,\"tag_year\":2001}],\"playlists\":[]}", json);
    }

    @Test
    void shouldOmitAbsentGenreAndTrackNumber() throws Exception {
        BackupItem bare = BackupItem.builder()
                .accountId("dbid:1")
                .key("id:x")
                .name("x.flac")
                .album("Unknown")
                .albumArtist("Unknown")
                .artist("Unknown")
                .diskNumber(1)
                .durationSeconds(0)
                .title("x")
                .build();
        Path output = dir.resolve("b.cbbackup");

        backupWriter.write(output, new BackupDocument(Arrays.asList(bare)));

        String json = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertEquals("{\"items\":[{\"account_id\":\"dbid:1\",\"key\":\"id:x\",\"name\":\"x.flac\",\"path\":\"\","
                + "\"service\":\"dropbox\",\"tag_album\":\"Unknown\",\"tag_albumArtist\":\"Unknown\","
                + "\"tag_artist\":\"Unknown\",\"tag_diskNumber\":1,\"tag_duration\":0.0,"
                + "\"tag_name\":\"x\",\"tag_year\":0}],\"playlists\":[]}", json);
    }

    @Test
    void shouldRoundDurationToOneDecimal() throws Exception {
        BackupItem item = BackupItem.builder().durationSeconds(183.46).build();
        Path output = dir.resolve("c.cbbackup");

        backupWriter.write(output, new BackupDocument(Collections.singletonList(item)));

        String json = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertEquals(true, json.contains("\"tag_duration\":183.5"));
    }

    @Test
    void shouldWriteEmptyDocument() throws Exception {
        Path output = dir.resolve("empty.cbbackup");

        backupWriter.write(output, new BackupDocument(Collections.emptyList()));

        assertEquals("{\"items\":[],\"playlists\":[]}",
                new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
    }

    @Test
    void shouldFailWhenTargetIsADirectory() throws Exception {
        Path output = Files.createDirectories(dir.resolve("taken"));

        assertThrows(BackupException.class,
                () -> backupWriter.write(output, new BackupDocument(Collections.emptyList())));
    }
}
