package com.example.cloudbeatsbackup.infrastructure.backup;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Top level of a .cbbackup file. Playlists are not generated and always written as an empty array.
 */
@Data
@JsonPropertyOrder({"items", "playlists"})
@NoArgsConstructor
@AllArgsConstructor
public class BackupDocument {

    private List<BackupItem> items = new ArrayList<>();

    private List<Object> playlists = new ArrayList<>();

    public BackupDocument(List<BackupItem> items) {
        this(items, new ArrayList<>());
    }
}
