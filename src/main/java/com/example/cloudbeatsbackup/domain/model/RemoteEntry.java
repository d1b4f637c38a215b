package com.example.cloudbeatsbackup.domain.model;

import lombok.Value;

@Value
public class RemoteEntry {

    RemoteEntryKind kind;

    String id;

    String name;

    /**
     * Dropbox path_lower; the identity key for matching.
     */
    String lowercasePath;

    String displayPath;
}
