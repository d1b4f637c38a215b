package com.example.cloudbeatsbackup.infrastructure.backup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Builder;
import lombok.Value;

/**
 * One file entry of a CloudBeats backup.
 */
@Value
@Builder
@JsonPropertyOrder({"account_id", "key", "name", "path", "service", "tag_album", "tag_albumArtist", "tag_artist",
        "tag_diskNumber", "tag_duration", "tag_genre", "tag_name", "tag_trackNumber", "tag_year"})
public class BackupItem {

    public static final String SERVICE_DROPBOX = "dropbox";

    @JsonProperty("account_id")
    String accountId;

    /**
     * Dropbox file id, e.g. "id:abc123".
     */
    @JsonProperty("key")
    String key;

    @JsonProperty("name")
    String name;

    @Builder.Default
    @JsonProperty("path")
    String path = "";

    @Builder.Default
    @JsonProperty("service")
    String service = SERVICE_DROPBOX;

    @JsonProperty("tag_album")
    String album;

    @JsonProperty("tag_albumArtist")
    String albumArtist;

    @JsonProperty("tag_artist")
    String artist;

    @JsonProperty("tag_diskNumber")
    int diskNumber;

    @JsonProperty("tag_duration")
    @JsonSerialize(using = OneDecimalSerializer.class)
    double durationSeconds;

    @JsonProperty("tag_genre")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String genre;

    @JsonProperty("tag_name")
    String title;

    @JsonProperty("tag_trackNumber")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Integer trackNumber;

    @JsonProperty("tag_year")
    int year;
}
