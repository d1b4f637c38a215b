package com.example.cloudbeatsbackup.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AudioMetadata {

    String title;

    String artist;

    String album;

    String albumArtist;

    String genre;

    int year;

    /**
     * Null when the file carries no track number.
     */
    Integer trackNumber;

    int diskNumber;

    double durationSeconds;
}
