package com.example.cloudbeatsbackup.application.service;

import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import java.nio.file.Path;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class MetadataFallbackService {

    static final String UNKNOWN = "Unknown";
    static final int DEFAULT_DISK_NUMBER = 1;

    /**
     * Fills every blank field of {@code input}. The title falls back to the file name without its extension.
     */
    public AudioMetadata applyFallback(AudioMetadata input, Path file) {
        AudioMetadata metadata = input == null ? AudioMetadata.builder().build() : input;

        return metadata.toBuilder()
                .title(firstText(metadata.getTitle(), extractFileBaseName(file)))
                .artist(firstText(metadata.getArtist(), UNKNOWN))
                .album(firstText(metadata.getAlbum(), UNKNOWN))
                .albumArtist(firstText(metadata.getAlbumArtist(), UNKNOWN))
                .genre(StringUtils.hasText(metadata.getGenre()) ? metadata.getGenre().trim() : null)
                .year(Math.max(0, metadata.getYear()))
                .trackNumber(metadata.getTrackNumber() != null && metadata.getTrackNumber() >= 0
                        ? metadata.getTrackNumber() : null)
                .diskNumber(metadata.getDiskNumber() > 0 ? metadata.getDiskNumber() : DEFAULT_DISK_NUMBER)
                .durationSeconds(Math.max(0d, metadata.getDurationSeconds()))
                .build();
    }

    /**
     * Metadata for a file whose tags could not be read at all.
     */
    public AudioMetadata defaults(Path file) {
        return applyFallback(null, file);
    }

    String extractFileBaseName(Path file) {
        if (file == null || file.getFileName() == null) {
            return UNKNOWN;
        }
        String filename = file.getFileName().toString();
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > 0) {
            filename = filename.substring(0, dotIndex);
        }
        return StringUtils.hasText(filename) ? filename : UNKNOWN;
    }

    private String firstText(String value, String fallback) {
        return StringUtils.hasText(value) ? value.trim() : fallback;
    }
}
