package com.example.cloudbeatsbackup.infrastructure.parser;

import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private static final Logger log = LoggerFactory.getLogger(JaudiotaggerAudioMetadataParser.class);

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");
    private static final Pattern YEAR_PATTERN = Pattern.compile("^(\\d{4})");

    @Override
    public AudioMetadata parse(Path audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile.toFile());
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        Integer diskNumber = parseInteger(safeTagValue(tag, FieldKey.DISC_NO));
        AudioMetadata.AudioMetadataBuilder metadata = AudioMetadata.builder()
                .title(safeTagValue(tag, FieldKey.TITLE))
                .artist(safeTagValue(tag, FieldKey.ARTIST))
                .album(safeTagValue(tag, FieldKey.ALBUM))
                .albumArtist(safeTagValue(tag, FieldKey.ALBUM_ARTIST))
                .genre(safeTagValue(tag, FieldKey.GENRE))
                .year(parseYear(safeTagValue(tag, FieldKey.YEAR)))
                .trackNumber(parseInteger(safeTagValue(tag, FieldKey.TRACK)))
                .diskNumber(diskNumber == null ? 0 : diskNumber);

        if (header != null) {
            metadata.durationSeconds(header.getPreciseTrackLength());
        }
        return metadata.build();
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (RuntimeException e) {
            // Some tag formats reject keys they do not map.
            log.trace("Tag field {} unavailable: {}", fieldKey, e.getMessage());
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Leading number of values such as "3", "3/12" or " 5 / 10 ".
     */
    static Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Year from "2023" or a full ISO date such as "2023-05-15"; 0 when there is no leading four-digit year.
     */
    static int parseYear(String raw) {
        if (raw == null) {
            return 0;
        }
        Matcher matcher = YEAR_PATTERN.matcher(raw.trim());
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
    }
}
