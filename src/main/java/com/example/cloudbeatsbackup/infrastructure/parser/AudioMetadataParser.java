package com.example.cloudbeatsbackup.infrastructure.parser;

import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import java.nio.file.Path;

/**
 * Reads raw tags of one local audio file. Fields the file does not carry are left null or zero;
 * callers apply their own defaults.
 */
public interface AudioMetadataParser {

    AudioMetadata parse(Path audioFile) throws Exception;
}
