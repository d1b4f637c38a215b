package com.example.cloudbeatsbackup.domain.model;

import java.nio.file.Path;
import lombok.Value;

@Value
public class MatchedFile {

    Path localPath;

    RemoteEntry remoteEntry;
}
