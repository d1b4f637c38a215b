package com.example.cloudbeatsbackup.domain.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * Every scanned local file and every remote audio file lands in exactly one of the three lists.
 */
@Value
public class ReconciliationResult {

    List<MatchedFile> matched;

    List<Path> unmatchedLocal;

    List<RemoteEntry> unmatchedRemote;

    public ReconciliationResult(List<MatchedFile> matched, List<Path> unmatchedLocal, List<RemoteEntry> unmatchedRemote) {
        this.matched = Collections.unmodifiableList(matched);
        this.unmatchedLocal = Collections.unmodifiableList(unmatchedLocal);
        this.unmatchedRemote = Collections.unmodifiableList(unmatchedRemote);
    }
}
