package com.example.cloudbeatsbackup.domain.model;

import lombok.Data;

@Data
public class BackupRunReport {

    private String accountId;

    private String remotePath;

    private int localFiles;

    private int remoteFiles;

    private int matched;

    private int unmatchedLocal;

    private int unmatchedRemote;

    private int cacheHits;

    private int parsed;

    private int failed;

    private int itemsWritten;

    private boolean dryRun;
}
