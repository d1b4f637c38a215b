package com.example.cloudbeatsbackup.application.service;

import com.example.cloudbeatsbackup.common.config.AppCacheProperties;
import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.config.AppScanProperties;
import com.example.cloudbeatsbackup.common.exception.ConfigurationException;
import com.example.cloudbeatsbackup.common.exception.RunCancelledException;
import com.example.cloudbeatsbackup.common.exception.TagExtractionException;
import com.example.cloudbeatsbackup.common.util.RunCancellation;
import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import com.example.cloudbeatsbackup.domain.model.BackupRunReport;
import com.example.cloudbeatsbackup.domain.model.MatchedFile;
import com.example.cloudbeatsbackup.domain.model.ReconciliationResult;
import com.example.cloudbeatsbackup.domain.model.RemoteEntry;
import com.example.cloudbeatsbackup.infrastructure.backup.BackupDocument;
import com.example.cloudbeatsbackup.infrastructure.backup.BackupItem;
import com.example.cloudbeatsbackup.infrastructure.backup.BackupWriter;
import com.example.cloudbeatsbackup.infrastructure.cache.TagCache;
import com.example.cloudbeatsbackup.infrastructure.dropbox.DropboxClient;
import com.example.cloudbeatsbackup.infrastructure.dropbox.DropboxClientFactory;
import com.example.cloudbeatsbackup.infrastructure.dropbox.DropboxInfoLocator;
import com.example.cloudbeatsbackup.infrastructure.parser.AudioMetadataParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * One backup run: maps the local folder onto Dropbox, matches files, reads tags through the cache and
 * writes the backup file.
 */
@Service
public class BackupGenerationService {

    private static final Logger log = LoggerFactory.getLogger(BackupGenerationService.class);

    private final DropboxClientFactory dropboxClientFactory;
    private final DropboxInfoLocator dropboxInfoLocator;
    private final LocalScanService localScanService;
    private final ReconciliationService reconciliationService;
    private final WorkerPool workerPool;
    private final AudioMetadataParser audioMetadataParser;
    private final MetadataFallbackService metadataFallbackService;
    private final BackupWriter backupWriter;
    private final ObjectMapper objectMapper;
    private final AppScanProperties appScanProperties;
    private final AppCacheProperties appCacheProperties;
    private final RunCancellation cancellation;
    private final MeterRegistry meterRegistry;

    public BackupGenerationService(DropboxClientFactory dropboxClientFactory,
                                   DropboxInfoLocator dropboxInfoLocator,
                                   LocalScanService localScanService,
                                   ReconciliationService reconciliationService,
                                   WorkerPool workerPool,
                                   AudioMetadataParser audioMetadataParser,
                                   MetadataFallbackService metadataFallbackService,
                                   BackupWriter backupWriter,
                                   ObjectMapper objectMapper,
                                   AppScanProperties appScanProperties,
                                   AppCacheProperties appCacheProperties,
                                   RunCancellation cancellation,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.dropboxClientFactory = dropboxClientFactory;
        this.dropboxInfoLocator = dropboxInfoLocator;
        this.localScanService = localScanService;
        this.reconciliationService = reconciliationService;
        this.workerPool = workerPool;
        this.audioMetadataParser = audioMetadataParser;
        this.metadataFallbackService = metadataFallbackService;
        this.backupWriter = backupWriter;
        this.objectMapper = objectMapper;
        this.appScanProperties = appScanProperties;
        this.appCacheProperties = appCacheProperties;
        this.cancellation = cancellation;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public BackupRunReport generate(String accessToken, AppRunProperties options) {
        long startNanos = System.nanoTime();
        String metricStatus = "SUCCESS";
        try {
            BackupRunReport report = doGenerate(accessToken, options);
            if (report.isDryRun()) {
                metricStatus = "DRY_RUN";
            }
            return report;
        } catch (RunCancelledException e) {
            metricStatus = "CANCELLED";
            throw e;
        } catch (RuntimeException e) {
            metricStatus = "FAILED";
            throw e;
        } finally {
            recordDuration("backup.run.duration", System.nanoTime() - startNanos, "status", metricStatus);
        }
    }

    private BackupRunReport doGenerate(String accessToken, AppRunProperties options) {
        Path localDir = requireLocalDir(options);
        BackupRunReport report = new BackupRunReport();
        report.setDryRun(options.isDryRun());

        DropboxClient client = dropboxClientFactory.create(accessToken);
        String accountId = client.getAccountId();
        report.setAccountId(accountId);

        Path dropboxRoot = dropboxInfoLocator.detectRootPath();
        String remotePath = dropboxInfoLocator.computeRemotePath(localDir, dropboxRoot);
        report.setRemotePath(remotePath);
        log.info("BACKUP_RUN_START account={} local={} dropboxRoot={} remote={} dryRun={}",
                accountId, localDir, dropboxRoot, remotePath.isEmpty() ? "/" : remotePath, options.isDryRun());

        List<Path> localFiles = localScanService.scan(localDir);
        checkCancelled("local scan");
        List<RemoteEntry> remoteFiles = client.listFolder(remotePath);
        checkCancelled("remote listing");

        ReconciliationResult reconciliation =
                reconciliationService.match(localDir, remotePath, localFiles, remoteFiles);
        report.setLocalFiles(localFiles.size());
        report.setRemoteFiles(remoteFiles.size());
        report.setMatched(reconciliation.getMatched().size());
        report.setUnmatchedLocal(reconciliation.getUnmatchedLocal().size());
        report.setUnmatchedRemote(reconciliation.getUnmatchedRemote().size());
        logUnmatched(reconciliation);

        if (options.isDryRun()) {
            log.info("BACKUP_DRY_RUN account={} remote={} matched={} unmatchedLocal={} unmatchedRemote={} "
                            + "- no tags read, no file written",
                    accountId, remotePath.isEmpty() ? "/" : remotePath, report.getMatched(),
                    report.getUnmatchedLocal(), report.getUnmatchedRemote());
            return report;
        }

        List<MatchedFile> matched = reconciliation.getMatched();
        TagCache cache = openCache();
        int workers = appScanProperties.effectiveWorkers();
        log.info("TAG_READ_START files={} workers={} cacheEntries={}",
                matched.size(), workers, cache == null ? 0 : cache.size());

        PoolResult<TagReadOutcome> pool = workerPool.process(
                matched,
                workers,
                file -> readTags(file.getLocalPath(), cache),
                new ExtractionProgressReporter(appScanProperties.getProgressLogStepPct()),
                cancellation);

        List<AudioMetadata> metadata = new ArrayList<>(matched.size());
        for (int i = 0; i < matched.size(); i++) {
            Path localPath = matched.get(i).getLocalPath();
            if (!pool.isAttempted(i)) {
                metadata.add(null);
                continue;
            }
            Throwable error = pool.getErrors().get(i);
            if (error != null) {
                report.setFailed(report.getFailed() + 1);
                log.warn("TAG_READ_FAILED file={} reason={} - using defaults", localPath, error.getMessage());
                log.debug("Tag read failure detail for {}", localPath, error);
                metadata.add(metadataFallbackService.defaults(localPath));
                continue;
            }
            TagReadOutcome outcome = pool.getResults().get(i);
            if (outcome.isFromCache()) {
                report.setCacheHits(report.getCacheHits() + 1);
            } else {
                report.setParsed(report.getParsed() + 1);
                if (cache != null) {
                    cache.store(localPath, outcome.getMetadata());
                }
            }
            metadata.add(outcome.getMetadata());
        }
        incrementCounter("backup.tags.cache.hit", report.getCacheHits());
        incrementCounter("backup.tags.parsed", report.getParsed());
        incrementCounter("backup.tags.failed", report.getFailed());
        saveCache(cache);

        if (pool.isCancelled() || cancellation.isCancelled()) {
            throw new RunCancelledException("run cancelled after reading tags of " + pool.attemptedCount()
                    + " of " + matched.size() + " files; no backup written");
        }
        if (report.getFailed() > 0) {
            log.warn("TAG_READ_FAILURES count={} - those files were written with default tags", report.getFailed());
        }

        List<BackupItem> items = new ArrayList<>(matched.size());
        for (int i = 0; i < matched.size(); i++) {
            items.add(toItem(accountId, matched.get(i).getRemoteEntry(), metadata.get(i)));
        }
        Path output = Paths.get(StringUtils.hasText(options.getOutput()) ? options.getOutput().trim()
                : "cloudbeats.cbbackup");
        backupWriter.write(output, new BackupDocument(items));
        report.setItemsWritten(items.size());

        log.info("BACKUP_RUN_FINISH output={} items={} cacheHits={} parsed={} failed={} "
                        + "unmatchedLocal={} unmatchedRemote={}",
                output, items.size(), report.getCacheHits(), report.getParsed(), report.getFailed(),
                report.getUnmatchedLocal(), report.getUnmatchedRemote());
        return report;
    }

    private TagReadOutcome readTags(Path localPath, TagCache cache) {
        if (cache != null) {
            Optional<AudioMetadata> cached = cache.lookup(localPath);
            if (cached.isPresent()) {
                return new TagReadOutcome(cached.get(), true);
            }
        }
        AudioMetadata parsed;
        try {
            parsed = audioMetadataParser.parse(localPath);
        } catch (Exception e) {
            throw new TagExtractionException(localPath, e);
        }
        return new TagReadOutcome(metadataFallbackService.applyFallback(parsed, localPath), false);
    }

    private BackupItem toItem(String accountId, RemoteEntry entry, AudioMetadata metadata) {
        return BackupItem.builder()
                .accountId(accountId)
                .key(entry.getId())
                .name(entry.getName())
                .album(metadata.getAlbum())
                .albumArtist(metadata.getAlbumArtist())
                .artist(metadata.getArtist())
                .diskNumber(metadata.getDiskNumber())
                .durationSeconds(metadata.getDurationSeconds())
                .genre(metadata.getGenre())
                .title(metadata.getTitle())
                .trackNumber(metadata.getTrackNumber())
                .year(metadata.getYear())
                .build();
    }

    private Path requireLocalDir(AppRunProperties options) {
        if (!StringUtils.hasText(options.getLocal())) {
            throw new ConfigurationException("no local folder given",
                    "Pass --local=<folder inside your Dropbox folder>");
        }
        Path localDir = Paths.get(options.getLocal().trim()).toAbsolutePath().normalize();
        if (!Files.isDirectory(localDir)) {
            throw new ConfigurationException("local folder does not exist: " + localDir,
                    "Pass --local=<folder inside your Dropbox folder>");
        }
        return localDir;
    }

    private TagCache openCache() {
        if (!appCacheProperties.isEnabled()) {
            log.info("TAG_CACHE_DISABLED");
            return null;
        }
        return TagCache.load(appCacheProperties.resolvedPath(), objectMapper);
    }

    private void saveCache(TagCache cache) {
        if (cache == null) {
            return;
        }
        try {
            cache.save();
        } catch (IOException e) {
            log.warn("TAG_CACHE_SAVE_FAILED file={} reason={}", appCacheProperties.resolvedPath(), e.getMessage());
        }
    }

    private void checkCancelled(String stage) {
        if (cancellation.isCancelled()) {
            throw new RunCancelledException("run cancelled after " + stage);
        }
    }

    private void logUnmatched(ReconciliationResult reconciliation) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (Path path : reconciliation.getUnmatchedLocal()) {
            log.debug("UNMATCHED_LOCAL {}", path);
        }
        for (RemoteEntry entry : reconciliation.getUnmatchedRemote()) {
            log.debug("UNMATCHED_REMOTE {}", entry.getDisplayPath());
        }
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }

    static final class TagReadOutcome {

        private final AudioMetadata metadata;
        private final boolean fromCache;

        TagReadOutcome(AudioMetadata metadata, boolean fromCache) {
            this.metadata = metadata;
            this.fromCache = fromCache;
        }

        AudioMetadata getMetadata() {
            return metadata;
        }

        boolean isFromCache() {
            return fromCache;
        }
    }
}
