package com.example.cloudbeatsbackup.application.service;

import com.example.cloudbeatsbackup.domain.model.MatchedFile;
import com.example.cloudbeatsbackup.domain.model.ReconciliationResult;
import com.example.cloudbeatsbackup.domain.model.RemoteEntry;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pairs local files with remote entries by their path relative to the Dropbox root.
 *
 * <p>Keys on both sides are NFC-normalized and lower-cased, so "Café" stored decomposed on one side
 * matches "café" stored composed on the other.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final LocalScanService localScanService;

    public ReconciliationService(LocalScanService localScanService) {
        this.localScanService = localScanService;
    }

    /**
     * @param localRoot     folder the local files were scanned from
     * @param remotePrefix  Dropbox path of {@code localRoot}; "" for the Dropbox root
     * @param localFiles    scanned files, all below {@code localRoot}
     * @param remoteEntries remote file listing of {@code remotePrefix}
     */
    public ReconciliationResult match(Path localRoot, String remotePrefix,
                                      List<Path> localFiles, List<RemoteEntry> remoteEntries) {
        Map<String, RemoteEntry> index = new LinkedHashMap<>();
        for (RemoteEntry entry : remoteEntries) {
            String key = normalize(entry.getLowercasePath());
            RemoteEntry previous = index.put(key, entry);
            if (previous != null) {
                log.warn("REMOTE_PATH_COLLISION key={} kept={} dropped={}",
                        key, entry.getDisplayPath(), previous.getDisplayPath());
            }
        }

        String prefix = normalizePrefix(remotePrefix);
        Path base = localRoot.toAbsolutePath().normalize();

        List<MatchedFile> matched = new ArrayList<>();
        List<Path> unmatchedLocal = new ArrayList<>();
        for (Path localFile : localFiles) {
            String key = prefix + "/" + normalize(relativeKey(base, localFile));
            RemoteEntry entry = index.remove(key);
            if (entry != null) {
                matched.add(new MatchedFile(localFile, entry));
            } else {
                unmatchedLocal.add(localFile);
            }
        }

        List<RemoteEntry> unmatchedRemote = new ArrayList<>();
        for (RemoteEntry entry : index.values()) {
            if (localScanService.hasAudioExtension(entry.getName())) {
                unmatchedRemote.add(entry);
            }
        }

        log.info("RECONCILE_FINISH local={} remote={} matched={} unmatchedLocal={} unmatchedRemote={}",
                localFiles.size(), remoteEntries.size(), matched.size(), unmatchedLocal.size(), unmatchedRemote.size());
        return new ReconciliationResult(matched, unmatchedLocal, unmatchedRemote);
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return Normalizer.normalize(value, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
    }

    private static String normalizePrefix(String remotePrefix) {
        String prefix = normalize(remotePrefix);
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix;
    }

    private static String relativeKey(Path base, Path localFile) {
        Path relative = base.relativize(localFile.toAbsolutePath().normalize());
        StringBuilder key = new StringBuilder();
        for (Path part : relative) {
            if (key.length() > 0) {
                key.append('/');
            }
            key.append(part.toString());
        }
        return key.toString();
    }
}
