package com.example.cloudbeatsbackup.application.runner;

import com.example.cloudbeatsbackup.application.service.BackupGenerationService;
import com.example.cloudbeatsbackup.application.service.InteractiveSetupService;
import com.example.cloudbeatsbackup.application.service.TokenResolutionService;
import com.example.cloudbeatsbackup.common.config.AppCacheProperties;
import com.example.cloudbeatsbackup.common.config.AppRunProperties;
import com.example.cloudbeatsbackup.common.exception.BackupException;
import com.example.cloudbeatsbackup.common.exception.BackupExitCodeMapper;
import com.example.cloudbeatsbackup.common.util.RunCancellation;
import com.example.cloudbeatsbackup.domain.model.BackupRunReport;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Command-line entry: resolves a Dropbox token, runs one backup and records the exit status.
 *
 * <p>Boolean switches ({@code --dry-run}, {@code --no-cache}) are read from the raw arguments; value options
 * reach {@link AppRunProperties} through application.yml.
 */
@Component
public class BackupCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BackupCommandRunner.class);

    private final AppRunProperties appRunProperties;
    private final AppCacheProperties appCacheProperties;
    private final TokenResolutionService tokenResolutionService;
    private final InteractiveSetupService interactiveSetupService;
    private final BackupGenerationService backupGenerationService;
    private final BackupExitCodeMapper exitCodeMapper;
    private final RunCancellation cancellation;

    private volatile int exitCode = BackupExitCodeMapper.EXIT_OK;

    public BackupCommandRunner(AppRunProperties appRunProperties,
                               AppCacheProperties appCacheProperties,
                               TokenResolutionService tokenResolutionService,
                               InteractiveSetupService interactiveSetupService,
                               BackupGenerationService backupGenerationService,
                               BackupExitCodeMapper exitCodeMapper,
                               RunCancellation cancellation) {
        this.appRunProperties = appRunProperties;
        this.appCacheProperties = appCacheProperties;
        this.tokenResolutionService = tokenResolutionService;
        this.interactiveSetupService = interactiveSetupService;
        this.backupGenerationService = backupGenerationService;
        this.exitCodeMapper = exitCodeMapper;
        this.cancellation = cancellation;
    }

    @Override
    public void run(ApplicationArguments args) {
        applySwitches(args);

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> onShutdown(finished), "backup-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            String accessToken = resolveAccessToken();
            BackupRunReport report = backupGenerationService.generate(accessToken, appRunProperties);
            printSummary(report);
            exitCode = BackupExitCodeMapper.EXIT_OK;
        } catch (BackupException e) {
            exitCode = exitCodeMapper.getExitCode(e);
            log.error("BACKUP_RUN_FAILED code={} message={}", e.getCode(), e.getMessage());
            if (StringUtils.hasText(e.getUserAction())) {
                log.error("  -> {}", e.getUserAction());
            }
            log.debug("Failure detail", e);
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void applySwitches(ApplicationArguments args) {
        if (args.containsOption("dry-run") && !isFalse(args, "dry-run")) {
            appRunProperties.setDryRun(true);
        }
        if (args.containsOption("no-cache") && !isFalse(args, "no-cache")) {
            appCacheProperties.setEnabled(false);
        }
    }

    private String resolveAccessToken() {
        if (!tokenResolutionService.hasCredentials(appRunProperties)
                && appRunProperties.isInteractiveSetup()
                && interactiveSetupService.isAvailable()) {
            return interactiveSetupService.run(appRunProperties).getAccessToken();
        }
        return tokenResolutionService.resolve(appRunProperties);
    }

    private void printSummary(BackupRunReport report) {
        String remote = StringUtils.hasText(report.getRemotePath()) ? report.getRemotePath() : "/";
        if (report.isDryRun()) {
            log.info("Dry run: {} -> Dropbox:{} | local={} remote={} matched={} unmatchedLocal={} unmatchedRemote={}",
                    appRunProperties.getLocal(), remote, report.getLocalFiles(), report.getRemoteFiles(),
                    report.getMatched(), report.getUnmatchedLocal(), report.getUnmatchedRemote());
            return;
        }
        log.info("Wrote {} items to {} (cache hits {}, parsed {}, failed {})",
                report.getItemsWritten(), appRunProperties.getOutput(),
                report.getCacheHits(), report.getParsed(), report.getFailed());
    }

    private void onShutdown(CountDownLatch finished) {
        if (finished.getCount() == 0) {
            return;
        }
        cancellation.cancel();
        try {
            if (!finished.await(Math.max(0, appRunProperties.getShutdownGraceSec()), TimeUnit.SECONDS)) {
                log.warn("RUN_SHUTDOWN_TIMEOUT graceSec={}", appRunProperties.getShutdownGraceSec());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running.
            log.trace("Shutdown in progress, hook stays registered");
        }
    }

    private static boolean isFalse(ApplicationArguments args, String option) {
        return args.getOptionValues(option).stream().anyMatch("false"::equalsIgnoreCase);
    }
}
