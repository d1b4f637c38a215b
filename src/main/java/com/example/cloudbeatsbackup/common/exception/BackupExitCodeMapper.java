package com.example.cloudbeatsbackup.common.exception;

import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * Process exit status for a failed run, derived from the first {@link BackupException} in the cause chain.
 */
@Component
public class BackupExitCodeMapper implements ExitCodeExceptionMapper {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_AUTH = 3;
    public static final int EXIT_REMOTE = 4;
    public static final int EXIT_LOCAL_SCAN = 5;
    public static final int EXIT_CANCELLED = 130;

    @Override
    public int getExitCode(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof BackupException) {
                return exitCodeFor((BackupException) current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return EXIT_FAILURE;
    }

    private int exitCodeFor(BackupException exception) {
        if (exception instanceof RunCancelledException) {
            return EXIT_CANCELLED;
        }
        if (exception instanceof ConfigurationException) {
            return EXIT_CONFIGURATION;
        }
        if (exception instanceof DropboxAuthException) {
            return EXIT_AUTH;
        }
        if (exception instanceof DropboxApiException) {
            return EXIT_REMOTE;
        }
        if (exception instanceof LocalScanException) {
            return EXIT_LOCAL_SCAN;
        }
        return EXIT_FAILURE;
    }
}
