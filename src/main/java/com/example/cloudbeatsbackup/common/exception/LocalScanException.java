package com.example.cloudbeatsbackup.common.exception;

public class LocalScanException extends BackupException {

    public static final String CODE = "LOCAL_SCAN_FAILED";

    public LocalScanException(String message, Throwable cause) {
        super(CODE, message, "Check that the --local folder exists and is readable", cause);
    }
}
