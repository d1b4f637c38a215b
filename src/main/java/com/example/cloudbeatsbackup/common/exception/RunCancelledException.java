package com.example.cloudbeatsbackup.common.exception;

public class RunCancelledException extends BackupException {

    public static final String CODE = "RUN_CANCELLED";

    public RunCancelledException(String message) {
        super(CODE, message);
    }
}
