package com.example.cloudbeatsbackup.common.exception;

public class BackupException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BackupException(String code, String message) {
        this(code, message, null, null);
    }

    public BackupException(String code, String message, String userAction) {
        this(code, message, userAction, null);
    }

    public BackupException(String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = userAction;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
